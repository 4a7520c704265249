package com.questrail.startline.internal.timeline;

import com.questrail.startline.model.FleetStartEntry;
import com.questrail.startline.model.SequenceProfile;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Countdown to the start gun for a fleet that has had its warning signal.
 *
 * <p>Derived from the actual warning time only; it does not look at the
 * fleet's status, so a late preparatory signal does not stall the count.</p>
 */
public final class SequenceCountdown
{
    private static final Duration DEFAULT_FINAL_WINDOW = Duration.ofMinutes(1);

    /**
     * Which signal the fleet is counting down towards.
     */
    public enum Phase {
        /** Counting down to the preparatory signal (or to the final minute if there is none). */
        WARNING,
        /** Counting down to the one-minute signal. */
        PREPARATORY,
        /** Final minute. */
        FINAL,
        /** Start time reached. */
        START
    }

    /**
     * @param entryId          the fleet entry
     * @param phase            current phase
     * @param secondsRemaining seconds until the start, never negative
     * @param totalSeconds     sequence length in seconds
     */
    public record Countdown(String entryId, Phase phase, long secondsRemaining, long totalSeconds) {}

    private SequenceCountdown() {}

    /**
     * Computes the countdown, or empty if the fleet has not been warned.
     */
    public static Optional<Countdown> of(FleetStartEntry entry, SequenceProfile profile, Instant now) {
        Objects.requireNonNull(entry, "entry");
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(now, "now");

        Optional<Instant> warning = entry.actualWarningTime();
        if (warning.isEmpty()) {
            return Optional.empty();
        }

        long totalSeconds = profile.warningOffset().toSeconds();
        long elapsedSeconds = Math.floorDiv(Duration.between(warning.get(), now).toMillis(), 1000L);

        if (elapsedSeconds >= totalSeconds) {
            return Optional.of(new Countdown(entry.id(), Phase.START, 0, totalSeconds));
        }

        long remaining = totalSeconds - Math.max(0, elapsedSeconds);

        Phase phase = Phase.WARNING;
        Optional<Duration> prep = profile.prepOffset();
        if (prep.isPresent() && remaining <= prep.get().toSeconds()) {
            phase = Phase.PREPARATORY;
        }
        Duration finalWindow = profile.oneMinuteOffset().orElse(DEFAULT_FINAL_WINDOW);
        if (remaining <= finalWindow.toSeconds()) {
            phase = Phase.FINAL;
        }
        return Optional.of(new Countdown(entry.id(), phase, remaining, totalSeconds));
    }
}
