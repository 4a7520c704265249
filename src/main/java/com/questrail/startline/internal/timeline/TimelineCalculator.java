package com.questrail.startline.internal.timeline;

import com.questrail.startline.model.FleetStartEntry;
import com.questrail.startline.model.FleetStartStatus;
import com.questrail.startline.model.SequenceProfile;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * TimelineCalculator
 * -----------------------------------------------------------------------------
 * Pure planner for the rolling start chain.
 *
 * <h2>Rules</h2>
 * Entries are walked in start order while tracking the latest start time seen
 * so far (the <em>anchor</em>):
 * <ul>
 *   <li>STARTED entries anchor on their actual start.</li>
 *   <li>Entries mid-sequence anchor on actual warning + sequence length.</li>
 *   <li>POSTPONED, ABANDONED and GENERAL_RECALL entries are passed over; the
 *       next pending fleet takes their slot.</li>
 *   <li>The first PENDING entry with no anchor warns at the schedule's first
 *       warning time.</li>
 *   <li>Every later PENDING entry warns one gap after the anchor. The default
 *       start-to-start gap is {@code max(sequence length, start interval)};
 *       the previous fleet's custom interval overrides it according to
 *       {@link CustomIntervalPolicy}. A warning is never planned before the
 *       anchor.</li>
 *   <li>A pending entry pinned by a resume warns at
 *       {@code max(pin, chained time)}.</li>
 * </ul>
 * Only PENDING entries are rewritten. Everything else is returned as given, so
 * signalled times are never touched.
 */
public final class TimelineCalculator
{
    private final CustomIntervalPolicy policy;

    public TimelineCalculator(CustomIntervalPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public CustomIntervalPolicy policy() {
        return policy;
    }

    /**
     * Recomputes planned times for every pending entry.
     *
     * @param entries              entries in start order
     * @param firstWarningTime     warning time of the first fleet; may be {@code null},
     *                             in which case unanchored pending entries lose their plan
     * @param profile              the schedule's sequence
     * @param startIntervalMinutes the schedule's default start interval
     * @return a new list, same order and size as {@code entries}
     */
    public List<FleetStartEntry> recompute(List<FleetStartEntry> entries,
                                           Instant firstWarningTime,
                                           SequenceProfile profile,
                                           int startIntervalMinutes) {
        Objects.requireNonNull(entries, "entries");
        Objects.requireNonNull(profile, "profile");

        final Duration sequenceLength = profile.warningOffset();
        final Duration defaultGap = max(sequenceLength, Duration.ofMinutes(startIntervalMinutes));

        List<FleetStartEntry> out = new ArrayList<>(entries.size());
        Instant anchor = null;
        Integer anchorCustomInterval = null;

        for (FleetStartEntry e : entries) {
            FleetStartStatus status = e.status();

            if (status == FleetStartStatus.STARTED) {
                Optional<Instant> start = e.actualStartTime().or(e::plannedStartTime);
                if (start.isPresent() && becomesAnchor(anchor, start.get())) {
                    anchor = start.get();
                    anchorCustomInterval = e.customIntervalMinutes().orElse(null);
                }
                out.add(e);
                continue;
            }

            if (status.isSignaling()) {
                Optional<Instant> expectedStart = e.actualWarningTime()
                        .map(w -> w.plus(sequenceLength))
                        .or(e::plannedStartTime);
                if (expectedStart.isPresent() && becomesAnchor(anchor, expectedStart.get())) {
                    anchor = expectedStart.get();
                    anchorCustomInterval = e.customIntervalMinutes().orElse(null);
                }
                out.add(e);
                continue;
            }

            if (status != FleetStartStatus.PENDING) {
                out.add(e);
                continue;
            }

            Instant warning;
            if (anchor == null) {
                warning = firstWarningTime;
            }
            else {
                warning = chainedWarning(anchor, anchorCustomInterval, sequenceLength, defaultGap);
            }

            Optional<Instant> pin = e.anchoredWarningTime();
            if (pin.isPresent()) {
                warning = (warning == null || anchor == null) ? pin.get() : later(warning, pin.get());
            }

            FleetStartEntry planned = plan(e, warning, profile);
            out.add(planned);

            if (warning != null) {
                anchor = planned.plannedStartTime().orElseThrow();
                anchorCustomInterval = e.customIntervalMinutes().orElse(null);
            }
        }
        return out;
    }

    /**
     * A start takes over the anchor, and with it the gap to the next fleet,
     * only if it is not earlier than the current anchor.
     */
    private static boolean becomesAnchor(Instant anchor, Instant start) {
        return anchor == null || !start.isBefore(anchor);
    }

    private Instant chainedWarning(Instant anchor,
                                   Integer customInterval,
                                   Duration sequenceLength,
                                   Duration defaultGap) {
        Instant warning;
        if (customInterval == null) {
            warning = anchor.plus(defaultGap).minus(sequenceLength);
        }
        else if (policy == CustomIntervalPolicy.REPLACE) {
            warning = anchor.plus(Duration.ofMinutes(customInterval)).minus(sequenceLength);
        }
        else {
            warning = anchor.plus(Duration.ofMinutes(customInterval));
        }
        // Overlapping sequences are not planned: a short custom gap collapses
        // to the plain rolling chain.
        return later(anchor, warning);
    }

    private static FleetStartEntry plan(FleetStartEntry e, Instant warning, SequenceProfile profile) {
        if (warning == null) {
            return e.toBuilder()
                    .plannedWarningTime(null)
                    .plannedPrepTime(null)
                    .plannedStartTime(null)
                    .build();
        }
        Instant start = warning.plus(profile.warningOffset());
        Instant prep = profile.prepOffset().map(start::minus).orElse(null);
        return e.toBuilder()
                .plannedWarningTime(warning)
                .plannedPrepTime(prep)
                .plannedStartTime(start)
                .build();
    }

    /**
     * Planned one-minute signal time, derived from the planned start.
     */
    public static Optional<Instant> plannedOneMinuteTime(FleetStartEntry entry, SequenceProfile profile) {
        Optional<Duration> offset = profile.oneMinuteOffset();
        if (offset.isEmpty()) {
            return Optional.empty();
        }
        return entry.plannedStartTime().map(s -> s.minus(offset.get()));
    }

    private static Instant later(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        return b.isAfter(a) ? b : a;
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
