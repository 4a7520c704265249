package com.questrail.startline.model;

import com.questrail.startline.error.InvalidSequenceTypeException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SequenceProfile
 * -----------------------------------------------------------------------------
 * Immutable description of one start sequence: which signals are made and how
 * many minutes before the start each one falls.
 *
 * <h2>Validity</h2>
 * Offsets are minutes-before-start and must be strictly decreasing in signal
 * order. The warning offset is also the total sequence length, so it must be
 * positive. Preparatory and one-minute offsets are optional; when present they
 * must be non-negative and below every earlier offset.
 *
 * <p>Profiles are looked up by name through {@link SequenceProfiles}.</p>
 */
public final class SequenceProfile
{
    private final String sequenceType;
    private final int warningMinutes;
    private final Integer prepMinutes;
    private final Integer oneMinuteMinutes;
    private final List<SignalStage> stages;

    private SequenceProfile(String sequenceType,
                            int warningMinutes,
                            Integer prepMinutes,
                            Integer oneMinuteMinutes) {
        this.sequenceType = Objects.requireNonNull(sequenceType, "sequenceType");
        validate(sequenceType, warningMinutes, prepMinutes, oneMinuteMinutes);
        this.warningMinutes = warningMinutes;
        this.prepMinutes = prepMinutes;
        this.oneMinuteMinutes = oneMinuteMinutes;

        List<SignalStage> s = new ArrayList<>(4);
        s.add(SignalStage.WARNING);
        if (prepMinutes != null) {
            s.add(SignalStage.PREPARATORY);
        }
        if (oneMinuteMinutes != null) {
            s.add(SignalStage.ONE_MINUTE);
        }
        s.add(SignalStage.START);
        this.stages = Collections.unmodifiableList(s);
    }

    /**
     * Creates a profile; {@code null} marks an absent preparatory or one-minute signal.
     *
     * @throws InvalidSequenceTypeException if the offsets do not form a valid sequence
     */
    public static SequenceProfile of(String sequenceType,
                                     int warningMinutes,
                                     Integer prepMinutes,
                                     Integer oneMinuteMinutes) {
        return new SequenceProfile(sequenceType, warningMinutes, prepMinutes, oneMinuteMinutes);
    }

    private static void validate(String type, int warning, Integer prep, Integer oneMinute) {
        if (warning <= 0) {
            throw new InvalidSequenceTypeException(
                    "Sequence " + type + ": warning offset must be positive, was " + warning);
        }
        if (prep != null) {
            if (prep < 0) {
                throw new InvalidSequenceTypeException(
                        "Sequence " + type + ": preparatory offset must be non-negative, was " + prep);
            }
            if (prep >= warning) {
                throw new InvalidSequenceTypeException(
                        "Sequence " + type + ": preparatory offset " + prep
                                + " must be below warning offset " + warning);
            }
        }
        if (oneMinute != null) {
            if (oneMinute < 0) {
                throw new InvalidSequenceTypeException(
                        "Sequence " + type + ": one-minute offset must be non-negative, was " + oneMinute);
            }
            int ceiling = prep != null ? prep : warning;
            if (oneMinute >= ceiling) {
                throw new InvalidSequenceTypeException(
                        "Sequence " + type + ": one-minute offset " + oneMinute
                                + " must be below " + (prep != null ? "preparatory" : "warning")
                                + " offset " + ceiling);
            }
        }
    }

    public String sequenceType() {
        return sequenceType;
    }

    public int warningMinutes() {
        return warningMinutes;
    }

    public Optional<Integer> prepMinutes() {
        return Optional.ofNullable(prepMinutes);
    }

    public Optional<Integer> oneMinuteMinutes() {
        return Optional.ofNullable(oneMinuteMinutes);
    }

    /**
     * Time from warning signal to start signal.
     */
    public Duration warningOffset() {
        return Duration.ofMinutes(warningMinutes);
    }

    public Optional<Duration> prepOffset() {
        return prepMinutes().map(Duration::ofMinutes);
    }

    public Optional<Duration> oneMinuteOffset() {
        return oneMinuteMinutes().map(Duration::ofMinutes);
    }

    public boolean hasStage(SignalStage stage) {
        return stages.contains(stage);
    }

    /**
     * Signals made by this sequence, in order; always starts with WARNING and
     * ends with START.
     */
    public List<SignalStage> stages() {
        return stages;
    }

    /**
     * The signal that must already have been made before {@code stage} may be
     * signalled, or empty for WARNING.
     *
     * @throws IllegalArgumentException if this sequence has no such stage
     */
    public Optional<SignalStage> previousStage(SignalStage stage) {
        int idx = stages.indexOf(stage);
        if (idx < 0) {
            throw new IllegalArgumentException("Sequence " + sequenceType + " has no " + stage + " signal");
        }
        return idx == 0 ? Optional.empty() : Optional.of(stages.get(idx - 1));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SequenceProfile other)) {
            return false;
        }
        return warningMinutes == other.warningMinutes
                && sequenceType.equals(other.sequenceType)
                && Objects.equals(prepMinutes, other.prepMinutes)
                && Objects.equals(oneMinuteMinutes, other.oneMinuteMinutes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequenceType, warningMinutes, prepMinutes, oneMinuteMinutes);
    }

    @Override
    public String toString() {
        return sequenceType + "(" + warningMinutes + ","
                + (prepMinutes == null ? "-" : prepMinutes) + ","
                + (oneMinuteMinutes == null ? "-" : oneMinuteMinutes) + ")";
    }
}
