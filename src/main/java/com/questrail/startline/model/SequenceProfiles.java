package com.questrail.startline.model;

import com.questrail.startline.error.InvalidSequenceTypeException;

import java.util.Map;
import java.util.Set;

/**
 * Registry of named start sequences.
 *
 * <p>The built-in names resolve to fixed offsets. {@value #CUSTOM} requires the
 * caller to supply offsets when the schedule is created.</p>
 */
public final class SequenceProfiles
{
    public static final String FIVE_FOUR_ONE_GO = "5-4-1-go";
    public static final String THREE_TWO_ONE_GO = "3-2-1-go";
    public static final String FIVE_ONE_GO = "5-1-go";
    public static final String CUSTOM = "custom";

    private static final Map<String, SequenceProfile> BUILT_IN = Map.of(
            FIVE_FOUR_ONE_GO, SequenceProfile.of(FIVE_FOUR_ONE_GO, 5, 4, 1),
            THREE_TWO_ONE_GO, SequenceProfile.of(THREE_TWO_ONE_GO, 3, 2, 1),
            FIVE_ONE_GO, SequenceProfile.of(FIVE_ONE_GO, 5, null, 1)
    );

    private SequenceProfiles() {}

    /**
     * Resolves a built-in sequence.
     *
     * @throws InvalidSequenceTypeException for unknown names and for {@value #CUSTOM}
     */
    public static SequenceProfile builtIn(String sequenceType) {
        if (sequenceType == null) {
            throw new InvalidSequenceTypeException("Sequence type is required");
        }
        SequenceProfile profile = BUILT_IN.get(sequenceType);
        if (profile == null) {
            if (CUSTOM.equals(sequenceType)) {
                throw new InvalidSequenceTypeException("Sequence type custom requires explicit offsets");
            }
            throw new InvalidSequenceTypeException("Unknown sequence type: " + sequenceType);
        }
        return profile;
    }

    /**
     * Builds a {@value #CUSTOM} sequence from explicit offsets.
     */
    public static SequenceProfile custom(int warningMinutes, Integer prepMinutes, Integer oneMinuteMinutes) {
        return SequenceProfile.of(CUSTOM, warningMinutes, prepMinutes, oneMinuteMinutes);
    }

    /**
     * Resolves {@code sequenceType}, using {@code customOffsets} only when the
     * type is {@value #CUSTOM}.
     */
    public static SequenceProfile resolve(String sequenceType, CustomOffsets customOffsets) {
        if (CUSTOM.equals(sequenceType)) {
            if (customOffsets == null) {
                throw new InvalidSequenceTypeException("Sequence type custom requires explicit offsets");
            }
            return custom(customOffsets.warningMinutes(),
                    customOffsets.prepMinutes(),
                    customOffsets.oneMinuteMinutes());
        }
        return builtIn(sequenceType);
    }

    public static Set<String> builtInNames() {
        return BUILT_IN.keySet();
    }

    /**
     * Caller-supplied offsets for a {@value #CUSTOM} sequence; {@code null}
     * means the signal is not made.
     */
    public record CustomOffsets(int warningMinutes, Integer prepMinutes, Integer oneMinuteMinutes) {}
}
