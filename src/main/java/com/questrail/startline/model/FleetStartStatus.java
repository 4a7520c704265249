package com.questrail.startline.model;

/**
 * FleetStartStatus
 * -----------------------------------------------------------------------------
 * Closed set of states a single fleet passes through on its way to the gun.
 *
 * <p>Legality of moving between these states is decided in one place,
 * {@code FleetTransitions}. This enum only answers classification questions.</p>
 */
public enum FleetStartStatus
{
    PENDING("pending", "Pending"),
    WARNING("warning", "Warning"),
    PREPARATORY("preparatory", "Prep"),
    ONE_MINUTE("one_minute", "1 Minute"),
    STARTED("started", "Started"),
    GENERAL_RECALL("general_recall", "Recall"),
    POSTPONED("postponed", "Postponed"),
    ABANDONED("abandoned", "Abandoned");

    private final String wireName;
    private final String label;

    FleetStartStatus(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    /**
     * Lower-case name used by the committee log and broadcast datagrams.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Short label for signal boards.
     */
    public String label() {
        return label;
    }

    /**
     * True while the fleet is mid-sequence (warning, preparatory or one-minute).
     */
    public boolean isSignaling() {
        return this == WARNING || this == PREPARATORY || this == ONE_MINUTE;
    }

    /**
     * True once no further command may change the status.
     */
    public boolean isTerminal() {
        return this == STARTED || this == ABANDONED;
    }

    public static FleetStartStatus fromWireName(String wireName) {
        for (FleetStartStatus s : values()) {
            if (s.wireName.equals(wireName)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown fleet status: " + wireName);
    }
}
