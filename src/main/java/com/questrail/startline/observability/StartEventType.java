package com.questrail.startline.observability;

/**
 * Externally observable changes to a start schedule.
 *
 * <p>Exactly one event is emitted per change; a command that changes nothing
 * emits nothing.</p>
 */
public enum StartEventType
{
    SCHEDULE_CREATED("schedule_created"),
    SCHEDULE_UPDATED("schedule_updated"),
    SCHEDULE_DELETED("schedule_deleted"),
    FLEETS_ADDED("fleets_added"),
    FLEET_REMOVED("fleet_removed"),
    FLEET_UPDATED("fleet_updated"),
    FLEETS_REORDERED("fleets_reordered"),
    SCHEDULE_READY("schedule_ready"),
    SEQUENCE_STARTED("sequence_started"),
    WARNING_SIGNALED("warning"),
    PREPARATORY_SIGNALED("preparatory"),
    ONE_MINUTE_SIGNALED("one_minute"),
    START_SIGNALED("start"),
    GENERAL_RECALL("general_recall"),
    INDIVIDUAL_RECALL("individual_recall"),
    POSTPONED("postponed"),
    RESUMED("resumed"),
    ABANDONED("abandoned"),
    SCHEDULE_COMPLETED("schedule_completed");

    private final String wireName;

    StartEventType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used in committee log records and broadcast datagrams.
     */
    public String wireName() {
        return wireName;
    }

    public static StartEventType fromWireName(String wireName) {
        for (StartEventType t : values()) {
            if (t.wireName.equals(wireName)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + wireName);
    }
}
