package com.questrail.startline.model;

/**
 * Lifecycle of a {@link StartSchedule}.
 */
public enum ScheduleStatus
{
    /** Fleets may be added, removed, updated and reordered. */
    DRAFT,

    /** Structure frozen, initial timeline computed. */
    READY,

    /** Sequence running; signal commands accepted. */
    ACTIVE,

    /** No fleet is pending or mid-sequence. */
    COMPLETED
}
