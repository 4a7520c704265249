package com.questrail.startline.api;

/**
 * Where a fleet sits on the day's timeline, for display.
 */
public enum TimelinePhase
{
    /** Waiting, with at least one fleet ahead of it. */
    PENDING,
    /** Next fleet to be warned. */
    UPCOMING,
    /** In sequence. */
    ACTIVE,
    /** Started. */
    COMPLETED,
    /** Postponed or abandoned. */
    INACTIVE
}
