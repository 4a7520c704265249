package com.questrail.startline.api;

import com.questrail.startline.model.FleetStartStatus;

import java.time.Instant;

/**
 * One row of the start timeline.
 *
 * <p>Effective times are the actual signal times once made and the planned
 * times until then. Any time may be {@code null} when nothing is planned,
 * for instance before a first warning time has been set.</p>
 */
public record TimelineEntry(
    String entryId,
    String fleetName,
    String classFlag,
    int startOrder,
    int raceNumber,
    FleetStartStatus status,
    TimelinePhase phase,
    Instant plannedWarningTime,
    Instant plannedPrepTime,
    Instant plannedOneMinuteTime,
    Instant plannedStartTime,
    Instant effectiveWarningTime,
    Instant effectiveStartTime,
    int recallCount
) {
}
