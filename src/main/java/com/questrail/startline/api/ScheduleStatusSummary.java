package com.questrail.startline.api;

import com.questrail.startline.model.ScheduleStatus;

import java.time.Instant;
import java.time.LocalDate;

/**
 * At-a-glance progress of one schedule.
 *
 * @param fleetsRecalled  fleets that have had at least one general recall
 * @param nextFleet       name of the next fleet to be warned, or {@code null}
 * @param nextWarningTime its planned warning time, or {@code null}
 */
public record ScheduleStatusSummary(
    String scheduleId,
    String regattaId,
    String scheduleName,
    LocalDate scheduledDate,
    ScheduleStatus status,
    Instant firstWarningTime,
    int startIntervalMinutes,
    String sequenceType,
    int totalFleets,
    int fleetsStarted,
    int fleetsPending,
    int fleetsInSequence,
    int fleetsRecalled,
    String nextFleet,
    Instant nextWarningTime
) {
}
