package com.questrail.startline.core;

import com.questrail.startline.api.ScheduleStatusSummary;
import com.questrail.startline.api.TimelineEntry;
import com.questrail.startline.api.TimelinePhase;
import com.questrail.startline.internal.timeline.TimelineCalculator;
import com.questrail.startline.model.FleetStartEntry;
import com.questrail.startline.model.FleetStartStatus;
import com.questrail.startline.model.StartSchedule;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-side projections of a schedule snapshot.
 */
public final class ScheduleViews
{
    private ScheduleViews() {}

    public static List<TimelineEntry> timeline(StartSchedule schedule) {
        Optional<String> upcoming = schedule.firstPendingEntry().map(FleetStartEntry::id);
        List<TimelineEntry> rows = new ArrayList<>(schedule.entries().size());
        for (FleetStartEntry e : schedule.entries()) {
            rows.add(new TimelineEntry(
                    e.id(),
                    e.fleetName(),
                    e.classFlag().orElse(null),
                    e.startOrder(),
                    e.raceNumber(),
                    e.status(),
                    phaseOf(e, upcoming),
                    e.plannedWarningTime().orElse(null),
                    e.plannedPrepTime().orElse(null),
                    TimelineCalculator.plannedOneMinuteTime(e, schedule.sequence()).orElse(null),
                    e.plannedStartTime().orElse(null),
                    e.actualWarningTime().or(e::plannedWarningTime).orElse(null),
                    e.actualStartTime().or(e::plannedStartTime).orElse(null),
                    e.recallCount()));
        }
        return List.copyOf(rows);
    }

    public static ScheduleStatusSummary summary(StartSchedule schedule) {
        int started = 0;
        int pending = 0;
        int inSequence = 0;
        int recalled = 0;
        for (FleetStartEntry e : schedule.entries()) {
            if (e.status() == FleetStartStatus.STARTED) {
                started++;
            }
            else if (e.status() == FleetStartStatus.PENDING) {
                pending++;
            }
            else if (e.status().isSignaling()) {
                inSequence++;
            }
            if (e.recallCount() > 0) {
                recalled++;
            }
        }

        Optional<FleetStartEntry> next = schedule.firstPendingEntry();
        return new ScheduleStatusSummary(
                schedule.id(),
                schedule.regattaId(),
                schedule.name(),
                schedule.scheduledDate(),
                schedule.status(),
                schedule.firstWarningTime().orElse(null),
                schedule.startIntervalMinutes(),
                schedule.sequenceType(),
                schedule.entries().size(),
                started,
                pending,
                inSequence,
                recalled,
                next.map(FleetStartEntry::fleetName).orElse(null),
                next.flatMap(FleetStartEntry::plannedWarningTime).orElse(null));
    }

    private static TimelinePhase phaseOf(FleetStartEntry e, Optional<String> upcoming) {
        return switch (e.status()) {
            case STARTED -> TimelinePhase.COMPLETED;
            case WARNING, PREPARATORY, ONE_MINUTE -> TimelinePhase.ACTIVE;
            case POSTPONED, ABANDONED -> TimelinePhase.INACTIVE;
            case PENDING, GENERAL_RECALL -> upcoming.filter(e.id()::equals).isPresent()
                    ? TimelinePhase.UPCOMING
                    : TimelinePhase.PENDING;
        };
    }
}
