package com.questrail.startline.api;

import com.questrail.startline.error.StartSchedulerException;
import com.questrail.startline.internal.timeline.SequenceCountdown;
import com.questrail.startline.model.FleetStartEntry;
import com.questrail.startline.model.StartSchedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * StartScheduler
 * =============================================================================
 * Command and query surface of the rolling start scheduler.
 *
 * <h2>Commands</h2>
 * Every command is applied atomically to one schedule and either returns the
 * updated entry or schedule, or throws a {@link StartSchedulerException} having
 * changed nothing. Entry commands are addressed by entry id alone.
 *
 * <h2>Queries</h2>
 * Queries read the last committed snapshot and never wait for a command in
 * progress.
 */
public interface StartScheduler
{
    // ---------------------------------------------------------------------
    // Schedule management
    // ---------------------------------------------------------------------

    StartSchedule createSchedule(ScheduleDefinition definition);

    /**
     * Edits a DRAFT schedule's settings and replans its fleets.
     */
    StartSchedule updateSchedule(String scheduleId, ScheduleUpdate update);

    /**
     * Deletes a schedule that is not ACTIVE, together with its fleets.
     */
    void deleteSchedule(String scheduleId);

    // ---------------------------------------------------------------------
    // Fleets (DRAFT only)
    // ---------------------------------------------------------------------

    /**
     * Appends fleets in the given order.
     *
     * @return the new entries, in start order
     */
    List<FleetStartEntry> addFleets(String scheduleId, List<FleetEntryRequest> fleets);

    StartSchedule removeFleet(String entryId);

    FleetStartEntry updateFleet(String entryId, FleetUpdate update);

    /**
     * Sets the start order. {@code orderedEntryIds} must name every entry
     * of the schedule exactly once.
     *
     * @return all entries in their new order
     */
    List<FleetStartEntry> reorderFleets(String scheduleId, List<String> orderedEntryIds);

    // ---------------------------------------------------------------------
    // Sequence control
    // ---------------------------------------------------------------------

    StartSchedule markReady(String scheduleId);

    /**
     * Activates a READY schedule and makes the first pending fleet's warning
     * signal.
     *
     * @return the fleet that was warned
     */
    FleetStartEntry startSequence(String scheduleId);

    FleetStartEntry signalWarning(String entryId);

    FleetStartEntry signalPreparatory(String entryId);

    FleetStartEntry signalOneMinute(String entryId);

    /**
     * Records the start. The next fleet may be warned in the same step when
     * it is due back-to-back; query the schedule to see it.
     */
    FleetStartEntry signalStart(String entryId);

    // ---------------------------------------------------------------------
    // Race control
    // ---------------------------------------------------------------------

    /**
     * Sends a fleet in sequence back to the end of the queue.
     */
    FleetStartEntry generalRecall(String entryId, String reason);

    FleetStartEntry individualRecall(String entryId, List<String> boatIds);

    FleetStartEntry postpone(String entryId, String reason);

    /**
     * Returns a postponed fleet to the queue with its warning no earlier than
     * {@code newWarningTime}.
     */
    FleetStartEntry resume(String entryId, Instant newWarningTime);

    FleetStartEntry abandon(String entryId, String reason);

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    Optional<StartSchedule> getSchedule(String scheduleId);

    /**
     * Schedules of a regatta, earliest scheduled date first.
     */
    List<StartSchedule> getSchedules(String regattaId);

    Optional<FleetStartEntry> getEntry(String entryId);

    List<TimelineEntry> getTimeline(String scheduleId);

    ScheduleStatusSummary getStatusSummary(String scheduleId);

    /**
     * Countdown for a fleet that has had its warning, or empty otherwise.
     */
    Optional<SequenceCountdown.Countdown> countdown(String entryId);
}
