package com.questrail.startline.internal.state;

import com.questrail.startline.api.FleetEntryRequest;
import com.questrail.startline.api.FleetUpdate;
import com.questrail.startline.api.ScheduleDefinition;
import com.questrail.startline.api.ScheduleUpdate;
import com.questrail.startline.config.SchedulerConfig;
import com.questrail.startline.error.DuplicateStartOrderException;
import com.questrail.startline.error.EntryNotFoundException;
import com.questrail.startline.error.InvalidTransitionException;
import com.questrail.startline.error.ScheduleNotReadyException;
import com.questrail.startline.internal.timeline.TimelineCalculator;
import com.questrail.startline.model.FleetStartEntry;
import com.questrail.startline.model.FleetStartStatus;
import com.questrail.startline.model.ScheduleStatus;
import com.questrail.startline.model.SequenceProfile;
import com.questrail.startline.model.SequenceProfiles;
import com.questrail.startline.model.SignalStage;
import com.questrail.startline.model.StartSchedule;
import com.questrail.startline.observability.CommitteeLogEntry;
import com.questrail.startline.observability.StartEvent;
import com.questrail.startline.observability.StartEventType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * StartScheduleReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic state transition engine for a start schedule.
 *
 * <h2>Role in the architecture</h2>
 * Given the last committed {@link StartSchedule}, a {@link ScheduleCommand}
 * and the wall-clock time the command arrived, the reducer computes:
 * <ul>
 *   <li>the next schedule snapshot, with the timeline already recomputed</li>
 *   <li>the {@link StartEvent}s describing what changed, in order</li>
 * </ul>
 * It performs no I/O and holds no locks. Persisting the snapshot and
 * publishing the events is the job of {@code RollingStartScheduler}.
 *
 * <h2>Failure</h2>
 * Every check happens before anything is built. A command that is not legal
 * throws a {@code StartSchedulerException} and the caller's snapshot is, as
 * always, untouched.
 */
public final class StartScheduleReducer
{
    /**
     * Result of applying a command.
     *
     * @param schedule the new snapshot (same instance as the input when nothing changed)
     * @param events   events to publish once the snapshot is saved
     * @param entryId  the entry the command addressed or warned, or {@code null}
     */
    public record Result(StartSchedule schedule, List<StartEvent> events, String entryId) {
        public Result {
            Objects.requireNonNull(schedule, "schedule");
            events = List.copyOf(events);
        }

        public boolean changed() {
            return !events.isEmpty();
        }

        public Optional<FleetStartEntry> entry() {
            return entryId == null ? Optional.empty() : schedule.entry(entryId);
        }
    }

    private static final Set<ScheduleStatus> SIGNALLING_STATES = EnumSet.of(ScheduleStatus.ACTIVE);
    private static final Set<ScheduleStatus> RACE_CONTROL_STATES =
            EnumSet.of(ScheduleStatus.READY, ScheduleStatus.ACTIVE, ScheduleStatus.COMPLETED);

    private final TimelineCalculator timeline;
    private final boolean autoAdvance;
    private final Duration autoAdvanceTolerance;
    private final String defaultSequenceType;
    private final int defaultStartIntervalMinutes;

    public StartScheduleReducer(SchedulerConfig config) {
        Objects.requireNonNull(config, "config");
        this.timeline = new TimelineCalculator(config.customIntervalPolicy());
        this.autoAdvance = config.autoAdvance();
        this.autoAdvanceTolerance = config.autoAdvanceTolerance();
        this.defaultSequenceType = config.defaultSequenceType();
        this.defaultStartIntervalMinutes = config.defaultStartIntervalMinutes();
    }

    // ---------------------------------------------------------------------
    // Schedule lifecycle outside the command set
    // ---------------------------------------------------------------------

    /**
     * Builds a new DRAFT schedule with no fleets.
     */
    public Result create(String scheduleId, ScheduleDefinition definition, Instant now) {
        Objects.requireNonNull(scheduleId, "scheduleId");
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(now, "now");

        String type = definition.sequenceType() != null ? definition.sequenceType() : defaultSequenceType;
        SequenceProfile profile = SequenceProfiles.resolve(type, definition.customOffsets());
        int interval = definition.startIntervalMinutes() != null
                ? definition.startIntervalMinutes()
                : defaultStartIntervalMinutes;

        StartSchedule schedule = StartSchedule.builder()
                .id(scheduleId)
                .regattaId(definition.regattaId())
                .name(definition.name())
                .scheduledDate(definition.scheduledDate())
                .notes(definition.notes())
                .sequence(profile)
                .startIntervalMinutes(interval)
                .firstWarningTime(definition.firstWarningTime())
                .status(ScheduleStatus.DRAFT)
                .createdAt(now)
                .updatedAt(now)
                .build();

        Map<String, String> details = new LinkedHashMap<>();
        details.put("name", schedule.name());
        details.put("regattaId", schedule.regattaId());
        details.put("sequenceType", profile.sequenceType());
        details.put("startIntervalMinutes", Integer.toString(interval));
        StartEvent event = StartEvent.forSchedule(StartEventType.SCHEDULE_CREATED, scheduleId, now, details);
        return new Result(schedule, List.of(event), null);
    }

    /**
     * Validates that a schedule may be deleted and describes the deletion.
     *
     * @throws ScheduleNotReadyException while the schedule is ACTIVE
     */
    public StartEvent delete(StartSchedule schedule, Instant now) {
        if (schedule.status() == ScheduleStatus.ACTIVE) {
            throw new ScheduleNotReadyException(schedule.id(), schedule.status(),
                    "Schedule " + schedule.id() + " cannot be deleted while its sequence is running");
        }
        return StartEvent.forSchedule(StartEventType.SCHEDULE_DELETED, schedule.id(), now,
                Map.of("name", schedule.name()));
    }

    // ---------------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------------

    /**
     * Applies a single command to the current schedule.
     *
     * @param schedule the last committed snapshot
     * @param command  the command to apply
     * @param now      wall-clock time used for every stamp the command makes
     */
    public Result apply(StartSchedule schedule, ScheduleCommand command, Instant now) {
        Objects.requireNonNull(schedule, "schedule");
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(now, "now");

        if (command instanceof ScheduleCommand.AddFleets c) {
            return onAddFleets(schedule, c, now);
        }
        if (command instanceof ScheduleCommand.RemoveFleet c) {
            return onRemoveFleet(schedule, c, now);
        }
        if (command instanceof ScheduleCommand.UpdateFleet c) {
            return onUpdateFleet(schedule, c, now);
        }
        if (command instanceof ScheduleCommand.ReorderFleets c) {
            return onReorderFleets(schedule, c, now);
        }
        if (command instanceof ScheduleCommand.UpdateSchedule c) {
            return onUpdateSchedule(schedule, c, now);
        }
        if (command instanceof ScheduleCommand.MarkReady) {
            return onMarkReady(schedule, now);
        }
        if (command instanceof ScheduleCommand.StartSequence) {
            return onStartSequence(schedule, now);
        }
        if (command instanceof ScheduleCommand.Signal c) {
            return onSignal(schedule, c, now);
        }
        if (command instanceof ScheduleCommand.GeneralRecall c) {
            return onGeneralRecall(schedule, c, now);
        }
        if (command instanceof ScheduleCommand.IndividualRecall c) {
            return onIndividualRecall(schedule, c, now);
        }
        if (command instanceof ScheduleCommand.Postpone c) {
            return onPostpone(schedule, c, now);
        }
        if (command instanceof ScheduleCommand.Resume c) {
            return onResume(schedule, c, now);
        }
        if (command instanceof ScheduleCommand.Abandon c) {
            return onAbandon(schedule, c, now);
        }
        throw new IllegalArgumentException("Unsupported command: " + command);
    }

    // ---------------------------------------------------------------------
    // Structural edits (DRAFT only)
    // ---------------------------------------------------------------------

    private Result onAddFleets(StartSchedule schedule, ScheduleCommand.AddFleets c, Instant now) {
        requireDraft(schedule, c.name());
        if (c.fleets().isEmpty()) {
            return new Result(schedule, List.of(), null);
        }

        List<FleetStartEntry> entries = new ArrayList<>(schedule.entries());
        List<String> added = new ArrayList<>();
        int order = entries.size();
        for (ScheduleCommand.NewFleet f : c.fleets()) {
            FleetEntryRequest r = f.request();
            entries.add(FleetStartEntry.builder()
                    .id(f.entryId())
                    .scheduleId(schedule.id())
                    .fleetId(r.fleetId())
                    .fleetName(r.fleetName())
                    .classFlag(r.classFlag())
                    .raceNumber(r.raceNumber())
                    .customIntervalMinutes(r.customIntervalMinutes())
                    .startOrder(++order)
                    .status(FleetStartStatus.PENDING)
                    .build());
            added.add(f.entryId());
        }

        StartSchedule next = recompute(schedule.toBuilder().entries(entries).updatedAt(now));
        Map<String, String> details = new LinkedHashMap<>();
        details.put("count", Integer.toString(added.size()));
        details.put("entryIds", String.join(",", added));
        return new Result(next,
                List.of(StartEvent.forSchedule(StartEventType.FLEETS_ADDED, schedule.id(), now, details)),
                null);
    }

    private Result onRemoveFleet(StartSchedule schedule, ScheduleCommand.RemoveFleet c, Instant now) {
        requireDraft(schedule, c.name());
        FleetStartEntry removed = requireEntry(schedule, c.entryId());

        List<FleetStartEntry> remaining = new ArrayList<>(schedule.entries());
        remaining.remove(removed);
        StartSchedule next = recompute(schedule.toBuilder().entries(renumber(remaining)).updatedAt(now));

        return new Result(next,
                List.of(StartEvent.forEntry(StartEventType.FLEET_REMOVED, schedule.id(), removed.id(), now,
                        describe(removed))),
                null);
    }

    private Result onUpdateFleet(StartSchedule schedule, ScheduleCommand.UpdateFleet c, Instant now) {
        requireDraft(schedule, c.name());
        FleetStartEntry entry = requireEntry(schedule, c.entryId());
        FleetUpdate u = c.update();

        FleetStartEntry.Builder b = entry.toBuilder();
        if (u.fleetName() != null) {
            b.fleetName(u.fleetName());
        }
        if (u.classFlag() != null) {
            b.classFlag(u.classFlag());
        }
        if (u.raceNumber() != null) {
            b.raceNumber(u.raceNumber());
        }
        if (u.clearCustomInterval()) {
            b.customIntervalMinutes(null);
        }
        else if (u.customIntervalMinutes() != null) {
            b.customIntervalMinutes(u.customIntervalMinutes());
        }
        FleetStartEntry updated = b.build();
        if (updated.equals(entry)) {
            return new Result(schedule, List.of(), entry.id());
        }

        StartSchedule next = recompute(schedule.toBuilder().entries(replace(schedule, updated)).updatedAt(now));
        return new Result(next,
                List.of(StartEvent.forEntry(StartEventType.FLEET_UPDATED, schedule.id(), entry.id(), now,
                        describe(updated))),
                entry.id());
    }

    private Result onReorderFleets(StartSchedule schedule, ScheduleCommand.ReorderFleets c, Instant now) {
        requireDraft(schedule, c.name());

        List<String> ids = c.orderedEntryIds();
        for (String id : ids) {
            requireEntry(schedule, id);
        }
        Set<String> distinct = new HashSet<>(ids);
        if (distinct.size() != ids.size()) {
            throw new DuplicateStartOrderException("Reorder lists an entry more than once: " + ids);
        }
        if (ids.size() != schedule.entries().size()) {
            throw new DuplicateStartOrderException("Reorder must list all " + schedule.entries().size()
                    + " entries exactly once, got " + ids.size());
        }

        List<FleetStartEntry> reordered = new ArrayList<>(ids.size());
        for (String id : ids) {
            reordered.add(schedule.entry(id).orElseThrow());
        }
        StartSchedule next = recompute(schedule.toBuilder().entries(renumber(reordered)).updatedAt(now));
        return new Result(next,
                List.of(StartEvent.forSchedule(StartEventType.FLEETS_REORDERED, schedule.id(), now,
                        Map.of("order", String.join(",", ids)))),
                null);
    }

    private Result onUpdateSchedule(StartSchedule schedule, ScheduleCommand.UpdateSchedule c, Instant now) {
        requireDraft(schedule, c.name());
        ScheduleUpdate u = c.update();

        StartSchedule.Builder b = schedule.toBuilder();
        if (u.name() != null) {
            b.name(u.name());
        }
        if (u.scheduledDate() != null) {
            b.scheduledDate(u.scheduledDate());
        }
        if (u.sequenceType() != null) {
            b.sequence(SequenceProfiles.resolve(u.sequenceType(), u.customOffsets()));
        }
        else if (u.customOffsets() != null && SequenceProfiles.CUSTOM.equals(schedule.sequenceType())) {
            b.sequence(SequenceProfiles.resolve(SequenceProfiles.CUSTOM, u.customOffsets()));
        }
        if (u.startIntervalMinutes() != null) {
            b.startIntervalMinutes(u.startIntervalMinutes());
        }
        if (u.firstWarningTime() != null) {
            b.firstWarningTime(u.firstWarningTime());
        }
        if (u.notes() != null) {
            b.notes(u.notes());
        }

        StartSchedule next = recompute(b.updatedAt(now));
        Map<String, String> details = new LinkedHashMap<>();
        details.put("name", next.name());
        details.put("sequenceType", next.sequenceType());
        details.put("startIntervalMinutes", Integer.toString(next.startIntervalMinutes()));
        next.firstWarningTime().ifPresent(t -> details.put("firstWarningTime", t.toString()));
        return new Result(next,
                List.of(StartEvent.forSchedule(StartEventType.SCHEDULE_UPDATED, schedule.id(), now, details)),
                null);
    }

    // ---------------------------------------------------------------------
    // Schedule lifecycle
    // ---------------------------------------------------------------------

    private Result onMarkReady(StartSchedule schedule, Instant now) {
        requireDraft(schedule, "markReady");
        if (schedule.entries().isEmpty()) {
            throw new ScheduleNotReadyException(schedule.id(), schedule.status(),
                    "Schedule " + schedule.id() + " has no fleets");
        }

        StartSchedule next = recompute(schedule.toBuilder().status(ScheduleStatus.READY).updatedAt(now));
        Map<String, String> details = new LinkedHashMap<>();
        details.put("fleets", Integer.toString(next.entries().size()));
        next.firstWarningTime().ifPresent(t -> details.put("firstWarningTime", t.toString()));
        return new Result(next,
                List.of(StartEvent.forSchedule(StartEventType.SCHEDULE_READY, schedule.id(), now, details)),
                null);
    }

    private Result onStartSequence(StartSchedule schedule, Instant now) {
        if (schedule.status() != ScheduleStatus.READY) {
            throw new ScheduleNotReadyException(schedule.id(), schedule.status(),
                    "startSequence requires schedule " + schedule.id() + " to be ready; it is "
                            + schedule.status().name().toLowerCase());
        }

        if (schedule.firstPendingEntry().isEmpty()) {
            throw new ScheduleNotReadyException(schedule.id(), schedule.status(),
                    "Schedule " + schedule.id() + " has no pending fleet to warn");
        }

        Instant firstWarning = schedule.firstWarningTime().orElse(now);
        StartSchedule active = recompute(schedule.toBuilder()
                .status(ScheduleStatus.ACTIVE)
                .firstWarningTime(firstWarning)
                .updatedAt(now));

        List<StartEvent> events = new ArrayList<>();
        Map<String, String> details = new LinkedHashMap<>();
        details.put("firstWarningTime", firstWarning.toString());
        events.add(StartEvent.forSchedule(StartEventType.SEQUENCE_STARTED, schedule.id(), now, details));

        FleetStartEntry first = active.firstPendingEntry().orElseThrow();
        active = warn(active, first, now, false, events);
        return new Result(completeIfDone(active, now, events), events, first.id());
    }

    // ---------------------------------------------------------------------
    // Signals
    // ---------------------------------------------------------------------

    private Result onSignal(StartSchedule schedule, ScheduleCommand.Signal c, Instant now) {
        requireStatus(schedule, SIGNALLING_STATES, c.name());
        FleetStartEntry entry = requireEntry(schedule, c.entryId());
        FleetTransitions.Operation op = FleetTransitions.Operation.forStage(c.stage());
        FleetTransitions.require(entry.id(), entry.status(), op, schedule.sequence());

        List<StartEvent> events = new ArrayList<>();
        if (c.stage() == SignalStage.WARNING) {
            requireNextInLine(schedule, entry, c.name());
            StartSchedule next = warn(schedule, entry, now, false, events);
            return new Result(completeIfDone(next, now, events), events, entry.id());
        }

        FleetStartEntry.Builder b = entry.toBuilder().status(c.stage().resultingStatus());
        StartEventType type;
        switch (c.stage()) {
            case PREPARATORY -> {
                b.actualPrepTime(now);
                type = StartEventType.PREPARATORY_SIGNALED;
            }
            case ONE_MINUTE -> {
                b.actualOneMinuteTime(now);
                type = StartEventType.ONE_MINUTE_SIGNALED;
            }
            case START -> {
                b.actualStartTime(now);
                type = StartEventType.START_SIGNALED;
            }
            default -> throw new IllegalStateException("Unexpected stage " + c.stage());
        }
        FleetStartEntry signalled = b.build();
        StartSchedule next = recompute(schedule.toBuilder().entries(replace(schedule, signalled)).updatedAt(now));
        events.add(entryEvent(type, signalled, now, Map.of()));

        if (c.stage() == SignalStage.START && autoAdvance) {
            next = autoAdvance(next, now, events);
        }
        return new Result(completeIfDone(next, now, events), events, entry.id());
    }

    /**
     * Warns the next pending fleet in the same command when its planned
     * warning coincides with the start just made.
     */
    private StartSchedule autoAdvance(StartSchedule schedule, Instant startTime, List<StartEvent> events) {
        if (schedule.signalingEntry().isPresent()) {
            return schedule;
        }
        Optional<FleetStartEntry> next = schedule.firstPendingEntry();
        if (next.isEmpty() || next.get().plannedWarningTime().isEmpty()) {
            return schedule;
        }
        Duration drift = Duration.between(startTime, next.get().plannedWarningTime().get()).abs();
        if (drift.compareTo(autoAdvanceTolerance) > 0) {
            return schedule;
        }
        return warn(schedule, next.get(), startTime, true, events);
    }

    private StartSchedule warn(StartSchedule schedule,
                               FleetStartEntry entry,
                               Instant now,
                               boolean autoAdvanced,
                               List<StartEvent> events) {
        FleetStartEntry warned = entry.toBuilder()
                .status(FleetStartStatus.WARNING)
                .actualWarningTime(now)
                .anchoredWarningTime(null)
                .build();

        StartSchedule.Builder b = schedule.toBuilder().entries(replace(schedule, warned)).updatedAt(now);
        if (schedule.actualFirstWarningTime().isEmpty()) {
            b.actualFirstWarningTime(now);
        }
        Map<String, String> details = new LinkedHashMap<>();
        entry.plannedWarningTime().ifPresent(t -> details.put("plannedWarningTime", t.toString()));
        if (autoAdvanced) {
            details.put("autoAdvanced", "true");
        }
        events.add(entryEvent(StartEventType.WARNING_SIGNALED, warned, now, details));
        return recompute(b);
    }

    private static void requireNextInLine(StartSchedule schedule, FleetStartEntry entry, String command) {
        Optional<FleetStartEntry> signalling = schedule.signalingEntry();
        if (signalling.isPresent()) {
            throw new InvalidTransitionException(entry.id(), entry.status(), command,
                    "Fleet " + signalling.get().fleetName() + " is still in sequence");
        }
        FleetStartEntry first = schedule.firstPendingEntry().orElseThrow();
        if (!first.id().equals(entry.id())) {
            throw new InvalidTransitionException(entry.id(), entry.status(), command,
                    "Fleet " + first.fleetName() + " is next to start, not " + entry.fleetName());
        }
    }

    // ---------------------------------------------------------------------
    // Race control
    // ---------------------------------------------------------------------

    private Result onGeneralRecall(StartSchedule schedule, ScheduleCommand.GeneralRecall c, Instant now) {
        requireStatus(schedule, SIGNALLING_STATES, c.name());
        FleetStartEntry entry = requireEntry(schedule, c.entryId());
        FleetStartStatus to = FleetTransitions.require(entry.id(), entry.status(),
                FleetTransitions.Operation.GENERAL_RECALL, schedule.sequence());

        FleetStartEntry requeued = entry.toBuilder()
                .clearActualTimes()
                .anchoredWarningTime(null)
                .recallCount(entry.recallCount() + 1)
                .lastRecallAt(now)
                .recallNotes(c.reason())
                .status(to)
                .build();

        List<FleetStartEntry> entries = new ArrayList<>(schedule.entries());
        int position = entries.indexOf(entry);
        entries.remove(position);
        entries.add(requeuePosition(entries, position), requeued);
        StartSchedule next = recompute(schedule.toBuilder().entries(renumber(entries)).updatedAt(now));

        FleetStartEntry stored = next.entry(entry.id()).orElseThrow();
        Map<String, String> details = new LinkedHashMap<>();
        details.put("recallCount", Integer.toString(stored.recallCount()));
        details.put("newStartOrder", Integer.toString(stored.startOrder()));
        putReason(details, c.reason());
        List<StartEvent> events = new ArrayList<>();
        events.add(entryEvent(StartEventType.GENERAL_RECALL, stored, now, details));
        return new Result(next, events, entry.id());
    }

    private Result onIndividualRecall(StartSchedule schedule, ScheduleCommand.IndividualRecall c, Instant now) {
        requireStatus(schedule, SIGNALLING_STATES, c.name());
        FleetStartEntry entry = requireEntry(schedule, c.entryId());
        FleetTransitions.require(entry.id(), entry.status(),
                FleetTransitions.Operation.INDIVIDUAL_RECALL, schedule.sequence());

        Set<String> boats = new LinkedHashSet<>(entry.ocsBoatIds());
        boats.addAll(c.boatIds());
        FleetStartEntry updated = entry.toBuilder().ocsBoatIds(new ArrayList<>(boats)).build();

        StartSchedule next = schedule.toBuilder().entries(replace(schedule, updated)).updatedAt(now).build();
        Map<String, String> details = new LinkedHashMap<>();
        details.put(CommitteeLogEntry.KEY_BOATS, String.join(", ", c.boatIds()));
        return new Result(next, List.of(entryEvent(StartEventType.INDIVIDUAL_RECALL, updated, now, details)),
                entry.id());
    }

    private Result onPostpone(StartSchedule schedule, ScheduleCommand.Postpone c, Instant now) {
        requireStatus(schedule, RACE_CONTROL_STATES, c.name());
        FleetStartEntry entry = requireEntry(schedule, c.entryId());
        FleetStartStatus to = FleetTransitions.require(entry.id(), entry.status(),
                FleetTransitions.Operation.POSTPONE, schedule.sequence());

        FleetStartEntry postponed = entry.toBuilder()
                .status(to)
                .clearActualTimes()
                .anchoredWarningTime(null)
                .build();
        StartSchedule next = recompute(schedule.toBuilder().entries(replace(schedule, postponed)).updatedAt(now));

        Map<String, String> details = new LinkedHashMap<>();
        putReason(details, c.reason());
        List<StartEvent> events = new ArrayList<>();
        events.add(entryEvent(StartEventType.POSTPONED, postponed, now, details));
        return new Result(completeIfDone(next, now, events), events, entry.id());
    }

    private Result onResume(StartSchedule schedule, ScheduleCommand.Resume c, Instant now) {
        requireStatus(schedule, RACE_CONTROL_STATES, c.name());
        FleetStartEntry entry = requireEntry(schedule, c.entryId());
        FleetStartStatus to = FleetTransitions.require(entry.id(), entry.status(),
                FleetTransitions.Operation.RESUME, schedule.sequence());

        FleetStartEntry resumed = entry.toBuilder()
                .status(to)
                .anchoredWarningTime(c.newWarningTime())
                .build();

        StartSchedule.Builder b = schedule.toBuilder().entries(replace(schedule, resumed)).updatedAt(now);
        if (isFirstUnstarted(schedule, entry)) {
            b.firstWarningTime(c.newWarningTime());
        }
        if (schedule.status() == ScheduleStatus.COMPLETED) {
            b.status(ScheduleStatus.ACTIVE);
        }
        StartSchedule next = recompute(b);

        Map<String, String> details = new LinkedHashMap<>();
        details.put("newWarningTime", c.newWarningTime().toString());
        return new Result(next, List.of(entryEvent(StartEventType.RESUMED, resumed, now, details)), entry.id());
    }

    private Result onAbandon(StartSchedule schedule, ScheduleCommand.Abandon c, Instant now) {
        requireStatus(schedule, RACE_CONTROL_STATES, c.name());
        FleetStartEntry entry = requireEntry(schedule, c.entryId());
        FleetStartStatus to = FleetTransitions.require(entry.id(), entry.status(),
                FleetTransitions.Operation.ABANDON, schedule.sequence());

        FleetStartEntry abandoned = entry.toBuilder().status(to).anchoredWarningTime(null).build();
        StartSchedule next = recompute(schedule.toBuilder().entries(replace(schedule, abandoned)).updatedAt(now));

        Map<String, String> details = new LinkedHashMap<>();
        putReason(details, c.reason());
        List<StartEvent> events = new ArrayList<>();
        events.add(entryEvent(StartEventType.ABANDONED, abandoned, now, details));
        return new Result(completeIfDone(next, now, events), events, entry.id());
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private StartSchedule recompute(StartSchedule.Builder b) {
        StartSchedule s = b.build();
        List<FleetStartEntry> planned = timeline.recompute(
                s.entries(),
                s.firstWarningTime().orElse(null),
                s.sequence(),
                s.startIntervalMinutes());
        return s.toBuilder().entries(planned).build();
    }

    private static StartSchedule completeIfDone(StartSchedule schedule, Instant now, List<StartEvent> events) {
        if (schedule.status() != ScheduleStatus.ACTIVE || !schedule.hasNoOutstandingStarts()) {
            return schedule;
        }
        long started = schedule.entries().stream().filter(e -> e.status() == FleetStartStatus.STARTED).count();
        Map<String, String> details = new LinkedHashMap<>();
        details.put("fleetsStarted", Long.toString(started));
        details.put("fleets", Integer.toString(schedule.entries().size()));
        events.add(StartEvent.forSchedule(StartEventType.SCHEDULE_COMPLETED, schedule.id(), now, details));
        return schedule.toBuilder().status(ScheduleStatus.COMPLETED).updatedAt(now).build();
    }

    /**
     * Slot for a recalled fleet: right after the last fleet still waiting to
     * start, or its old slot if none is waiting. Postponed and abandoned
     * fleets further down keep their place behind it.
     */
    private static int requeuePosition(List<FleetStartEntry> remaining, int recalledFrom) {
        for (int i = remaining.size() - 1; i >= 0; i--) {
            if (remaining.get(i).status() == FleetStartStatus.PENDING) {
                return Math.max(i + 1, recalledFrom);
            }
        }
        return recalledFrom;
    }

    /**
     * True if the entry's warning would be the schedule's first: no fleet
     * anywhere has started or is in sequence, and no pending fleet is ahead of it.
     */
    private static boolean isFirstUnstarted(StartSchedule schedule, FleetStartEntry entry) {
        for (FleetStartEntry e : schedule.entries()) {
            if (e.status() == FleetStartStatus.STARTED || e.status().isSignaling()) {
                return false;
            }
        }
        for (FleetStartEntry e : schedule.entries()) {
            if (e.id().equals(entry.id())) {
                return true;
            }
            if (e.status() == FleetStartStatus.PENDING) {
                return false;
            }
        }
        return false;
    }

    private static List<FleetStartEntry> replace(StartSchedule schedule, FleetStartEntry updated) {
        List<FleetStartEntry> out = new ArrayList<>(schedule.entries().size());
        for (FleetStartEntry e : schedule.entries()) {
            out.add(e.id().equals(updated.id()) ? updated : e);
        }
        return out;
    }

    private static List<FleetStartEntry> renumber(List<FleetStartEntry> ordered) {
        List<FleetStartEntry> out = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            FleetStartEntry e = ordered.get(i);
            out.add(e.startOrder() == i + 1 ? e : e.toBuilder().startOrder(i + 1).build());
        }
        return out;
    }

    private static FleetStartEntry requireEntry(StartSchedule schedule, String entryId) {
        return schedule.entry(entryId).orElseThrow(() -> new EntryNotFoundException(entryId));
    }

    private static void requireDraft(StartSchedule schedule, String command) {
        requireStatus(schedule, EnumSet.of(ScheduleStatus.DRAFT), command);
    }

    private static void requireStatus(StartSchedule schedule, Set<ScheduleStatus> allowed, String command) {
        if (!allowed.contains(schedule.status())) {
            throw new ScheduleNotReadyException(schedule.id(), schedule.status(),
                    command + " is not allowed while schedule " + schedule.id() + " is "
                            + schedule.status().name().toLowerCase());
        }
    }

    private static StartEvent entryEvent(StartEventType type, FleetStartEntry entry, Instant now,
                                         Map<String, String> extra) {
        Map<String, String> details = describe(entry);
        details.putAll(extra);
        return StartEvent.forEntry(type, entry.scheduleId(), entry.id(), now, details);
    }

    private static Map<String, String> describe(FleetStartEntry entry) {
        Map<String, String> d = new LinkedHashMap<>();
        d.put(CommitteeLogEntry.KEY_FLEET_NAME, entry.fleetName());
        entry.classFlag().ifPresent(f -> d.put(CommitteeLogEntry.KEY_CLASS_FLAG, f));
        d.put(CommitteeLogEntry.KEY_RACE_NUMBER, Integer.toString(entry.raceNumber()));
        d.put("startOrder", Integer.toString(entry.startOrder()));
        d.put("status", entry.status().wireName());
        return d;
    }

    private static void putReason(Map<String, String> details, String reason) {
        if (reason != null && !reason.isBlank()) {
            details.put(CommitteeLogEntry.KEY_REASON, reason);
        }
    }
}
