package com.questrail.startline.core;

import com.questrail.startline.api.FleetEntryRequest;
import com.questrail.startline.api.FleetUpdate;
import com.questrail.startline.api.ScheduleDefinition;
import com.questrail.startline.api.ScheduleStatusSummary;
import com.questrail.startline.api.ScheduleUpdate;
import com.questrail.startline.api.StartScheduler;
import com.questrail.startline.api.TimelineEntry;
import com.questrail.startline.config.SchedulerConfig;
import com.questrail.startline.error.EntryNotFoundException;
import com.questrail.startline.error.PersistenceConflictException;
import com.questrail.startline.error.ScheduleNotFoundException;
import com.questrail.startline.error.StartSchedulerException;
import com.questrail.startline.internal.exec.ScheduleGate;
import com.questrail.startline.internal.state.ScheduleCommand;
import com.questrail.startline.internal.state.StartScheduleReducer;
import com.questrail.startline.internal.time.WallClock;
import com.questrail.startline.internal.timeline.SequenceCountdown;
import com.questrail.startline.model.FleetStartEntry;
import com.questrail.startline.model.SignalStage;
import com.questrail.startline.model.StartSchedule;
import com.questrail.startline.observability.CommandRejectedEvent;
import com.questrail.startline.observability.NullStartEventSink;
import com.questrail.startline.observability.SchedulerErrorEvent;
import com.questrail.startline.observability.StartEvent;
import com.questrail.startline.observability.StartEventSink;
import com.questrail.startline.persistence.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * RollingStartScheduler
 * =============================================================================
 * The {@link StartScheduler} implementation: owns locking, persistence and
 * event emission around the pure {@link StartScheduleReducer}.
 *
 * <h2>Command path</h2>
 * <pre>
 *   command ─▶ resolve schedule ─▶ ScheduleGate (try-lock)
 *           ─▶ load snapshot ─▶ reducer.apply ─▶ repository.save (version check)
 *           ─▶ publish events ─▶ return entry / schedule
 * </pre>
 * A stale save reloads the snapshot and re-applies the same command up to
 * {@link SchedulerConfig#maxConflictRetries()} times before the conflict is
 * surfaced. Any refusal is reported to {@link StartEventSink#onCommandRejected}
 * and rethrown.
 *
 * <h2>Events</h2>
 * Events are published only after the save succeeds, in the order the
 * reducer produced them, while the gate is still held, so listeners see each
 * schedule's history in commit order. A failing sink is reported and logged;
 * it never undoes a committed command.
 *
 * <h2>Queries</h2>
 * Queries read the repository's last committed snapshot without the gate.
 */
public final class RollingStartScheduler implements StartScheduler
{
    private static final Logger log = LoggerFactory.getLogger(RollingStartScheduler.class);

    private final ScheduleRepository repository;
    private final StartScheduleReducer reducer;
    private final ScheduleGate gate;
    private final WallClock clock;
    private final StartEventSink sink;
    private final Supplier<String> idGenerator;
    private final int maxConflictRetries;

    public RollingStartScheduler(ScheduleRepository repository,
                                 SchedulerConfig config,
                                 WallClock clock,
                                 StartEventSink sink,
                                 Supplier<String> idGenerator)
    {
        this.repository = Objects.requireNonNull(repository, "repository");
        Objects.requireNonNull(config, "config");
        this.reducer = new StartScheduleReducer(config);
        this.gate = new ScheduleGate();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sink = Objects.requireNonNullElse(sink, NullStartEventSink.INSTANCE);
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
        this.maxConflictRetries = config.maxConflictRetries();
    }

    public RollingStartScheduler(ScheduleRepository repository,
                                 SchedulerConfig config,
                                 WallClock clock,
                                 StartEventSink sink)
    {
        this(repository, config, clock, sink, () -> UUID.randomUUID().toString());
    }

    /**
     * The gate guarding this scheduler's schedules. Exposed for diagnostics.
     */
    public ScheduleGate gate() {
        return gate;
    }

    // ---------------------------------------------------------------------
    // Schedule management
    // ---------------------------------------------------------------------

    @Override
    public StartSchedule createSchedule(ScheduleDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        try {
            StartScheduleReducer.Result result = reducer.create(idGenerator.get(), definition, clock.now());
            StartSchedule saved = repository.insert(result.schedule());
            publish(result.events());
            return saved;
        } catch (StartSchedulerException e) {
            reportRejected(null, "createSchedule", e);
            throw e;
        }
    }

    @Override
    public StartSchedule updateSchedule(String scheduleId, ScheduleUpdate update) {
        return execute(scheduleId, new ScheduleCommand.UpdateSchedule(update)).schedule();
    }

    @Override
    public void deleteSchedule(String scheduleId) {
        Objects.requireNonNull(scheduleId, "scheduleId");
        try {
            gate.withSchedule(scheduleId, () -> {
                StartSchedule current = load(scheduleId);
                StartEvent deleted = reducer.delete(current, clock.now());
                repository.delete(scheduleId, current.version());
                publish(List.of(deleted));
                return null;
            });
            gate.forget(scheduleId);
        } catch (StartSchedulerException e) {
            reportRejected(scheduleId, "deleteSchedule", e);
            throw e;
        }
    }

    // ---------------------------------------------------------------------
    // Fleets
    // ---------------------------------------------------------------------

    @Override
    public List<FleetStartEntry> addFleets(String scheduleId, List<FleetEntryRequest> fleets) {
        Objects.requireNonNull(fleets, "fleets");
        List<ScheduleCommand.NewFleet> newFleets = new ArrayList<>(fleets.size());
        Set<String> ids = new HashSet<>();
        for (FleetEntryRequest f : fleets) {
            String id = idGenerator.get();
            ids.add(id);
            newFleets.add(new ScheduleCommand.NewFleet(id, f));
        }

        StartSchedule saved = execute(scheduleId, new ScheduleCommand.AddFleets(newFleets)).schedule();
        return saved.entries().stream().filter(e -> ids.contains(e.id())).toList();
    }

    @Override
    public StartSchedule removeFleet(String entryId) {
        return executeOnEntry(entryId, new ScheduleCommand.RemoveFleet(entryId)).schedule();
    }

    @Override
    public FleetStartEntry updateFleet(String entryId, FleetUpdate update) {
        return entryOf(executeOnEntry(entryId, new ScheduleCommand.UpdateFleet(entryId, update)));
    }

    @Override
    public List<FleetStartEntry> reorderFleets(String scheduleId, List<String> orderedEntryIds) {
        Objects.requireNonNull(orderedEntryIds, "orderedEntryIds");
        return execute(scheduleId, new ScheduleCommand.ReorderFleets(orderedEntryIds)).schedule().entries();
    }

    // ---------------------------------------------------------------------
    // Sequence control
    // ---------------------------------------------------------------------

    @Override
    public StartSchedule markReady(String scheduleId) {
        return execute(scheduleId, new ScheduleCommand.MarkReady()).schedule();
    }

    @Override
    public FleetStartEntry startSequence(String scheduleId) {
        return entryOf(execute(scheduleId, new ScheduleCommand.StartSequence()));
    }

    @Override
    public FleetStartEntry signalWarning(String entryId) {
        return signal(entryId, SignalStage.WARNING);
    }

    @Override
    public FleetStartEntry signalPreparatory(String entryId) {
        return signal(entryId, SignalStage.PREPARATORY);
    }

    @Override
    public FleetStartEntry signalOneMinute(String entryId) {
        return signal(entryId, SignalStage.ONE_MINUTE);
    }

    @Override
    public FleetStartEntry signalStart(String entryId) {
        return signal(entryId, SignalStage.START);
    }

    private FleetStartEntry signal(String entryId, SignalStage stage) {
        return entryOf(executeOnEntry(entryId, new ScheduleCommand.Signal(entryId, stage)));
    }

    // ---------------------------------------------------------------------
    // Race control
    // ---------------------------------------------------------------------

    @Override
    public FleetStartEntry generalRecall(String entryId, String reason) {
        return entryOf(executeOnEntry(entryId, new ScheduleCommand.GeneralRecall(entryId, reason)));
    }

    @Override
    public FleetStartEntry individualRecall(String entryId, List<String> boatIds) {
        Objects.requireNonNull(boatIds, "boatIds");
        return entryOf(executeOnEntry(entryId, new ScheduleCommand.IndividualRecall(entryId, boatIds)));
    }

    @Override
    public FleetStartEntry postpone(String entryId, String reason) {
        return entryOf(executeOnEntry(entryId, new ScheduleCommand.Postpone(entryId, reason)));
    }

    @Override
    public FleetStartEntry resume(String entryId, Instant newWarningTime) {
        return entryOf(executeOnEntry(entryId, new ScheduleCommand.Resume(entryId, newWarningTime)));
    }

    @Override
    public FleetStartEntry abandon(String entryId, String reason) {
        return entryOf(executeOnEntry(entryId, new ScheduleCommand.Abandon(entryId, reason)));
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    @Override
    public Optional<StartSchedule> getSchedule(String scheduleId) {
        return repository.findById(scheduleId);
    }

    @Override
    public List<StartSchedule> getSchedules(String regattaId) {
        return repository.findByRegatta(regattaId);
    }

    @Override
    public Optional<FleetStartEntry> getEntry(String entryId) {
        return repository.findScheduleIdForEntry(entryId)
                .flatMap(repository::findById)
                .flatMap(s -> s.entry(entryId));
    }

    @Override
    public List<TimelineEntry> getTimeline(String scheduleId) {
        return ScheduleViews.timeline(load(scheduleId));
    }

    @Override
    public ScheduleStatusSummary getStatusSummary(String scheduleId) {
        return ScheduleViews.summary(load(scheduleId));
    }

    @Override
    public Optional<SequenceCountdown.Countdown> countdown(String entryId) {
        StartSchedule schedule = repository.findScheduleIdForEntry(entryId)
                .flatMap(repository::findById)
                .orElseThrow(() -> new EntryNotFoundException(entryId));
        FleetStartEntry entry = schedule.entry(entryId).orElseThrow(() -> new EntryNotFoundException(entryId));
        return SequenceCountdown.of(entry, schedule.sequence(), clock.now());
    }

    // ---------------------------------------------------------------------
    // Command execution
    // ---------------------------------------------------------------------

    private StartScheduleReducer.Result executeOnEntry(String entryId, ScheduleCommand command) {
        Objects.requireNonNull(entryId, "entryId");
        Optional<String> scheduleId = repository.findScheduleIdForEntry(entryId);
        if (scheduleId.isEmpty()) {
            EntryNotFoundException e = new EntryNotFoundException(entryId);
            reportRejected(null, command.name(), e);
            throw e;
        }
        return execute(scheduleId.get(), command);
    }

    private StartScheduleReducer.Result execute(String scheduleId, ScheduleCommand command) {
        Objects.requireNonNull(scheduleId, "scheduleId");
        try {
            return gate.withSchedule(scheduleId, () -> commit(scheduleId, command));
        } catch (StartSchedulerException e) {
            reportRejected(scheduleId, command.name(), e);
            throw e;
        }
    }

    private StartScheduleReducer.Result commit(String scheduleId, ScheduleCommand command) {
        int attempt = 0;
        while (true) {
            StartSchedule current = load(scheduleId);
            StartScheduleReducer.Result result = reducer.apply(current, command, clock.now());
            if (!result.changed()) {
                return result;
            }
            try {
                StartSchedule saved = repository.save(result.schedule());
                publish(result.events());
                return new StartScheduleReducer.Result(saved, result.events(), result.entryId());
            } catch (PersistenceConflictException e) {
                if (attempt >= maxConflictRetries) {
                    throw e;
                }
                attempt++;
                log.debug("Schedule {}: {} hit a stale save, retrying ({}/{})",
                        scheduleId, command.name(), attempt, maxConflictRetries);
            }
        }
    }

    private StartSchedule load(String scheduleId) {
        return repository.findById(scheduleId).orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
    }

    private static FleetStartEntry entryOf(StartScheduleReducer.Result result) {
        return result.entry().orElseThrow(() -> new IllegalStateException(
                "Command result for schedule " + result.schedule().id() + " names no entry"));
    }

    // ---------------------------------------------------------------------
    // Emission
    // ---------------------------------------------------------------------

    private void publish(List<StartEvent> events) {
        for (StartEvent event : events) {
            try {
                sink.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Event sink failed on {} for schedule {}", event.eventType(), event.scheduleId(), e);
                reportError("Event sink failed on " + event.eventType().wireName(), e);
            }
        }
    }

    private void reportRejected(String scheduleId, String command, StartSchedulerException reason) {
        try {
            sink.onCommandRejected(new CommandRejectedEvent(clock.now(), scheduleId, command, reason));
        } catch (RuntimeException e) {
            log.error("Event sink failed while reporting rejected {}", command, e);
        }
    }

    private void reportError(String message, Throwable cause) {
        try {
            sink.onError(new SchedulerErrorEvent(clock.now(), message, cause));
        } catch (RuntimeException e) {
            log.error("Event sink failed while reporting error '{}'", message, e);
        }
    }
}
