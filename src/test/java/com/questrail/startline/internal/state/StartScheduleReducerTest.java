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
import com.questrail.startline.model.FleetStartEntry;
import com.questrail.startline.model.FleetStartStatus;
import com.questrail.startline.model.ScheduleStatus;
import com.questrail.startline.model.SequenceProfiles;
import com.questrail.startline.model.SignalStage;
import com.questrail.startline.model.StartSchedule;
import com.questrail.startline.observability.StartEvent;
import com.questrail.startline.observability.StartEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StartScheduleReducerTest
 * -----------------------------------------------------------------------------
 * Unit tests for the pure schedule reducer.
 *
 * These tests deliberately:
 * <ul>
 *   <li>do not involve a repository</li>
 *   <li>do not involve locking</li>
 *   <li>do not involve timers</li>
 * </ul>
 *
 * Given a snapshot and a command, they check the next snapshot and the events
 * describing it.
 */
class StartScheduleReducerTest {

    private StartScheduleReducer reducer;
    private StartSchedule schedule;

    private static Instant at(String hhmmss) {
        return Instant.parse("2026-06-14T" + hhmmss + "Z");
    }

    @BeforeEach
    void setUp() {
        reducer = new StartScheduleReducer(SchedulerConfig.defaults());
        schedule = reducer.create("s1", definition(at("10:00:00")), at("08:00:00")).schedule();
    }

    private static ScheduleDefinition definition(Instant firstWarning) {
        return ScheduleDefinition.builder()
                .withRegattaId("r1")
                .withName("Saturday")
                .withScheduledDate(LocalDate.of(2026, 6, 14))
                .withFirstWarningTime(firstWarning)
                .build();
    }

    private StartScheduleReducer.Result apply(ScheduleCommand command, String hhmmss) {
        StartScheduleReducer.Result result = reducer.apply(schedule, command, at(hhmmss));
        schedule = result.schedule();
        return result;
    }

    private void addFleets(String... names) {
        List<ScheduleCommand.NewFleet> fleets = new ArrayList<>();
        for (String n : names) {
            fleets.add(new ScheduleCommand.NewFleet(n.toLowerCase(), FleetEntryRequest.of(n, 1).withClassFlag(n + "-flag")));
        }
        apply(new ScheduleCommand.AddFleets(fleets), "08:10:00");
    }

    private void readyAndStart(String... names) {
        addFleets(names);
        apply(new ScheduleCommand.MarkReady(), "09:00:00");
        apply(new ScheduleCommand.StartSequence(), "10:00:00");
    }

    private FleetStartEntry entry(String id) {
        return schedule.entry(id).orElseThrow();
    }

    private static List<StartEventType> types(StartScheduleReducer.Result r) {
        return r.events().stream().map(StartEvent::eventType).collect(Collectors.toList());
    }

    private List<String> order() {
        return schedule.entries().stream().map(FleetStartEntry::id).collect(Collectors.toList());
    }

    private void signal(String id, SignalStage stage, String hhmmss) {
        apply(new ScheduleCommand.Signal(id, stage), hhmmss);
    }

    private void startFirstFleet() {
        signal("a", SignalStage.PREPARATORY, "10:01:00");
        signal("a", SignalStage.ONE_MINUTE, "10:04:00");
        signal("a", SignalStage.START, "10:05:00");
    }

    private void assertStartOrderIsDense() {
        List<FleetStartEntry> entries = schedule.entries();
        for (int i = 0; i < entries.size(); i++) {
            assertEquals(i + 1, entries.get(i).startOrder(), entries.get(i).id());
        }
        assertEquals(entries.size(), Set.copyOf(order()).size());
    }

    /** Pending fleets in list order: warning, then start, then the next warning. */
    private void assertPendingChainOrdered() {
        List<FleetStartEntry> pending = schedule.entries().stream()
                .filter(e -> e.status() == FleetStartStatus.PENDING)
                .collect(Collectors.toList());
        for (int i = 0; i < pending.size(); i++) {
            FleetStartEntry e = pending.get(i);
            Instant warning = e.plannedWarningTime().orElseThrow();
            Instant start = e.plannedStartTime().orElseThrow();
            assertFalse(start.isBefore(warning), e.id());
            if (i + 1 < pending.size()) {
                Instant nextWarning = pending.get(i + 1).plannedWarningTime().orElseThrow();
                assertFalse(nextWarning.isBefore(start), e.id() + " then " + pending.get(i + 1).id());
            }
        }
    }

    // ---------------------------------------------------------------------
    // Creation and structural edits
    // ---------------------------------------------------------------------

    @Test
    void createAppliesConfiguredDefaults() {
        assertEquals(ScheduleStatus.DRAFT, schedule.status());
        assertEquals(SequenceProfiles.FIVE_FOUR_ONE_GO, schedule.sequenceType());
        assertEquals(5, schedule.startIntervalMinutes());
        assertTrue(schedule.entries().isEmpty());
    }

    @Test
    void addedFleetsArePlannedInOrder() {
        StartScheduleReducer.Result r = reducer.apply(schedule, new ScheduleCommand.AddFleets(List.of(
                new ScheduleCommand.NewFleet("a", FleetEntryRequest.of("A", 1)),
                new ScheduleCommand.NewFleet("b", FleetEntryRequest.of("B", 1)))), at("08:10:00"));

        assertEquals(List.of(StartEventType.FLEETS_ADDED), types(r));
        assertEquals(Optional.of("2"), r.events().get(0).detail("count"));
        FleetStartEntry b = r.schedule().entry("b").orElseThrow();
        assertEquals(2, b.startOrder());
        assertEquals(Optional.of(at("10:05:00")), b.plannedWarningTime());
        assertEquals(Optional.of(at("10:10:00")), b.plannedStartTime());
    }

    @Test
    void addingNothingChangesNothing() {
        StartScheduleReducer.Result r = reducer.apply(schedule, new ScheduleCommand.AddFleets(List.of()), at("08:10:00"));
        assertFalse(r.changed());
        assertSame(schedule, r.schedule());
    }

    @Test
    void removeFleetClosesTheGap() {
        addFleets("A", "B", "C");
        StartScheduleReducer.Result r = apply(new ScheduleCommand.RemoveFleet("b"), "08:20:00");

        assertEquals(List.of(StartEventType.FLEET_REMOVED), types(r));
        assertEquals(List.of("a", "c"), order());
        assertEquals(2, entry("c").startOrder());
        assertEquals(Optional.of(at("10:05:00")), entry("c").plannedWarningTime());
    }

    @Test
    void updateFleetReplansTheChain() {
        addFleets("A", "B");
        StartScheduleReducer.Result r = apply(new ScheduleCommand.UpdateFleet("a", FleetUpdate.customInterval(10)), "08:20:00");

        assertEquals(List.of(StartEventType.FLEET_UPDATED), types(r));
        assertEquals(Optional.of(at("10:10:00")), entry("b").plannedWarningTime());

        apply(new ScheduleCommand.UpdateFleet("a", new FleetUpdate(null, null, null, null, true)), "08:21:00");
        assertEquals(Optional.of(at("10:05:00")), entry("b").plannedWarningTime());
    }

    @Test
    void updateFleetThatChangesNothingEmitsNothing() {
        addFleets("A");
        StartSchedule before = schedule;
        StartScheduleReducer.Result r = reducer.apply(schedule,
                new ScheduleCommand.UpdateFleet("a", FleetUpdate.rename("A")), at("08:20:00"));

        assertFalse(r.changed());
        assertSame(before, r.schedule());
    }

    @Test
    void reorderRenumbersAndReplans() {
        addFleets("A", "B", "C");
        StartScheduleReducer.Result r = apply(new ScheduleCommand.ReorderFleets(List.of("c", "a", "b")), "08:30:00");

        assertEquals(List.of("c", "a", "b"), order());
        assertEquals(Optional.of("c,a,b"), r.events().get(0).detail("order"));
        assertEquals(Optional.of(at("10:00:00")), entry("c").plannedWarningTime());
        assertEquals(Optional.of(at("10:10:00")), entry("b").plannedWarningTime());
    }

    @Test
    void reorderMustNameEveryEntryExactlyOnce() {
        addFleets("A", "B", "C");
        StartSchedule before = schedule;

        assertThrows(DuplicateStartOrderException.class,
                () -> reducer.apply(before, new ScheduleCommand.ReorderFleets(List.of("a", "a", "b")), at("08:30:00")));
        assertThrows(DuplicateStartOrderException.class,
                () -> reducer.apply(before, new ScheduleCommand.ReorderFleets(List.of("a", "b")), at("08:30:00")));
        assertThrows(EntryNotFoundException.class,
                () -> reducer.apply(before, new ScheduleCommand.ReorderFleets(List.of("a", "b", "x")), at("08:30:00")));
        assertEquals(List.of("a", "b", "c"), before.entries().stream().map(FleetStartEntry::id).toList());
    }

    @Test
    void addReorderAndReadyKeepEveryFleet() {
        addFleets("A", "B", "C", "D");
        apply(new ScheduleCommand.ReorderFleets(List.of("d", "b", "a", "c")), "08:30:00");
        apply(new ScheduleCommand.MarkReady(), "09:00:00");

        assertEquals(ScheduleStatus.READY, schedule.status());
        assertEquals(4, schedule.entries().size());
        assertEquals(Set.of("a", "b", "c", "d"), Set.copyOf(order()));
        assertEquals(List.of("d", "b", "a", "c"), order());
        assertStartOrderIsDense();
        assertPendingChainOrdered();
    }

    @Test
    void updateScheduleSwitchesSequence() {
        addFleets("A", "B");
        apply(new ScheduleCommand.UpdateSchedule(ScheduleUpdate.builder()
                .withSequenceType(SequenceProfiles.THREE_TWO_ONE_GO)
                .build()), "08:40:00");

        assertEquals(SequenceProfiles.THREE_TWO_ONE_GO, schedule.sequenceType());
        assertEquals(Optional.of(at("10:03:00")), entry("a").plannedStartTime());
        assertEquals(Optional.of(at("10:05:00")), entry("b").plannedWarningTime());
    }

    @Test
    void structuralEditsAreRefusedOnceReady() {
        addFleets("A");
        apply(new ScheduleCommand.MarkReady(), "09:00:00");

        assertThrows(ScheduleNotReadyException.class, () -> reducer.apply(schedule,
                new ScheduleCommand.AddFleets(List.of(new ScheduleCommand.NewFleet("z", FleetEntryRequest.of("Z", 1)))),
                at("09:01:00")));
        assertThrows(ScheduleNotReadyException.class,
                () -> reducer.apply(schedule, new ScheduleCommand.RemoveFleet("a"), at("09:01:00")));
    }

    @Test
    void markReadyNeedsAtLeastOneFleet() {
        assertThrows(ScheduleNotReadyException.class,
                () -> reducer.apply(schedule, new ScheduleCommand.MarkReady(), at("09:00:00")));
    }

    // ---------------------------------------------------------------------
    // Sequence
    // ---------------------------------------------------------------------

    @Test
    void startSequenceWarnsTheFirstFleet() {
        addFleets("A", "B");
        apply(new ScheduleCommand.MarkReady(), "09:00:00");
        StartScheduleReducer.Result r = apply(new ScheduleCommand.StartSequence(), "10:00:00");

        assertEquals(List.of(StartEventType.SEQUENCE_STARTED, StartEventType.WARNING_SIGNALED), types(r));
        assertEquals(ScheduleStatus.ACTIVE, schedule.status());
        assertEquals(FleetStartStatus.WARNING, r.entry().orElseThrow().status());
        assertEquals(Optional.of(at("10:00:00")), schedule.actualFirstWarningTime());
        assertEquals(Optional.of("A"), r.events().get(1).detail("fleetName"));
    }

    @Test
    void startSequenceWithoutPlannedTimeUsesNow() {
        schedule = reducer.create("s2", definition(null), at("08:00:00")).schedule();
        readyAndStart("A", "B");

        assertEquals(Optional.of(at("10:00:00")), schedule.firstWarningTime());
        assertEquals(Optional.of(at("10:05:00")), entry("b").plannedWarningTime());
    }

    @Test
    void startSequenceRequiresReady() {
        addFleets("A");
        assertThrows(ScheduleNotReadyException.class,
                () -> reducer.apply(schedule, new ScheduleCommand.StartSequence(), at("10:00:00")));
    }

    @Test
    void signalsAreRefusedBeforeTheSequenceStarts() {
        addFleets("A");
        apply(new ScheduleCommand.MarkReady(), "09:00:00");
        assertThrows(ScheduleNotReadyException.class,
                () -> reducer.apply(schedule, new ScheduleCommand.Signal("a", SignalStage.WARNING), at("10:00:00")));
    }

    @Test
    void startOnPendingFleetIsAnInvalidTransition() {
        readyAndStart("A", "B");
        StartSchedule before = schedule;

        InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                () -> reducer.apply(before, new ScheduleCommand.Signal("b", SignalStage.START), at("10:01:00")));
        assertEquals(FleetStartStatus.PENDING, e.currentStatus());
        assertEquals(FleetStartStatus.PENDING, before.entry("b").orElseThrow().status());
        assertEquals(FleetStartStatus.WARNING, before.entry("a").orElseThrow().status());
    }

    @Test
    void warningWaitsForTheFleetInSequence() {
        readyAndStart("A", "B", "C");

        assertThrows(InvalidTransitionException.class,
                () -> reducer.apply(schedule, new ScheduleCommand.Signal("b", SignalStage.WARNING), at("10:02:00")));
    }

    @Test
    void fullSequenceStampsActualTimes() {
        readyAndStart("A");
        signal("a", SignalStage.PREPARATORY, "10:01:00");
        signal("a", SignalStage.ONE_MINUTE, "10:04:00");
        StartScheduleReducer.Result r = apply(new ScheduleCommand.Signal("a", SignalStage.START), "10:05:02");

        FleetStartEntry a = entry("a");
        assertEquals(FleetStartStatus.STARTED, a.status());
        assertEquals(Optional.of(at("10:00:00")), a.actualWarningTime());
        assertEquals(Optional.of(at("10:01:00")), a.actualPrepTime());
        assertEquals(Optional.of(at("10:04:00")), a.actualOneMinuteTime());
        assertEquals(Optional.of(at("10:05:02")), a.actualStartTime());
        assertEquals(List.of(StartEventType.START_SIGNALED, StartEventType.SCHEDULE_COMPLETED), types(r));
        assertEquals(ScheduleStatus.COMPLETED, schedule.status());
    }

    @Test
    void startAutoAdvancesTheNextFleet() {
        readyAndStart("A", "B");
        signal("a", SignalStage.PREPARATORY, "10:01:00");
        signal("a", SignalStage.ONE_MINUTE, "10:04:00");
        StartScheduleReducer.Result r = apply(new ScheduleCommand.Signal("a", SignalStage.START), "10:05:00");

        assertEquals(List.of(StartEventType.START_SIGNALED, StartEventType.WARNING_SIGNALED), types(r));
        assertEquals(Optional.of("true"), r.events().get(1).detail("autoAdvanced"));
        assertEquals(FleetStartStatus.WARNING, entry("b").status());
        assertEquals(Optional.of(at("10:05:00")), entry("b").actualWarningTime());
        assertEquals("a", r.entryId());
    }

    @Test
    void noAutoAdvanceWhenTheNextWarningIsLater() {
        addFleets("A", "B");
        apply(new ScheduleCommand.UpdateFleet("a", FleetUpdate.customInterval(10)), "08:20:00");
        apply(new ScheduleCommand.MarkReady(), "09:00:00");
        apply(new ScheduleCommand.StartSequence(), "10:00:00");
        signal("a", SignalStage.PREPARATORY, "10:01:00");
        signal("a", SignalStage.ONE_MINUTE, "10:04:00");
        StartScheduleReducer.Result r = apply(new ScheduleCommand.Signal("a", SignalStage.START), "10:05:00");

        assertEquals(List.of(StartEventType.START_SIGNALED), types(r));
        assertEquals(FleetStartStatus.PENDING, entry("b").status());
        assertEquals(Optional.of(at("10:10:00")), entry("b").plannedWarningTime());
    }

    @Test
    void autoAdvanceCanBeSwitchedOff() {
        reducer = new StartScheduleReducer(SchedulerConfig.builder().withAutoAdvance(false).build());
        readyAndStart("A", "B");
        signal("a", SignalStage.PREPARATORY, "10:01:00");
        signal("a", SignalStage.ONE_MINUTE, "10:04:00");
        signal("a", SignalStage.START, "10:05:00");

        assertEquals(FleetStartStatus.PENDING, entry("b").status());
        signal("b", SignalStage.WARNING, "10:05:30");
        assertEquals(Optional.of(at("10:05:30")), entry("b").actualWarningTime());
    }

    // ---------------------------------------------------------------------
    // Race control
    // ---------------------------------------------------------------------

    @Test
    void generalRecallSendsTheFleetToTheBack() {
        readyAndStart("A", "B", "C");
        signal("a", SignalStage.PREPARATORY, "10:01:00");
        signal("a", SignalStage.ONE_MINUTE, "10:04:00");
        signal("a", SignalStage.START, "10:05:00");
        signal("b", SignalStage.PREPARATORY, "10:06:00");

        StartScheduleReducer.Result r = apply(new ScheduleCommand.GeneralRecall("b", "OCS"), "10:06:30");

        assertEquals(List.of("a", "c", "b"), order());
        FleetStartEntry b = entry("b");
        assertEquals(FleetStartStatus.PENDING, b.status());
        assertEquals(1, b.recallCount());
        assertTrue(b.actualWarningTime().isEmpty());
        assertEquals(Optional.of(at("10:06:30")), b.lastRecallAt());
        assertEquals(Optional.of(at("10:05:00")), entry("c").plannedWarningTime());
        assertEquals(Optional.of(at("10:10:00")), entry("c").plannedStartTime());
        assertEquals(Optional.of(at("10:10:00")), b.plannedWarningTime());
        assertEquals(Optional.of(at("10:15:00")), b.plannedStartTime());

        StartEvent event = r.events().get(0);
        assertEquals(StartEventType.GENERAL_RECALL, event.eventType());
        assertEquals(Optional.of("3"), event.detail("newStartOrder"));
        assertEquals(Optional.of("OCS"), event.detail("reason"));
    }

    @Test
    void recalledFleetGoesBehindTheLastPendingFleetNotBehindAnAbandonedOne() {
        readyAndStart("A", "B", "C", "D");
        startFirstFleet();
        assertEquals(FleetStartStatus.WARNING, entry("b").status());
        apply(new ScheduleCommand.Abandon("d", "gear failure"), "10:05:30");

        StartScheduleReducer.Result r = apply(new ScheduleCommand.GeneralRecall("b", null), "10:06:00");

        assertEquals(List.of("a", "c", "b", "d"), order());
        assertEquals(Optional.of("3"), r.events().get(0).detail("newStartOrder"));
        assertEquals(FleetStartStatus.ABANDONED, entry("d").status());
        assertEquals(4, entry("d").startOrder());
        assertEquals(Optional.of(at("10:10:00")), entry("b").plannedWarningTime());
        assertStartOrderIsDense();
    }

    @Test
    void recallingTheFleetThatMovedUpKeepsStartOrderDense() {
        readyAndStart("A", "B", "C", "D");
        startFirstFleet();
        apply(new ScheduleCommand.GeneralRecall("b", null), "10:06:00");
        assertEquals(List.of("a", "c", "d", "b"), order());

        signal("c", SignalStage.WARNING, "10:07:00");
        apply(new ScheduleCommand.GeneralRecall("c", "OCS"), "10:08:00");

        assertEquals(List.of("a", "d", "b", "c"), order());
        assertEquals(1, entry("b").recallCount());
        assertEquals(1, entry("c").recallCount());
        assertStartOrderIsDense();
        assertPendingChainOrdered();
    }

    @Test
    void pendingChainStaysOrderedThroughRaceControl() {
        readyAndStart("A", "B", "C", "D", "E");
        signal("a", SignalStage.PREPARATORY, "10:01:00");

        apply(new ScheduleCommand.Postpone("c", "wind shift"), "10:02:00");
        assertPendingChainOrdered();

        signal("a", SignalStage.ONE_MINUTE, "10:04:00");
        signal("a", SignalStage.START, "10:05:00");
        apply(new ScheduleCommand.GeneralRecall("b", "OCS"), "10:06:00");
        assertEquals(List.of("a", "c", "d", "e", "b"), order());
        assertPendingChainOrdered();

        apply(new ScheduleCommand.Abandon("d", null), "10:06:30");
        assertPendingChainOrdered();

        apply(new ScheduleCommand.Resume("c", at("10:40:00")), "10:07:00");
        assertPendingChainOrdered();
        assertEquals(Optional.of(at("10:40:00")), entry("c").plannedWarningTime());
        assertEquals(Optional.of(at("10:45:00")), entry("e").plannedWarningTime());
        assertEquals(Optional.of(at("10:50:00")), entry("b").plannedWarningTime());
        assertStartOrderIsDense();
    }

    @Test
    void individualRecallMergesBoatsWithoutDuplicates() {
        readyAndStart("A");
        signal("a", SignalStage.PREPARATORY, "10:01:00");
        signal("a", SignalStage.ONE_MINUTE, "10:04:00");
        signal("a", SignalStage.START, "10:05:00");
        apply(new ScheduleCommand.IndividualRecall("a", List.of("12", "7")), "10:05:10");
        StartScheduleReducer.Result r = apply(new ScheduleCommand.IndividualRecall("a", List.of("7", "3")), "10:05:20");

        assertEquals(List.of("12", "7", "3"), entry("a").ocsBoatIds());
        assertEquals(FleetStartStatus.STARTED, entry("a").status());
        assertEquals(Optional.of("7, 3"), r.events().get(0).detail("boats"));
    }

    @Test
    void individualRecallNeedsBoats() {
        assertThrows(IllegalArgumentException.class, () -> new ScheduleCommand.IndividualRecall("a", List.of()));
    }

    @Test
    void postponeAndResumePushesTheChain() {
        readyAndStart("A", "B", "C");
        apply(new ScheduleCommand.Postpone("b", "wind shift"), "10:02:00");

        assertEquals(FleetStartStatus.POSTPONED, entry("b").status());
        assertEquals(Optional.of(at("10:05:00")), entry("c").plannedWarningTime());

        StartScheduleReducer.Result r = apply(new ScheduleCommand.Resume("b", at("10:30:00")), "10:20:00");

        assertEquals(List.of(StartEventType.RESUMED), types(r));
        assertEquals(FleetStartStatus.PENDING, entry("b").status());
        assertEquals(Optional.of(at("10:30:00")), entry("b").plannedWarningTime());
        assertEquals(Optional.of(at("10:35:00")), entry("c").plannedWarningTime());
        assertEquals(Optional.of(at("10:00:00")), schedule.firstWarningTime());
    }

    @Test
    void postponingAFleetInSequenceClearsItsSignals() {
        readyAndStart("A", "B");
        signal("a", SignalStage.PREPARATORY, "10:01:00");
        apply(new ScheduleCommand.Postpone("a", null), "10:02:00");

        FleetStartEntry a = entry("a");
        assertEquals(FleetStartStatus.POSTPONED, a.status());
        assertTrue(a.actualWarningTime().isEmpty());
        assertTrue(a.actualPrepTime().isEmpty());
    }

    @Test
    void postponeIsRefusedAfterTheOneMinuteSignal() {
        readyAndStart("A");
        signal("a", SignalStage.PREPARATORY, "10:01:00");
        signal("a", SignalStage.ONE_MINUTE, "10:04:00");

        assertThrows(InvalidTransitionException.class,
                () -> reducer.apply(schedule, new ScheduleCommand.Postpone("a", "late"), at("10:04:30")));
    }

    @Test
    void resumingTheFirstFleetMovesTheFirstWarning() {
        addFleets("A", "B");
        apply(new ScheduleCommand.MarkReady(), "09:00:00");
        apply(new ScheduleCommand.Postpone("a", "fog"), "09:30:00");
        assertEquals(Optional.of(at("10:00:00")), entry("b").plannedWarningTime());

        apply(new ScheduleCommand.Resume("a", at("10:20:00")), "09:45:00");

        assertEquals(ScheduleStatus.READY, schedule.status());
        assertEquals(Optional.of(at("10:20:00")), schedule.firstWarningTime());
        assertEquals(Optional.of(at("10:20:00")), entry("a").plannedWarningTime());
        assertEquals(Optional.of(at("10:25:00")), entry("b").plannedWarningTime());
    }

    @Test
    void resumingTheFirstFleetAfterAnotherHasStartedKeepsTheFirstWarning() {
        addFleets("A", "B");
        apply(new ScheduleCommand.MarkReady(), "09:00:00");
        apply(new ScheduleCommand.Postpone("a", "fog"), "09:30:00");
        apply(new ScheduleCommand.StartSequence(), "10:00:00");
        signal("b", SignalStage.PREPARATORY, "10:01:00");
        signal("b", SignalStage.ONE_MINUTE, "10:04:00");
        signal("b", SignalStage.START, "10:05:00");
        assertEquals(ScheduleStatus.COMPLETED, schedule.status());

        apply(new ScheduleCommand.Resume("a", at("10:20:00")), "10:10:00");

        assertEquals(ScheduleStatus.ACTIVE, schedule.status());
        assertEquals(Optional.of(at("10:00:00")), schedule.firstWarningTime());
        assertEquals(Optional.of(at("10:20:00")), entry("a").plannedWarningTime());
    }

    @Test
    void resumingTheFirstFleetWhileAnotherIsInSequenceKeepsTheFirstWarning() {
        addFleets("A", "B");
        apply(new ScheduleCommand.MarkReady(), "09:00:00");
        apply(new ScheduleCommand.Postpone("a", "fog"), "09:30:00");
        apply(new ScheduleCommand.StartSequence(), "10:00:00");
        assertEquals(FleetStartStatus.WARNING, entry("b").status());

        apply(new ScheduleCommand.Resume("a", at("10:20:00")), "10:02:00");

        assertEquals(Optional.of(at("10:00:00")), schedule.firstWarningTime());
        assertEquals(Optional.of(at("10:20:00")), entry("a").plannedWarningTime());
    }

    @Test
    void resumeReopensACompletedSchedule() {
        readyAndStart("A", "B");
        signal("a", SignalStage.PREPARATORY, "10:01:00");
        apply(new ScheduleCommand.Postpone("b", "breakdown"), "10:02:00");
        signal("a", SignalStage.ONE_MINUTE, "10:04:00");
        StartScheduleReducer.Result started = apply(new ScheduleCommand.Signal("a", SignalStage.START), "10:05:00");
        assertEquals(List.of(StartEventType.START_SIGNALED, StartEventType.SCHEDULE_COMPLETED), types(started));

        apply(new ScheduleCommand.Resume("b", at("10:30:00")), "10:10:00");

        assertEquals(ScheduleStatus.ACTIVE, schedule.status());
        assertEquals(Optional.of(at("10:30:00")), entry("b").plannedWarningTime());
        assertEquals(Optional.of(at("10:30:00")), entry("b").anchoredWarningTime());

        signal("b", SignalStage.WARNING, "10:30:00");
        assertTrue(entry("b").anchoredWarningTime().isEmpty());
    }

    @Test
    void abandoningTheLastOutstandingFleetCompletesTheSchedule() {
        readyAndStart("A");
        StartScheduleReducer.Result r = apply(new ScheduleCommand.Abandon("a", "no wind"), "10:02:00");

        assertEquals(List.of(StartEventType.ABANDONED, StartEventType.SCHEDULE_COMPLETED), types(r));
        assertEquals(FleetStartStatus.ABANDONED, entry("a").status());
        assertEquals(ScheduleStatus.COMPLETED, schedule.status());
    }

    @Test
    void startedFleetCannotBeAbandoned() {
        readyAndStart("A", "B");
        signal("a", SignalStage.PREPARATORY, "10:01:00");
        signal("a", SignalStage.ONE_MINUTE, "10:04:00");
        signal("a", SignalStage.START, "10:05:00");

        assertThrows(InvalidTransitionException.class,
                () -> reducer.apply(schedule, new ScheduleCommand.Abandon("a", null), at("10:06:00")));
    }

    @Test
    void deleteIsRefusedWhileActive() {
        readyAndStart("A");
        assertThrows(ScheduleNotReadyException.class, () -> reducer.delete(schedule, at("10:01:00")));
    }

    @Test
    void unknownEntryIsReported() {
        readyAndStart("A");
        EntryNotFoundException e = assertThrows(EntryNotFoundException.class,
                () -> reducer.apply(schedule, new ScheduleCommand.Signal("zz", SignalStage.PREPARATORY), at("10:01:00")));
        assertEquals("zz", e.entryId());
    }
}
