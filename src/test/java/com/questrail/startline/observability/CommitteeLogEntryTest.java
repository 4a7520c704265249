package com.questrail.startline.observability;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommitteeLogEntryTest {

    private static final Instant T = Instant.parse("2026-06-14T10:00:00Z");

    private static StartEvent fleetEvent(StartEventType type, String... extra) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put(CommitteeLogEntry.KEY_FLEET_NAME, "Lasers");
        details.put(CommitteeLogEntry.KEY_CLASS_FLAG, "L");
        details.put(CommitteeLogEntry.KEY_RACE_NUMBER, "3");
        for (int i = 0; i < extra.length; i += 2) {
            details.put(extra[i], extra[i + 1]);
        }
        return StartEvent.forEntry(type, "s1", "e1", T, details);
    }

    @Test
    void warningHoistsTheClassFlag() {
        CommitteeLogEntry entry = CommitteeLogEntry.describe(fleetEvent(StartEventType.WARNING_SIGNALED));

        assertEquals("signal", entry.category());
        assertEquals("Warning Signal: Lasers", entry.title());
        assertEquals("Race 3 - Lasers", entry.description());
        assertEquals(List.of("L"), entry.flags());
        assertEquals(1, entry.soundSignals());
    }

    @Test
    void warningWithoutAClassFlagFallsBackToTheGenericFlag() {
        StartEvent event = StartEvent.forEntry(StartEventType.WARNING_SIGNALED, "s1", "e1", T,
                Map.of(CommitteeLogEntry.KEY_FLEET_NAME, "Optimists"));

        assertEquals(List.of("Class"), CommitteeLogEntry.describe(event).flags());
    }

    @Test
    void startIsATimingRecord() {
        CommitteeLogEntry entry = CommitteeLogEntry.describe(fleetEvent(StartEventType.START_SIGNALED));

        assertEquals("timing", entry.category());
        assertEquals("Race Start: Lasers", entry.title());
        assertTrue(entry.flags().isEmpty());
    }

    @Test
    void generalRecallUsesFirstSubstituteAndTwoSounds() {
        CommitteeLogEntry entry = CommitteeLogEntry.describe(
                fleetEvent(StartEventType.GENERAL_RECALL, CommitteeLogEntry.KEY_REASON, "Whole line over"));

        assertEquals(List.of("First Substitute"), entry.flags());
        assertEquals(2, entry.soundSignals());
        assertEquals("Whole line over", entry.description());
    }

    @Test
    void individualRecallListsTheBoats() {
        CommitteeLogEntry entry = CommitteeLogEntry.describe(
                fleetEvent(StartEventType.INDIVIDUAL_RECALL, CommitteeLogEntry.KEY_BOATS, "GBR 123, GBR 7"));

        assertEquals(List.of("X"), entry.flags());
        assertEquals("Individual recall for boats: GBR 123, GBR 7", entry.description());
    }

    @Test
    void postponementAndAbandonmentFlags() {
        CommitteeLogEntry ap = CommitteeLogEntry.describe(fleetEvent(StartEventType.POSTPONED));
        CommitteeLogEntry n = CommitteeLogEntry.describe(fleetEvent(StartEventType.ABANDONED));

        assertEquals(List.of("AP"), ap.flags());
        assertEquals(2, ap.soundSignals());
        assertEquals(List.of("N"), n.flags());
        assertEquals(3, n.soundSignals());
    }

    @Test
    void scheduleEventsAreTitledFromTheirType() {
        CommitteeLogEntry entry = CommitteeLogEntry.describe(
                StartEvent.forSchedule(StartEventType.SCHEDULE_COMPLETED, "s1", T, Map.of()));

        assertEquals("schedule", entry.category());
        assertEquals("Schedule Completed", entry.title());
        assertEquals("schedule_completed", entry.description());
        assertEquals(0, entry.soundSignals());
    }
}
