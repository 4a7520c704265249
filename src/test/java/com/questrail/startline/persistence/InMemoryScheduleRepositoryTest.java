package com.questrail.startline.persistence;

import com.questrail.startline.error.PersistenceConflictException;
import com.questrail.startline.model.FleetStartEntry;
import com.questrail.startline.model.SequenceProfiles;
import com.questrail.startline.model.StartSchedule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryScheduleRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-06-14T08:00:00Z");

    private final InMemoryScheduleRepository repository = new InMemoryScheduleRepository();

    private static StartSchedule schedule(String id, String regatta, LocalDate date, String... entryIds) {
        StartSchedule.Builder b = StartSchedule.builder()
                .id(id)
                .regattaId(regatta)
                .name("Race day " + id)
                .scheduledDate(date)
                .sequence(SequenceProfiles.builtIn(SequenceProfiles.FIVE_FOUR_ONE_GO))
                .createdAt(T0)
                .updatedAt(T0);
        FleetStartEntry[] entries = new FleetStartEntry[entryIds.length];
        for (int i = 0; i < entryIds.length; i++) {
            entries[i] = FleetStartEntry.builder()
                    .id(entryIds[i])
                    .scheduleId(id)
                    .fleetName("Fleet " + entryIds[i])
                    .startOrder(i + 1)
                    .build();
        }
        return b.entries(List.of(entries)).build();
    }

    @Test
    void insertStoresVersionOne() {
        StartSchedule stored = repository.insert(schedule("s1", "r1", LocalDate.of(2026, 6, 14), "e1"));

        assertEquals(1, stored.version());
        assertEquals(stored, repository.findById("s1").orElseThrow());
        assertEquals("s1", repository.findScheduleIdForEntry("e1").orElseThrow());
    }

    @Test
    void insertingATakenIdConflicts() {
        repository.insert(schedule("s1", "r1", LocalDate.of(2026, 6, 14)));

        PersistenceConflictException e = assertThrows(PersistenceConflictException.class,
                () -> repository.insert(schedule("s1", "r1", LocalDate.of(2026, 6, 15))));
        assertEquals(1, e.actualVersion());
        assertEquals(LocalDate.of(2026, 6, 14), repository.findById("s1").orElseThrow().scheduledDate());
    }

    @Test
    void saveIncrementsTheVersion() {
        StartSchedule v1 = repository.insert(schedule("s1", "r1", LocalDate.of(2026, 6, 14)));
        StartSchedule v2 = repository.save(v1.toBuilder().name("Renamed").build());

        assertEquals(2, v2.version());
        assertEquals("Renamed", repository.findById("s1").orElseThrow().name());
    }

    @Test
    void staleSaveConflictsAndStoresNothing() {
        StartSchedule v1 = repository.insert(schedule("s1", "r1", LocalDate.of(2026, 6, 14)));
        repository.save(v1.toBuilder().name("First writer").build());

        PersistenceConflictException e = assertThrows(PersistenceConflictException.class,
                () -> repository.save(v1.toBuilder().name("Second writer").build()));

        assertEquals(1, e.expectedVersion());
        assertEquals(2, e.actualVersion());
        assertTrue(e.isRetryable());
        assertEquals("First writer", repository.findById("s1").orElseThrow().name());
    }

    @Test
    void savingAMissingScheduleConflicts() {
        StartSchedule detached = schedule("s1", "r1", LocalDate.of(2026, 6, 14)).toBuilder().version(3).build();

        assertThrows(PersistenceConflictException.class, () -> repository.save(detached));
        assertTrue(repository.findById("s1").isEmpty());
    }

    @Test
    void regattaSchedulesComeBackInDateOrder() {
        repository.insert(schedule("sun", "r1", LocalDate.of(2026, 6, 15)));
        repository.insert(schedule("sat", "r1", LocalDate.of(2026, 6, 14)));
        repository.insert(schedule("other", "r2", LocalDate.of(2026, 6, 13)));

        List<StartSchedule> r1 = repository.findByRegatta("r1");

        assertEquals(List.of("sat", "sun"), r1.stream().map(StartSchedule::id).toList());
        assertTrue(repository.findByRegatta("r3").isEmpty());
    }

    @Test
    void entryIndexFollowsSavedEntries() {
        StartSchedule v1 = repository.insert(schedule("s1", "r1", LocalDate.of(2026, 6, 14), "e1", "e2"));
        StartSchedule withoutE1 = schedule("s1", "r1", LocalDate.of(2026, 6, 14), "e2", "e3")
                .toBuilder().version(v1.version()).build();

        repository.save(withoutE1);

        assertTrue(repository.findScheduleIdForEntry("e1").isEmpty());
        assertEquals("s1", repository.findScheduleIdForEntry("e2").orElseThrow());
        assertEquals("s1", repository.findScheduleIdForEntry("e3").orElseThrow());
    }

    @Test
    void deleteChecksTheVersionAndClearsTheIndex() {
        StartSchedule v1 = repository.insert(schedule("s1", "r1", LocalDate.of(2026, 6, 14), "e1"));
        repository.save(v1);

        assertThrows(PersistenceConflictException.class, () -> repository.delete("s1", 1));
        assertTrue(repository.findById("s1").isPresent());

        repository.delete("s1", 2);

        assertTrue(repository.findById("s1").isEmpty());
        assertTrue(repository.findScheduleIdForEntry("e1").isEmpty());
    }

    @Test
    void deletingAnUnknownScheduleIsANoOp() {
        assertDoesNotThrow(() -> repository.delete("missing", 1));
    }
}
