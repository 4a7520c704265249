package com.questrail.startline.persistence;

import com.questrail.startline.error.PersistenceConflictException;
import com.questrail.startline.model.FleetStartEntry;
import com.questrail.startline.model.StartSchedule;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * {@link ScheduleRepository} held in memory.
 *
 * <p>Each schedule is swapped atomically with {@link ConcurrentMap#compute}, so
 * the version check and the write are one step. Snapshots are immutable and
 * can be handed out without copying.</p>
 */
public final class InMemoryScheduleRepository implements ScheduleRepository
{
    private final ConcurrentMap<String, StartSchedule> schedules = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> scheduleByEntry = new ConcurrentHashMap<>();

    @Override
    public Optional<StartSchedule> findById(String scheduleId) {
        Objects.requireNonNull(scheduleId, "scheduleId");
        return Optional.ofNullable(schedules.get(scheduleId));
    }

    @Override
    public List<StartSchedule> findByRegatta(String regattaId) {
        Objects.requireNonNull(regattaId, "regattaId");
        return schedules.values().stream()
                .filter(s -> s.regattaId().equals(regattaId))
                .sorted(Comparator.comparing(StartSchedule::scheduledDate)
                        .thenComparing(StartSchedule::createdAt))
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public Optional<String> findScheduleIdForEntry(String entryId) {
        Objects.requireNonNull(entryId, "entryId");
        return Optional.ofNullable(scheduleByEntry.get(entryId));
    }

    @Override
    public StartSchedule insert(StartSchedule schedule) {
        Objects.requireNonNull(schedule, "schedule");
        StartSchedule stored = schedule.toBuilder().version(1).build();
        StartSchedule existing = schedules.putIfAbsent(schedule.id(), stored);
        if (existing != null) {
            throw new PersistenceConflictException(schedule.id(), 0, existing.version());
        }
        index(null, stored);
        return stored;
    }

    @Override
    public StartSchedule save(StartSchedule schedule) {
        Objects.requireNonNull(schedule, "schedule");
        return schedules.compute(schedule.id(), (id, current) -> {
            if (current == null) {
                throw new PersistenceConflictException(id, schedule.version(), 0);
            }
            if (current.version() != schedule.version()) {
                throw new PersistenceConflictException(id, schedule.version(), current.version());
            }
            StartSchedule stored = schedule.toBuilder().version(current.version() + 1).build();
            index(current, stored);
            return stored;
        });
    }

    @Override
    public void delete(String scheduleId, long expectedVersion) {
        Objects.requireNonNull(scheduleId, "scheduleId");
        schedules.compute(scheduleId, (id, current) -> {
            if (current == null) {
                return null;
            }
            if (current.version() != expectedVersion) {
                throw new PersistenceConflictException(id, expectedVersion, current.version());
            }
            index(current, null);
            return null;
        });
    }

    private void index(StartSchedule before, StartSchedule after) {
        Set<String> keep = new HashSet<>();
        if (after != null) {
            for (FleetStartEntry e : after.entries()) {
                keep.add(e.id());
                scheduleByEntry.put(e.id(), after.id());
            }
        }
        if (before != null) {
            for (FleetStartEntry e : before.entries()) {
                if (!keep.contains(e.id())) {
                    scheduleByEntry.remove(e.id(), before.id());
                }
            }
        }
    }
}
