package com.questrail.startline.persistence;

import com.questrail.startline.error.PersistenceConflictException;
import com.questrail.startline.model.StartSchedule;

import java.util.List;
import java.util.Optional;

/**
 * ScheduleRepository
 * -----------------------------------------------------------------------------
 * Storage port for whole schedule aggregates.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>A schedule and its entries are loaded and saved together.</li>
 *   <li>{@link StartSchedule#version()} is owned by the repository. A save is
 *       accepted only if the snapshot carries the currently stored version;
 *       the stored copy then gets the next version.</li>
 *   <li>A stale save fails with {@link PersistenceConflictException} and
 *       stores nothing.</li>
 * </ul>
 * Which engine backs the port is up to the deployment.
 */
public interface ScheduleRepository
{
    Optional<StartSchedule> findById(String scheduleId);

    /**
     * Schedules of one regatta, earliest scheduled date first.
     */
    List<StartSchedule> findByRegatta(String regattaId);

    /**
     * Resolves the schedule that owns a fleet entry.
     */
    Optional<String> findScheduleIdForEntry(String entryId);

    /**
     * Stores a new schedule.
     *
     * @return the stored snapshot, at version 1
     * @throws PersistenceConflictException if the id is already taken
     */
    StartSchedule insert(StartSchedule schedule);

    /**
     * Replaces a stored schedule.
     *
     * @return the stored snapshot, with its version incremented
     * @throws PersistenceConflictException if {@code schedule.version()} is not
     *         the stored version, or the schedule no longer exists
     */
    StartSchedule save(StartSchedule schedule);

    /**
     * Removes a schedule and its entries.
     *
     * @throws PersistenceConflictException if the stored version differs
     */
    void delete(String scheduleId, long expectedVersion);
}
