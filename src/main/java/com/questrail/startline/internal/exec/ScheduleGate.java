package com.questrail.startline.internal.exec;

import com.questrail.startline.error.ScheduleBusyException;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * ScheduleGate
 * =============================================================================
 * Single-writer admission per schedule.
 *
 * <p>Each schedule id has its own lock; schedules never contend with each
 * other. A command that finds its schedule's lock held is refused at once
 * with {@link ScheduleBusyException}. Nothing waits.</p>
 */
public final class ScheduleGate
{
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Runs {@code body} while holding the schedule's lock.
     *
     * @throws ScheduleBusyException if another command holds the lock
     */
    public <T> T withSchedule(String scheduleId, Supplier<T> body) {
        Objects.requireNonNull(scheduleId, "scheduleId");
        Objects.requireNonNull(body, "body");

        ReentrantLock lock = locks.computeIfAbsent(scheduleId, id -> new ReentrantLock());
        if (!lock.tryLock()) {
            throw new ScheduleBusyException(scheduleId);
        }
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isBusy(String scheduleId) {
        ReentrantLock lock = locks.get(scheduleId);
        return lock != null && lock.isLocked();
    }

    /**
     * Drops the lock of a deleted schedule.
     */
    public void forget(String scheduleId) {
        locks.remove(scheduleId);
    }
}
