package com.questrail.startline.error;

/**
 * The schedule was changed by someone else between load and save.
 *
 * <p>This is the only retryable failure: it means two officers raced on the
 * same schedule, not that the command itself was wrong.</p>
 */
public final class PersistenceConflictException extends StartSchedulerException
{
    private final String scheduleId;
    private final long expectedVersion;
    private final long actualVersion;

    public PersistenceConflictException(String scheduleId, long expectedVersion, long actualVersion) {
        super("Schedule " + scheduleId + " was modified concurrently (expected version "
                + expectedVersion + ", found " + actualVersion + ")");
        this.scheduleId = scheduleId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String scheduleId() {
        return scheduleId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public long actualVersion() {
        return actualVersion;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
