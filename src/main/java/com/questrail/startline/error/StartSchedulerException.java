package com.questrail.startline.error;

/**
 * Base type for every failure a start scheduler command can report.
 *
 * <p>All failures are local and synchronous. A failed command leaves the
 * schedule exactly as it was before the command arrived.</p>
 */
public abstract class StartSchedulerException extends RuntimeException
{
    protected StartSchedulerException(String message) {
        super(message);
    }

    protected StartSchedulerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether reloading the schedule and re-issuing the same command may succeed.
     *
     * <p>Domain-rule violations are never retryable.</p>
     */
    public boolean isRetryable() {
        return false;
    }
}
