package com.questrail.startline.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a task submitted to a {@link MonotonicScheduler}.
 */
public interface Cancellable
{
    /**
     * Attempts to cancel the task.
     *
     * @return {@code true} if the task will not run; {@code false} if it has
     *         already run or was cancelled before.
     */
    boolean cancel();
}
