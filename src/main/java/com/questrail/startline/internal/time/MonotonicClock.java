package com.questrail.startline.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Elapsed-time source for countdown cadence.
 *
 * <p>Countdown ticks are spaced on this clock so that an NTP step on the
 * committee boat's laptop does not bunch or skip ticks. Signal timestamps are
 * taken from {@link WallClock}.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between values are meaningful.
     */
    long nowNanos();
}
