package com.questrail.startline.internal.exec;

import com.questrail.startline.internal.timeline.SequenceCountdown;

/**
 * Receives countdown updates for the fleet currently in sequence.
 *
 * <p>Called on the scheduler's thread; implementations must not block.</p>
 */
@FunctionalInterface
public interface CountdownListener
{
    void onCountdown(String scheduleId, SequenceCountdown.Countdown countdown);
}
