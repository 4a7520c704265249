package com.questrail.startline.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of the timestamps written into a schedule: actual signal times,
 * recall times and event timestamps.
 *
 * <p>The scheduler never refuses a command because of what this clock says;
 * ordering is the state machine's job.</p>
 */
public interface WallClock
{
    Instant now();
}
