package com.questrail.startline.observability;

import java.time.Instant;

/**
 * Record representing an unexpected failure outside the command path, such as
 * a sink or transport error.
 */
public record SchedulerErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
