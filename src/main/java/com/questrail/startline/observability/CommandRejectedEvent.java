package com.questrail.startline.observability;

import com.questrail.startline.error.StartSchedulerException;

import java.time.Instant;

/**
 * A command that was refused without changing anything.
 *
 * @param timestamp  when the command was refused
 * @param scheduleId the schedule addressed, or {@code null} if it could not be resolved
 * @param command    short command name, e.g. {@code signalStart}
 * @param reason     the typed failure returned to the caller
 */
public record CommandRejectedEvent(
    Instant timestamp,
    String scheduleId,
    String command,
    StartSchedulerException reason
) {
}
