package com.questrail.startline.error;

import com.questrail.startline.model.ScheduleStatus;

/**
 * The schedule's lifecycle status does not permit the command, e.g. editing
 * fleets after {@code markReady} or signalling before {@code startSequence}.
 */
public final class ScheduleNotReadyException extends StartSchedulerException
{
    private final String scheduleId;
    private final ScheduleStatus status;

    public ScheduleNotReadyException(String scheduleId, ScheduleStatus status, String message) {
        super(message);
        this.scheduleId = scheduleId;
        this.status = status;
    }

    public String scheduleId() {
        return scheduleId;
    }

    public ScheduleStatus status() {
        return status;
    }
}
