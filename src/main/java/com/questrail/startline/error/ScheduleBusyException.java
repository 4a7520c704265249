package com.questrail.startline.error;

/**
 * Another command is being applied to the same schedule.
 */
public final class ScheduleBusyException extends StartSchedulerException
{
    private final String scheduleId;

    public ScheduleBusyException(String scheduleId) {
        super("Schedule " + scheduleId + " is processing another command");
        this.scheduleId = scheduleId;
    }

    public String scheduleId() {
        return scheduleId;
    }
}
