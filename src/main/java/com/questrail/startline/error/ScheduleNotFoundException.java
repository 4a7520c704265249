package com.questrail.startline.error;

/**
 * No schedule with the given id exists.
 */
public final class ScheduleNotFoundException extends StartSchedulerException
{
    private final String scheduleId;

    public ScheduleNotFoundException(String scheduleId) {
        super("Start schedule not found: " + scheduleId);
        this.scheduleId = scheduleId;
    }

    public String scheduleId() {
        return scheduleId;
    }
}
