package com.whereq.vigil.exception;

/**
 * Exception thrown when a scheduled scan id is unknown
 */
public class ScheduleNotFoundException extends RuntimeException {

    private final long scheduleId;

    public ScheduleNotFoundException(long scheduleId) {
        super("Scheduled scan not found");
        this.scheduleId = scheduleId;
    }

    public long getScheduleId() {
        return scheduleId;
    }
}
