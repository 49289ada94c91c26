package com.whereq.vigil.exception;

/**
 * Exception thrown when a scheduled scan cannot make the requested transition
 */
public class ScheduleStateException extends IllegalStateException {
    public ScheduleStateException(String message) {
        super(message);
    }
}
