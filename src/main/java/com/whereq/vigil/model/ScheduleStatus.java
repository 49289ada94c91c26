package com.whereq.vigil.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Scheduled scan lifecycle states
 *
 * State transitions:
 * PENDING → RUNNING → {COMPLETED, ERROR}
 * PENDING, RUNNING → CANCELLED (operator action)
 */
public enum ScheduleStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    CANCELLED("cancelled"),
    ERROR("error");

    private final String value;

    ScheduleStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ScheduleStatus fromValue(String value) {
        for (ScheduleStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown schedule status: " + value);
    }

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == ERROR;
    }

    /**
     * Check if the evaluator should still look at this schedule
     */
    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }
}
