package com.whereq.vigil.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDateTime;

/**
 * Recurrence unit for recurring schedules
 */
public enum IntervalType {
    HOURS("hours"),
    DAYS("days"),
    WEEKS("weeks");

    private final String value;

    IntervalType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public LocalDateTime addTo(LocalDateTime base, long amount) {
        return switch (this) {
            case HOURS -> base.plusHours(amount);
            case DAYS -> base.plusDays(amount);
            case WEEKS -> base.plusWeeks(amount);
        };
    }

    /**
     * Lenient lookup; unknown values yield null so callers can apply their own default
     */
    @JsonCreator
    public static IntervalType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (IntervalType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return null;
    }
}
