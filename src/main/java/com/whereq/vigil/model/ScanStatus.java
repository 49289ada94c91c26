package com.whereq.vigil.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Scan job lifecycle states
 *
 * State transitions:
 * RUNNING → {COMPLETED, FAILED, PERMISSION_DENIED}
 * RUNNING → CANCELLED (operator action, sticky even if the process exits afterwards)
 */
public enum ScanStatus {
    /**
     * Job registered; waiting for a worker slot or executing
     */
    RUNNING("running"),

    /**
     * Process exited cleanly and the report was extracted
     */
    COMPLETED("completed"),

    /**
     * Process exited with an error, or the report could not be read or parsed
     */
    FAILED("failed"),

    /**
     * User-initiated cancellation
     */
    CANCELLED("cancelled"),

    /**
     * Process refused to run without elevated privileges
     */
    PERMISSION_DENIED("permission_denied");

    private final String value;

    ScanStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this != RUNNING;
    }
}
