package com.whereq.vigil.exception;

/**
 * Exception thrown when the schedule or result store cannot be reached
 */
public class PersistenceException extends RuntimeException {
    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
