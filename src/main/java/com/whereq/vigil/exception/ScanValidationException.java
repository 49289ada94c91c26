package com.whereq.vigil.exception;

/**
 * Exception thrown when a scan request is rejected before any resource is committed
 */
public class ScanValidationException extends IllegalArgumentException {
    public ScanValidationException(String message) {
        super(message);
    }

    public ScanValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
