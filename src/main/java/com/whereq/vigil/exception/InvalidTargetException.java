package com.whereq.vigil.exception;

/**
 * Exception thrown when a scan target matches none of the accepted grammars
 */
public class InvalidTargetException extends ScanValidationException {

    private final String target;

    public InvalidTargetException(String target) {
        super("Invalid target: " + target);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
