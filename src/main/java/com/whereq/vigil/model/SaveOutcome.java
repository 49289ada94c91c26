package com.whereq.vigil.model;

/**
 * Result of forwarding a scan result to the persistence collaborator.
 *
 * @param ok           whether the result was stored
 * @param storedId     identifier assigned by the store, null on failure
 * @param errorMessage human readable reason, empty on success
 */
public record SaveOutcome(boolean ok, String storedId, String errorMessage) {

    public static SaveOutcome success(String storedId) {
        return new SaveOutcome(true, storedId, "");
    }

    public static SaveOutcome failure(String errorMessage) {
        return new SaveOutcome(false, null, errorMessage);
    }
}
