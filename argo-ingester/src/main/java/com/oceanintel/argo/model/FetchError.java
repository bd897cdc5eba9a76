package com.oceanintel.argo.model;

/**
 * A profile file that could not be downloaded after all retry attempts.
 */
public record FetchError(String fileRef, FetchFailureReason reason, String message, int attempts) {

    @Override
    public String toString() {
        return fileRef + ": " + reason + " after " + attempts + " attempt(s) (" + message + ")";
    }
}
