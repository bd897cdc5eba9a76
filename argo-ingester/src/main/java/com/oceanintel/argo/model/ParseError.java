package com.oceanintel.argo.model;

/**
 * A profile file whose structure could not be read.
 */
public record ParseError(String fileRef, String message) {

    @Override
    public String toString() {
        return fileRef + ": " + message;
    }
}
