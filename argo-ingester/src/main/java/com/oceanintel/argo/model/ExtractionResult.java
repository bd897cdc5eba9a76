package com.oceanintel.argo.model;

import java.util.List;

/**
 * Measurements read from one profile file, or the reason the file could not be read.
 *
 * @param levelsRead     depth levels examined across all profiles in the file
 * @param rejectedByQc   levels dropped because their QC flag was not good/probably good
 * @param skippedMissing levels dropped for missing pressure, date or position, or for
 *                       repeating a depth already read from an earlier profile of the file
 */
public record ExtractionResult(String fileRef,
                               List<Measurement> measurements,
                               int levelsRead,
                               int rejectedByQc,
                               int skippedMissing,
                               ParseError error) {

    public static ExtractionResult success(String fileRef, List<Measurement> measurements,
                                           int levelsRead, int rejectedByQc, int skippedMissing) {
        return new ExtractionResult(fileRef, List.copyOf(measurements), levelsRead, rejectedByQc, skippedMissing, null);
    }

    public static ExtractionResult failure(String fileRef, String message) {
        return new ExtractionResult(fileRef, List.of(), 0, 0, 0, new ParseError(fileRef, message));
    }

    public boolean isSuccess() {
        return error == null;
    }
}
