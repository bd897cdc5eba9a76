package com.oceanintel.argo.exception;

/**
 * The index downloaded fine but not a single line parsed. Usually means the
 * archive changed its index format.
 */
public class IndexEmptyException extends ArgoIngestException {

    private final long malformedLines;

    public IndexEmptyException(String message, long malformedLines) {
        super(message);
        this.malformedLines = malformedLines;
    }

    public long getMalformedLines() {
        return malformedLines;
    }
}
