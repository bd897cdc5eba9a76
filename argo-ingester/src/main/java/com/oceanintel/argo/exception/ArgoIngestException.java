package com.oceanintel.argo.exception;

/**
 * Base type for failures that abort an ingestion run or reject a request.
 * Per-file fetch and parse problems are values, not exceptions.
 */
public class ArgoIngestException extends RuntimeException {

    public ArgoIngestException(String message) {
        super(message);
    }

    public ArgoIngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
