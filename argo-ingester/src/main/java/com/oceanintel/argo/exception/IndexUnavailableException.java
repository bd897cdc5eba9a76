package com.oceanintel.argo.exception;

/**
 * The global index could not be downloaded after all retries.
 */
public class IndexUnavailableException extends ArgoIngestException {

    public IndexUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
