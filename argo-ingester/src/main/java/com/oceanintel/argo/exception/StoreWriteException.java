package com.oceanintel.argo.exception;

import com.oceanintel.argo.model.UpsertSummary;

/**
 * A write transaction failed. Chunks committed before the failure stay in the
 * store and are described by {@link #getCommitted()}; they cover the first
 * {@link #getCommittedRows()} measurements of the input.
 */
public class StoreWriteException extends ArgoIngestException {

    private final UpsertSummary committed;
    private final int committedRows;

    public StoreWriteException(String message, UpsertSummary committed, int committedRows, Throwable cause) {
        super(message, cause);
        this.committed = committed;
        this.committedRows = committedRows;
    }

    public UpsertSummary getCommitted() {
        return committed;
    }

    public int getCommittedRows() {
        return committedRows;
    }
}
