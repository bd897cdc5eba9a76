package com.oceanintel.argo.model;

/**
 * Everything one ingestion run needs, resolved at trigger time.
 */
public record RefreshRequest(FilterCriteria criteria, int batchSize, int maxWorkers, RefreshTrigger trigger) {

    public RefreshRequest {
        if (criteria == null) {
            throw new IllegalArgumentException("criteria is required");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, was " + batchSize);
        }
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1, was " + maxWorkers);
        }
    }
}
