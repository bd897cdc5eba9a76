package com.oceanintel.argo.model;

import java.util.List;

/**
 * Ordered per-entry results of a fetch. When cancelled, entries of the batches
 * that never started are absent.
 */
public record FetchBatchResult(List<FetchResult> results, int requested, boolean cancelled) {

    public List<RawProfileFile> files() {
        return results.stream().filter(FetchResult::isSuccess).map(FetchResult::file).toList();
    }

    public List<FetchError> errors() {
        return results.stream().filter(r -> !r.isSuccess()).map(FetchResult::error).toList();
    }

    public long successCount() {
        return results.stream().filter(FetchResult::isSuccess).count();
    }
}
