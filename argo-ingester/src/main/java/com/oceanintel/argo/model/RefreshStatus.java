package com.oceanintel.argo.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Process-wide snapshot of the latest refresh attempt. Immutable; the coordinator
 * swaps in a new snapshot at the start and at the end of every run. Persisted as
 * JSON so it is meaningful straight after a restart.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RefreshStatus {

    @Builder.Default
    RefreshState state = RefreshState.IDLE;

    Instant lastAttemptAt;
    Instant lastSuccessAt;
    Instant lastCompletedAt;

    /** Human-readable, null when the latest attempt succeeded */
    String lastError;

    String lastRunId;
    int profilesIngested;
    int measurementsIngested;

    /** Cumulative across restarts */
    long refreshCount;
    long errorCount;

    String summary;

    public static RefreshStatus initial() {
        return RefreshStatus.builder().summary("never run").build();
    }
}
