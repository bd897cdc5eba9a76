package com.oceanintel.argo.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Tracks one ingestion run from start to finish. Returned to the caller and
 * appended to the ingest_runs table.
 */
@Data
@Builder
public class RefreshReport {

    /** Error messages kept per run; the rest only show up in the counters */
    public static final int MAX_ERRORS = 50;

    private String runId;               // UUID
    private RefreshTrigger trigger;
    private Instant startedAt;
    private Instant completedAt;
    private RefreshState status;        // RUNNING | SUCCEEDED | FAILED

    // ── Index & filter ──────────────────────────────────────────────────────
    private long indexEntriesScanned;
    private long malformedIndexLines;
    private int profilesSelected;

    // ── Fetch ───────────────────────────────────────────────────────────────
    private int filesFetched;
    private int fetchErrors;
    private boolean cancelled;

    // ── Extract ─────────────────────────────────────────────────────────────
    private int parseErrors;
    private int measurementsExtracted;
    private int rejectedByQc;

    // ── Store ───────────────────────────────────────────────────────────────
    @Builder.Default
    private UpsertSummary upsert = UpsertSummary.EMPTY;
    private int profilesIngested;
    private int measurementsIngested;

    private String errorMessage;        // null on success

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public void addError(String message) {
        if (errors.size() < MAX_ERRORS) {
            errors.add(message);
        }
    }

    /** One line of counts for the status record and the logs. */
    public String summary() {
        StringBuilder sb = new StringBuilder()
                .append(profilesSelected).append(" profiles selected, ")
                .append(filesFetched).append(" fetched, ")
                .append(fetchErrors).append(" fetch errors, ")
                .append(parseErrors).append(" parse errors, ")
                .append(measurementsIngested).append(" measurements stored (")
                .append(upsert.inserted()).append(" new, ")
                .append(upsert.updated()).append(" updated, ")
                .append(upsert.skipped()).append(" skipped), ")
                .append(rejectedByQc).append(" levels rejected by QC");
        if (cancelled) {
            sb.append(", cancelled before all batches ran");
        }
        return sb.toString();
    }
}
