package com.oceanintel.argo.service;

import com.oceanintel.argo.config.ArgoIngestProperties;
import com.oceanintel.argo.exception.AlreadyRunningException;
import com.oceanintel.argo.exception.ArgoIngestException;
import com.oceanintel.argo.exception.IndexUnavailableException;
import com.oceanintel.argo.exception.StoreWriteException;
import com.oceanintel.argo.model.CleanupReport;
import com.oceanintel.argo.model.ExtractionResult;
import com.oceanintel.argo.model.FetchBatchResult;
import com.oceanintel.argo.model.FetchError;
import com.oceanintel.argo.model.FetchResult;
import com.oceanintel.argo.model.IndexEntry;
import com.oceanintel.argo.model.Measurement;
import com.oceanintel.argo.model.RefreshReport;
import com.oceanintel.argo.model.RefreshRequest;
import com.oceanintel.argo.model.RefreshState;
import com.oceanintel.argo.model.RefreshStatus;
import com.oceanintel.argo.model.RefreshTrigger;
import com.oceanintel.argo.model.RetentionPolicy;
import com.oceanintel.argo.model.UpsertSummary;
import com.oceanintel.argo.output.MeasurementStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Runs the ingestion pipeline: index → filter → fetch → extract → store.
 *
 * At most one run is in flight per process. The IDLE/SUCCEEDED/FAILED → RUNNING
 * transition is a compare-and-set on the status snapshot, so a second trigger
 * fails fast with {@link AlreadyRunningException} and never waits.
 *
 * A run fails only when the index cannot be used or the store write breaks.
 * Individual download and parse failures are counted in the report.
 */
@Service
@Slf4j
public class RefreshCoordinator {

    private final IndexCatalog indexCatalog;
    private final ProfileFilter profileFilter;
    private final FileFetcher fileFetcher;
    private final ProfileExtractor profileExtractor;
    private final MeasurementStore store;
    private final RefreshStatusRepository statusRepository;
    private final Clock clock;
    private final Path downloadDir;

    private final AtomicReference<RefreshStatus> status;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    public RefreshCoordinator(IndexCatalog indexCatalog,
                              ProfileFilter profileFilter,
                              FileFetcher fileFetcher,
                              ProfileExtractor profileExtractor,
                              MeasurementStore store,
                              RefreshStatusRepository statusRepository,
                              ArgoIngestProperties properties,
                              Clock clock) {
        this.indexCatalog = indexCatalog;
        this.profileFilter = profileFilter;
        this.fileFetcher = fileFetcher;
        this.profileExtractor = profileExtractor;
        this.store = store;
        this.statusRepository = statusRepository;
        this.clock = clock;
        this.downloadDir = Paths.get(properties.getFetch().getDownloadDir());
        this.status = new AtomicReference<>(statusRepository.load());
    }

    /**
     * Run the whole pipeline on the calling thread.
     *
     * @throws AlreadyRunningException another run is in flight; its status is left untouched
     */
    public RefreshReport runOnce(RefreshRequest request) {
        RefreshReport report = begin(request.trigger());
        return execute(request, report);
    }

    /**
     * Claim the run slot on the calling thread, then run the pipeline on the executor.
     * A rejected trigger fails here, synchronously, rather than in the future.
     *
     * @throws AlreadyRunningException another run is in flight
     */
    public CompletableFuture<RefreshReport> runAsync(RefreshRequest request, Executor executor) {
        RefreshReport report = begin(request.trigger());
        try {
            return CompletableFuture.supplyAsync(() -> execute(request, report), executor);
        } catch (RejectedExecutionException e) {
            report.setStatus(RefreshState.FAILED);
            report.setErrorMessage("Refresh could not be started: " + e.getMessage());
            finish(report);
            throw e;
        }
    }

    /** Current snapshot. Never blocks. */
    public RefreshStatus status() {
        return status.get();
    }

    /**
     * Ask the in-flight run to stop after its current download batch. Stages after the
     * fetch still process what was downloaded. No effect when nothing is running.
     */
    public boolean requestCancel() {
        if (status.get().getState() != RefreshState.RUNNING) {
            return false;
        }
        log.info("Cancellation requested for run {}", status.get().getLastRunId());
        cancelRequested.set(true);
        return true;
    }

    /**
     * True when there has never been a successful run, or the last one is at least
     * {@code interval} old.
     */
    public boolean isDue(Duration interval) {
        Instant lastSuccess = status.get().getLastSuccessAt();
        return lastSuccess == null || !clock.instant().isBefore(lastSuccess.plus(interval));
    }

    /**
     * Delete downloaded profile files last modified before the retention window.
     * Safe to call during a run: only files older than the window are touched, and
     * files written by the current run are new.
     */
    public CleanupReport cleanupOldFiles(RetentionPolicy policy) {
        if (!Files.isDirectory(downloadDir)) {
            return new CleanupReport(0, 0, 0, List.of());
        }

        Instant cutoff = clock.instant().minus(policy.keepFor());
        int deleted = 0;
        int kept = 0;
        long freed = 0;
        List<String> failures = new ArrayList<>();

        try (DirectoryStream<Path> files = Files.newDirectoryStream(downloadDir, "*.nc")) {
            for (Path file : files) {
                try {
                    if (!Files.isRegularFile(file)) continue;
                    if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)) {
                        long size = Files.size(file);
                        if (Files.deleteIfExists(file)) {
                            deleted++;
                            freed += size;
                        }
                    } else {
                        kept++;
                    }
                } catch (IOException e) {
                    log.warn("Could not clean up {}: {}", file.getFileName(), e.getMessage());
                    failures.add(file.getFileName() + ": " + e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Could not list {}: {}", downloadDir, e.getMessage());
            failures.add(downloadDir + ": " + e.getMessage());
        }

        log.info("Cleanup: {} files deleted ({} bytes), {} kept, {} failures (retention {})",
                deleted, freed, kept, failures.size(), policy.keepFor());
        return new CleanupReport(deleted, freed, kept, List.copyOf(failures));
    }

    /**
     * Empty the store. Refused while a run is writing to it.
     */
    public void resetStore() {
        RefreshStatus current = status.get();
        if (current.getState() == RefreshState.RUNNING) {
            throw new AlreadyRunningException(current.getLastAttemptAt());
        }
        store.clear();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RefreshReport begin(RefreshTrigger trigger) {
        String runId = UUID.randomUUID().toString();
        Instant now = clock.instant();

        RefreshStatus current;
        RefreshStatus running;
        // reset before claiming the slot, never after
        if (status.get().getState().acceptsNewRun()) {
            cancelRequested.set(false);
        }
        do {
            current = status.get();
            if (!current.getState().acceptsNewRun()) {
                log.info("{} refresh rejected: run {} in flight since {}",
                        trigger, current.getLastRunId(), current.getLastAttemptAt());
                throw new AlreadyRunningException(current.getLastAttemptAt());
            }
            running = current.toBuilder()
                    .state(RefreshState.RUNNING)
                    .lastAttemptAt(now)
                    .lastRunId(runId)
                    .summary("running")
                    .build();
        } while (!status.compareAndSet(current, running));

        statusRepository.save(running);
        log.info("Refresh {} started ({})", runId, trigger);

        return RefreshReport.builder()
                .runId(runId)
                .trigger(trigger)
                .startedAt(now)
                .status(RefreshState.RUNNING)
                .build();
    }

    private RefreshReport execute(RefreshRequest request, RefreshReport report) {
        try {
            runStages(request, report);
            report.setStatus(RefreshState.SUCCEEDED);
        } catch (ArgoIngestException e) {
            log.error("Refresh {} failed: {}", report.getRunId(), e.getMessage(), e);
            report.setStatus(RefreshState.FAILED);
            report.setErrorMessage(e.getMessage());
        } catch (Exception e) {
            log.error("Refresh {} failed unexpectedly: {}", report.getRunId(), e.getMessage(), e);
            report.setStatus(RefreshState.FAILED);
            report.setErrorMessage("Unexpected failure: " + e);
        } finally {
            finish(report);
        }
        return report;
    }

    private void runStages(RefreshRequest request, RefreshReport report) {
        IndexSnapshot snapshot = indexCatalog.fetchIndex();

        List<IndexEntry> selected;
        try (Stream<IndexEntry> entries = snapshot.stream()) {
            selected = profileFilter.select(entries, request.criteria());
        } catch (UncheckedIOException e) {
            throw new IndexUnavailableException("Index copy became unreadable: " + e.getMessage(), e);
        }
        report.setIndexEntriesScanned(snapshot.getIndexEntries());
        report.setMalformedIndexLines(snapshot.getIndexMalformedLines());
        report.setProfilesSelected(selected.size());
        log.info("Selected {} profiles ({} index entries, {} malformed lines)",
                selected.size(), snapshot.getIndexEntries(), snapshot.getIndexMalformedLines());

        if (selected.isEmpty()) {
            log.info("No profiles inside the configured box and window");
            return;
        }

        // extract per batch; payloads are dropped once read
        List<Measurement> measurements = new ArrayList<>();
        FetchBatchResult fetched = fileFetcher.fetchAll(selected, request.batchSize(), request.maxWorkers(),
                cancelRequested::get, batch -> extractBatch(batch, report, measurements));
        report.setFilesFetched((int) fetched.successCount());
        report.setFetchErrors(fetched.errors().size());
        report.setCancelled(fetched.cancelled());
        for (FetchError error : fetched.errors()) {
            report.addError("fetch " + error.fileRef() + ": " + error.reason() + " " + error.message());
        }
        report.setMeasurementsExtracted(measurements.size());
        log.info("Extracted {} measurements from {} files ({} parse errors, {} levels rejected by QC)",
                measurements.size(), fetched.successCount(), report.getParseErrors(), report.getRejectedByQc());

        UpsertSummary upsert;
        try {
            upsert = store.upsert(measurements);
        } catch (StoreWriteException e) {
            report.setUpsert(e.getCommitted());
            report.setMeasurementsIngested(e.getCommitted().written());
            report.setProfilesIngested(distinctProfiles(
                    measurements.subList(0, Math.min(e.getCommittedRows(), measurements.size()))));
            throw e;
        }
        report.setUpsert(upsert);
        report.setMeasurementsIngested(upsert.written());
        report.setProfilesIngested(distinctProfiles(measurements));
    }

    private void extractBatch(List<FetchResult> batch, RefreshReport report, List<Measurement> measurements) {
        for (FetchResult fetched : batch) {
            if (!fetched.isSuccess()) continue;
            ExtractionResult result = profileExtractor.extract(fetched.file());
            if (!result.isSuccess()) {
                report.setParseErrors(report.getParseErrors() + 1);
                report.addError("parse " + result.fileRef() + ": " + result.error().message());
                continue;
            }
            measurements.addAll(result.measurements());
            report.setRejectedByQc(report.getRejectedByQc() + result.rejectedByQc());
        }
    }

    private int distinctProfiles(List<Measurement> measurements) {
        Set<String> profiles = new HashSet<>();
        for (Measurement m : measurements) {
            profiles.add(m.getFloatId() + "|" + m.getTimestamp());
        }
        return profiles.size();
    }

    private void finish(RefreshReport report) {
        Instant completedAt = clock.instant();
        report.setCompletedAt(completedAt);
        if (report.getStatus() == RefreshState.RUNNING) {
            report.setStatus(RefreshState.FAILED);
            report.setErrorMessage("Refresh aborted");
        }
        boolean succeeded = report.getStatus() == RefreshState.SUCCEEDED;

        RefreshStatus previous = status.get();
        RefreshStatus.RefreshStatusBuilder next = previous.toBuilder()
                .state(report.getStatus())
                .lastCompletedAt(completedAt)
                .lastRunId(report.getRunId())
                .profilesIngested(report.getProfilesIngested())
                .measurementsIngested(report.getMeasurementsIngested())
                .refreshCount(previous.getRefreshCount() + 1)
                .summary(report.summary());
        if (succeeded) {
            next.lastSuccessAt(completedAt).lastError(null);
        } else {
            next.lastError(report.getErrorMessage()).errorCount(previous.getErrorCount() + 1);
        }
        RefreshStatus done = next.build();
        status.set(done);
        cancelRequested.set(false);

        statusRepository.save(done);
        store.recordRun(report);

        log.info("Refresh {} {} in {}s: {}", report.getRunId(), report.getStatus(),
                Duration.between(report.getStartedAt(), completedAt).toSeconds(), report.summary());
    }
}
