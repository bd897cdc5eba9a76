package com.oceanintel.argo.scheduler;

import com.oceanintel.argo.config.ArgoIngestProperties;
import com.oceanintel.argo.exception.AlreadyRunningException;
import com.oceanintel.argo.model.RefreshReport;
import com.oceanintel.argo.model.RefreshRequest;
import com.oceanintel.argo.model.RefreshTrigger;
import com.oceanintel.argo.model.RetentionPolicy;
import com.oceanintel.argo.output.MeasurementStore;
import com.oceanintel.argo.service.RefreshCoordinator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;

/**
 * Drives periodic refreshes and runs manual ones off the request thread.
 *
 * The first periodic run happens straight away when nothing has ever been
 * ingested, otherwise one interval after the last success. Overlapping triggers
 * are resolved by the coordinator, not here: a tick that finds a run in flight
 * just logs and skips.
 *
 * Defaults: every 24h, old downloads cleaned after each scheduled run. Override
 * with argo-ingest.scheduling.* properties or {@link #schedule(Duration)} at runtime.
 */
@Component
@Slf4j
public class RefreshScheduler {

    private final RefreshCoordinator coordinator;
    private final MeasurementStore store;
    private final TaskScheduler taskScheduler;
    private final ArgoIngestProperties properties;
    private final Clock clock;
    private final ExecutorService manualExecutor;

    private ScheduledFuture<?> scheduled;
    private Duration interval;
    private Instant firstRunAt;

    public RefreshScheduler(RefreshCoordinator coordinator,
                            MeasurementStore store,
                            TaskScheduler taskScheduler,
                            ArgoIngestProperties properties,
                            Clock clock) {
        this.coordinator = coordinator;
        this.store = store;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;
        this.manualExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "argo-manual-refresh");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * On application startup:
     *  1. Always ensure the store schema exists
     *  2. Start the periodic schedule unless disabled
     */
    @PostConstruct
    public void onStartup() {
        try {
            store.ensureSchema();
        } catch (Exception e) {
            log.error("Could not initialise the store schema: {}", e.getMessage(), e);
        }

        if (properties.getScheduling().isEnabled()) {
            schedule(properties.getScheduling().getInterval());
        } else {
            log.info("Periodic refresh disabled; use POST /argo/refresh or /argo/schedule");
        }
    }

    /**
     * Replace the current schedule. A run already in flight is not affected.
     */
    public synchronized Instant schedule(Duration newInterval) {
        if (newInterval == null || newInterval.isZero() || newInterval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, was " + newInterval);
        }
        stopTimer();

        Instant first = firstRunFor(newInterval);
        scheduled = taskScheduler.scheduleAtFixedRate(this::scheduledRefresh, first, newInterval);
        interval = newInterval;
        firstRunAt = first;

        log.info("Refresh scheduled every {}; next run at {}", newInterval, first);
        return first;
    }

    /**
     * Stop scheduling further runs. A run in flight finishes normally.
     */
    public synchronized boolean cancel() {
        boolean wasScheduled = stopTimer();
        if (wasScheduled) {
            log.info("Periodic refresh cancelled");
        }
        return wasScheduled;
    }

    /**
     * Start one refresh on the manual-trigger thread. The periodic anchor is unchanged.
     *
     * @throws AlreadyRunningException a run is already in flight
     */
    public CompletableFuture<RefreshReport> triggerNow() {
        RefreshRequest request = properties.toRefreshRequest(clock, RefreshTrigger.MANUAL);
        return coordinator.runAsync(request, manualExecutor);
    }

    public synchronized Optional<Instant> nextRunAt() {
        if (scheduled == null) return Optional.empty();
        Instant now = clock.instant();
        if (!now.isAfter(firstRunAt)) return Optional.of(firstRunAt);
        long elapsed = Duration.between(firstRunAt, now).toMillis();
        long periods = (elapsed + interval.toMillis() - 1) / interval.toMillis();
        return Optional.of(firstRunAt.plusMillis(periods * interval.toMillis()));
    }

    public synchronized Optional<Duration> currentInterval() {
        return scheduled == null ? Optional.empty() : Optional.of(interval);
    }

    /**
     * The interval used to decide whether a non-forced manual refresh is due.
     */
    public synchronized Duration effectiveInterval() {
        return interval != null ? interval : properties.getScheduling().getInterval();
    }

    @PreDestroy
    public void shutdown() {
        cancel();
        if (coordinator.requestCancel()) {
            log.info("Shutdown: in-flight refresh will stop after its current batch");
        }
        manualExecutor.shutdown();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    void scheduledRefresh() {
        log.info("Scheduled refresh triggered");
        try {
            coordinator.runOnce(properties.toRefreshRequest(clock, RefreshTrigger.SCHEDULED));
        } catch (AlreadyRunningException e) {
            log.info("Skipping scheduled refresh: {}", e.getMessage());
            return;
        } catch (Exception e) {
            log.error("Scheduled refresh failed: {}", e.getMessage(), e);
        }

        if (properties.getScheduling().isCleanupAfterRun()) {
            try {
                coordinator.cleanupOldFiles(RetentionPolicy.ofDays(properties.getRetention().getDays()));
            } catch (Exception e) {
                log.warn("Post-refresh cleanup failed: {}", e.getMessage());
            }
        }
    }

    Instant firstRunFor(Duration newInterval) {
        Instant now = clock.instant();
        Instant lastSuccess = coordinator.status().getLastSuccessAt();
        if (lastSuccess == null) {
            return properties.getScheduling().isRunOnStartup() ? now : now.plus(newInterval);
        }
        Instant due = lastSuccess.plus(newInterval);
        return due.isBefore(now) ? now : due;
    }

    private boolean stopTimer() {
        if (scheduled == null) return false;
        scheduled.cancel(false);
        scheduled = null;
        return true;
    }
}
