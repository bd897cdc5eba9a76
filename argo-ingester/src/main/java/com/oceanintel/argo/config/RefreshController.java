package com.oceanintel.argo.config;

import com.oceanintel.argo.exception.AlreadyRunningException;
import com.oceanintel.argo.model.CleanupReport;
import com.oceanintel.argo.model.Measurement;
import com.oceanintel.argo.model.RefreshReport;
import com.oceanintel.argo.model.RefreshStatus;
import com.oceanintel.argo.model.RetentionPolicy;
import com.oceanintel.argo.model.StoreFreshness;
import com.oceanintel.argo.output.MeasurementCsvExporter;
import com.oceanintel.argo.scheduler.RefreshScheduler;
import com.oceanintel.argo.service.MeasurementQueryService;
import com.oceanintel.argo.service.RefreshCoordinator;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/argo")
@Slf4j
@RequiredArgsConstructor
public class RefreshController {

    private final RefreshCoordinator coordinator;
    private final RefreshScheduler scheduler;
    private final MeasurementQueryService queryService;
    private final MeasurementCsvExporter csvExporter;
    private final ArgoIngestProperties properties;

    // ── Refresh control ───────────────────────────────────────────────────────

    /**
     * Start a refresh.
     *
     * POST /argo/refresh?force=false&wait=false
     *
     * Without force the refresh is skipped when the last success is younger than the
     * schedule interval. With wait the response carries the finished run report.
     */
    @PostMapping("/refresh")
    public ResponseEntity<?> refresh(
            @RequestParam(defaultValue = "false") boolean force,
            @RequestParam(defaultValue = "false") boolean wait) {
        try {
            Duration interval = scheduler.effectiveInterval();
            if (!force && !coordinator.isDue(interval)) {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("status", "skipped");
                body.put("reason", "last successful refresh is less than " + interval + " old");
                body.put("lastSuccessAt", coordinator.status().getLastSuccessAt());
                return ResponseEntity.ok(body);
            }

            CompletableFuture<RefreshReport> run = scheduler.triggerNow();
            String runId = coordinator.status().getLastRunId();
            if (wait) {
                return ResponseEntity.ok(run.join());
            }
            return ResponseEntity.accepted().body(Map.of("status", "accepted", "runId", runId));
        } catch (AlreadyRunningException e) {
            return conflict(e);
        } catch (Exception e) {
            log.error("Refresh trigger failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, String>> cancel() {
        boolean cancelling = coordinator.requestCancel();
        return ResponseEntity.ok(Map.of("status", cancelling ? "cancelling" : "idle"));
    }

    @GetMapping("/status")
    public ResponseEntity<?> status() {
        try {
            RefreshStatus status = coordinator.status();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("refresh", status);
            body.put("scheduled", scheduler.currentInterval().isPresent());
            body.put("intervalHours", scheduler.currentInterval().map(Duration::toHours).orElse(null));
            body.put("nextRunAt", scheduler.nextRunAt().orElse(null));
            body.put("freshness", freshnessBody(queryService.freshness()));
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            log.error("Status query failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    /**
     * Replace the periodic schedule.
     *
     * POST /argo/schedule?intervalHours=24
     */
    @PostMapping("/schedule")
    public ResponseEntity<?> schedule(@RequestParam int intervalHours) {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "scheduled");
            body.put("intervalHours", intervalHours);
            body.put("nextRunAt", scheduler.schedule(Duration.ofHours(intervalHours)));
            return ResponseEntity.ok(body);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @DeleteMapping("/schedule")
    public ResponseEntity<Map<String, String>> unschedule() {
        boolean wasScheduled = scheduler.cancel();
        return ResponseEntity.ok(Map.of("status", wasScheduled ? "cancelled" : "not scheduled"));
    }

    /**
     * Delete downloaded files older than the retention window.
     *
     * POST /argo/cleanup?retentionDays=7
     */
    @PostMapping("/cleanup")
    public ResponseEntity<?> cleanup(@RequestParam(required = false) Integer retentionDays) {
        try {
            int days = retentionDays != null ? retentionDays : properties.getRetention().getDays();
            CleanupReport report = coordinator.cleanupOldFiles(RetentionPolicy.ofDays(days));
            return ResponseEntity.ok(report);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Cleanup failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    /**
     * Empty the measurement store. Requires confirm=true.
     */
    @PostMapping("/store/reset")
    public ResponseEntity<?> resetStore(@RequestParam(defaultValue = "false") boolean confirm) {
        if (!confirm) {
            return ResponseEntity.badRequest().body(Map.of("error", "pass confirm=true to delete all stored measurements"));
        }
        try {
            coordinator.resetStore();
            return ResponseEntity.ok(Map.of("status", "cleared"));
        } catch (AlreadyRunningException e) {
            return conflict(e);
        } catch (Exception e) {
            log.error("Store reset failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    // ── Data query API ────────────────────────────────────────────────────────

    @GetMapping("/freshness")
    public ResponseEntity<?> freshness() {
        try {
            return ResponseEntity.ok(freshnessBody(queryService.freshness()));
        } catch (Exception e) {
            log.error("Freshness query failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    /**
     * GET /argo/profiles/latest?limit=20
     */
    @GetMapping("/profiles/latest")
    public ResponseEntity<?> latestProfiles(@RequestParam(defaultValue = "20") int limit) {
        try {
            return ResponseEntity.ok(queryService.latestProfiles(limit));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Profile query failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    /**
     * Depth levels of one profile.
     *
     * GET /argo/profiles/2902755?timestamp=2024-03-01T06:12:00
     *
     * Without timestamp the float's latest profile is returned.
     */
    @GetMapping("/profiles/{floatId}")
    public ResponseEntity<?> profile(
            @PathVariable String floatId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime timestamp) {
        try {
            List<Measurement> levels = queryService.profileMeasurements(floatId, timestamp);
            if (levels.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "no stored profile for float " + floatId));
            }
            return ResponseEntity.ok(levels);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Profile query failed for float {}: {}", floatId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/regions")
    public ResponseEntity<?> regions() {
        try {
            return ResponseEntity.ok(queryService.regionSummary());
        } catch (Exception e) {
            log.error("Region summary failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/runs")
    public ResponseEntity<?> runs(@RequestParam(defaultValue = "20") int limit) {
        try {
            return ResponseEntity.ok(queryService.recentRuns(limit));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Run history query failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    /**
     * Download stored measurements as CSV.
     *
     * GET /argo/export.csv?region=Arabian+Sea&from=2024-01-01&to=2024-03-31
     */
    @GetMapping("/export.csv")
    public void exportCsv(
            @RequestParam(required = false) String region,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            HttpServletResponse response) throws IOException {
        if (from != null && to != null && from.isAfter(to)) {
            response.sendError(HttpStatus.BAD_REQUEST.value(), "from must not be after to");
            return;
        }
        response.setContentType("text/csv");
        response.setCharacterEncoding("UTF-8");
        response.setHeader("Content-Disposition", "attachment; filename=\"argo_measurements.csv\"");
        int rows = csvExporter.export(response.getWriter(), region, from, to);
        log.info("CSV export: {} rows (region={}, from={}, to={})", rows, region, from, to);
    }

    /**
     * Write stored measurements to a CSV file under the configured output directory.
     *
     * POST /argo/export?region=Bay+of+Bengal
     */
    @PostMapping("/export")
    public ResponseEntity<?> exportToFile(
            @RequestParam(required = false) String region,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        if (from != null && to != null && from.isAfter(to)) {
            return ResponseEntity.badRequest().body(Map.of("error", "from must not be after to"));
        }
        try {
            Path file = csvExporter.exportToFile(region, from, to);
            return ResponseEntity.ok(Map.of("status", "written", "file", file.toString()));
        } catch (Exception e) {
            log.error("CSV file export failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private ResponseEntity<Map<String, Object>> conflict(AlreadyRunningException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("runningSince", e.getRunningSince());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    private Map<String, Object> freshnessBody(StoreFreshness freshness) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("hasRealData", freshness.hasRealData());
        body.put("totalMeasurements", freshness.totalMeasurements());
        body.put("totalProfiles", freshness.totalProfiles());
        body.put("newestTimestamp", freshness.newestTimestamp());
        return body;
    }
}
