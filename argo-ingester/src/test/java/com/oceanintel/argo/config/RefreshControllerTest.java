package com.oceanintel.argo.config;

import com.oceanintel.argo.exception.AlreadyRunningException;
import com.oceanintel.argo.model.CleanupReport;
import com.oceanintel.argo.model.RefreshReport;
import com.oceanintel.argo.model.RefreshState;
import com.oceanintel.argo.model.RefreshStatus;
import com.oceanintel.argo.model.RefreshTrigger;
import com.oceanintel.argo.model.RetentionPolicy;
import com.oceanintel.argo.model.StoreFreshness;
import com.oceanintel.argo.output.MeasurementCsvExporter;
import com.oceanintel.argo.scheduler.RefreshScheduler;
import com.oceanintel.argo.service.MeasurementQueryService;
import com.oceanintel.argo.service.RefreshCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.Writer;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.hamcrest.Matchers.endsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class RefreshControllerTest {

    private static final Instant STARTED = Instant.parse("2024-03-01T02:00:00Z");

    private RefreshCoordinator coordinator;
    private RefreshScheduler scheduler;
    private MeasurementQueryService queryService;
    private MeasurementCsvExporter csvExporter;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        coordinator = mock(RefreshCoordinator.class);
        scheduler = mock(RefreshScheduler.class);
        queryService = mock(MeasurementQueryService.class);
        csvExporter = mock(MeasurementCsvExporter.class);
        when(scheduler.effectiveInterval()).thenReturn(Duration.ofHours(24));
        when(coordinator.status()).thenReturn(RefreshStatus.builder().lastRunId("run-1").build());

        mvc = MockMvcBuilders.standaloneSetup(new RefreshController(
                coordinator, scheduler, queryService, csvExporter, new ArgoIngestProperties())).build();
    }

    @Test
    void refreshIsSkippedWhenNotDue() throws Exception {
        when(coordinator.isDue(Duration.ofHours(24))).thenReturn(false);

        mvc.perform(post("/argo/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("skipped"));

        verify(scheduler, never()).triggerNow();
    }

    @Test
    void refreshIsAcceptedWhenDue() throws Exception {
        when(coordinator.isDue(any())).thenReturn(true);
        when(scheduler.triggerNow()).thenReturn(new CompletableFuture<>());

        mvc.perform(post("/argo/refresh"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("accepted"))
                .andExpect(jsonPath("$.runId").value("run-1"));
    }

    @Test
    void forcedRefreshCanWaitForTheReport() throws Exception {
        RefreshReport report = RefreshReport.builder()
                .runId("run-2")
                .trigger(RefreshTrigger.MANUAL)
                .status(RefreshState.SUCCEEDED)
                .profilesSelected(4)
                .build();
        when(scheduler.triggerNow()).thenReturn(CompletableFuture.completedFuture(report));

        mvc.perform(post("/argo/refresh").param("force", "true").param("wait", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("run-2"))
                .andExpect(jsonPath("$.status").value("SUCCEEDED"))
                .andExpect(jsonPath("$.profilesSelected").value(4));

        verify(coordinator, never()).isDue(any());
    }

    @Test
    void refreshWhileRunningIsAConflict() throws Exception {
        when(scheduler.triggerNow()).thenThrow(new AlreadyRunningException(STARTED));

        mvc.perform(post("/argo/refresh").param("force", "true"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void cancelReportsWhetherARunWasInFlight() throws Exception {
        when(coordinator.requestCancel()).thenReturn(false);

        mvc.perform(post("/argo/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("idle"));
    }

    @Test
    void invalidScheduleIsABadRequest() throws Exception {
        when(scheduler.schedule(Duration.ZERO)).thenThrow(new IllegalArgumentException("interval must be positive"));

        mvc.perform(post("/argo/schedule").param("intervalHours", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("interval must be positive"));
    }

    @Test
    void unscheduleWhenNothingScheduled() throws Exception {
        when(scheduler.cancel()).thenReturn(false);

        mvc.perform(delete("/argo/schedule"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("not scheduled"));
    }

    @Test
    void cleanupUsesConfiguredRetentionByDefault() throws Exception {
        when(coordinator.cleanupOldFiles(RetentionPolicy.ofDays(7))).thenReturn(new CleanupReport(2, 2048, 1, List.of()));

        mvc.perform(post("/argo/cleanup"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.filesDeleted").value(2))
                .andExpect(jsonPath("$.bytesFreed").value(2048));
    }

    @Test
    void negativeRetentionIsABadRequest() throws Exception {
        mvc.perform(post("/argo/cleanup").param("retentionDays", "-1"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void storeResetNeedsConfirmation() throws Exception {
        mvc.perform(post("/argo/store/reset"))
                .andExpect(status().isBadRequest());

        verify(coordinator, never()).resetStore();
    }

    @Test
    void statusCombinesRefreshScheduleAndFreshness() throws Exception {
        when(scheduler.currentInterval()).thenReturn(Optional.of(Duration.ofHours(24)));
        when(scheduler.nextRunAt()).thenReturn(Optional.of(STARTED));
        when(queryService.freshness()).thenReturn(new StoreFreshness(120, 3, null));

        mvc.perform(get("/argo/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.refresh.lastRunId").value("run-1"))
                .andExpect(jsonPath("$.scheduled").value(true))
                .andExpect(jsonPath("$.intervalHours").value(24))
                .andExpect(jsonPath("$.freshness.hasRealData").value(true))
                .andExpect(jsonPath("$.freshness.totalMeasurements").value(120));
    }

    @Test
    void unknownProfileIsNotFound() throws Exception {
        when(queryService.profileMeasurements("2902755", null)).thenReturn(List.of());

        mvc.perform(get("/argo/profiles/2902755"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("no stored profile for float 2902755"));
    }

    @Test
    void exportStreamsCsv() throws Exception {
        when(csvExporter.export(any(Writer.class), isNull(), isNull(), isNull())).thenAnswer(inv -> {
            Writer out = inv.getArgument(0);
            out.write("\"float_id\"\n\"2902755\"\n");
            return 1;
        });

        mvc.perform(get("/argo/export.csv"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("text/csv;charset=UTF-8"))
                .andExpect(header().string("Content-Disposition", "attachment; filename=\"argo_measurements.csv\""))
                .andExpect(content().string("\"float_id\"\n\"2902755\"\n"));
    }

    @Test
    void exportRejectsInvertedDateRange() throws Exception {
        mvc.perform(get("/argo/export.csv").param("from", "2024-03-01").param("to", "2024-01-01"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void fileExportReportsTheWrittenFile() throws Exception {
        when(csvExporter.exportToFile("Bay of Bengal", null, null))
                .thenReturn(Path.of("data/export/argo_measurements_Bay_of_Bengal_20240301_020000.csv"));

        mvc.perform(post("/argo/export").param("region", "Bay of Bengal"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("written"))
                .andExpect(jsonPath("$.file").value(endsWith("argo_measurements_Bay_of_Bengal_20240301_020000.csv")));
    }

    @Test
    void fileExportRejectsInvertedDateRange() throws Exception {
        mvc.perform(post("/argo/export").param("from", "2024-03-01").param("to", "2024-01-01"))
                .andExpect(status().isBadRequest());

        verify(csvExporter, never()).exportToFile(any(), any(), any());
    }
}
