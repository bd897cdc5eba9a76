package com.oceanintel.argo.service;

import com.oceanintel.argo.config.ArgoIngestProperties;
import com.oceanintel.argo.model.Measurement;
import com.oceanintel.argo.model.ProfileSummary;
import com.oceanintel.argo.model.RefreshReport;
import com.oceanintel.argo.model.RefreshState;
import com.oceanintel.argo.model.RefreshTrigger;
import com.oceanintel.argo.output.MeasurementStore;
import com.oceanintel.argo.output.TestStores;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static com.oceanintel.argo.output.TestStores.measurement;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MeasurementQueryServiceTest {

    private static final LocalDateTime T1 = LocalDateTime.of(2024, 1, 15, 6, 12);
    private static final LocalDateTime T2 = LocalDateTime.of(2024, 1, 25, 6, 40);

    private EmbeddedDatabase db;
    private MeasurementStore store;
    private MeasurementQueryService queryService;

    @BeforeEach
    void setUp() {
        db = TestStores.database();
        store = TestStores.store(db, new ArgoIngestProperties());
        queryService = new MeasurementQueryService(new JdbcTemplate(db), store);

        store.upsert(List.of(
                measurement("2902755", T1, 20.0).build(),
                measurement("2902755", T1, 5.0).dissolvedOxygen(210.0).build(),
                measurement("2902755", T2, 5.0).build(),
                measurement("2902756", T1, 5.0).region("Bay of Bengal").longitude(88.0).build()));
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Test
    void latestProfilesNewestFirst() {
        List<ProfileSummary> latest = queryService.latestProfiles(2);

        assertThat(latest).hasSize(2);
        assertThat(latest.get(0).floatId()).isEqualTo("2902755");
        assertThat(latest.get(0).timestamp()).isEqualTo(T2);
        assertThat(latest.get(1).timestamp()).isEqualTo(T1);
        assertThat(latest.get(1).levelCount()).isEqualTo(2);
    }

    @Test
    void profileLevelsShallowestFirst() {
        List<Measurement> levels = queryService.profileMeasurements("2902755", T1);

        assertThat(levels).extracting(Measurement::getDepth).containsExactly(5.0, 20.0);
        assertThat(levels.get(0).getDissolvedOxygen()).isEqualTo(210.0);
        assertThat(levels.get(1).getDissolvedOxygen()).isNull();
        assertThat(levels.get(0).getQcFlag()).isEqualTo('1');
    }

    @Test
    void profileWithoutTimestampIsTheLatestOne() {
        assertThat(queryService.profileMeasurements("2902755", null))
                .singleElement()
                .satisfies(m -> assertThat(m.getTimestamp()).isEqualTo(T2));
        assertThat(queryService.profileMeasurements("9999999", null)).isEmpty();
    }

    @Test
    void regionSummaryCountsPerRegion() {
        List<Map<String, Object>> regions = queryService.regionSummary();

        assertThat(regions).hasSize(2);
        Map<String, Object> first = regions.get(0);
        assertThat(first.get("region")).isEqualTo("Arabian Sea");
        assertThat(((Number) first.get("measurement_count")).intValue()).isEqualTo(3);
        assertThat(((Number) first.get("float_count")).intValue()).isEqualTo(1);
    }

    @Test
    void recentRunsNewestFirst() {
        store.recordRun(run("run-1", "2024-03-01T02:00:00Z"));
        store.recordRun(run("run-2", "2024-03-02T02:00:00Z"));

        List<Map<String, Object>> runs = queryService.recentRuns(10);

        assertThat(runs).extracting(r -> r.get("run_id")).containsExactly("run-2", "run-1");
    }

    @Test
    void rejectsUnreasonableLimits() {
        assertThatThrownBy(() -> queryService.latestProfiles(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> queryService.recentRuns(5000)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> queryService.profileMeasurements(" ", null)).isInstanceOf(IllegalArgumentException.class);
    }

    private static RefreshReport run(String runId, String startedAt) {
        return RefreshReport.builder()
                .runId(runId)
                .trigger(RefreshTrigger.SCHEDULED)
                .startedAt(Instant.parse(startedAt))
                .status(RefreshState.SUCCEEDED)
                .build();
    }
}
