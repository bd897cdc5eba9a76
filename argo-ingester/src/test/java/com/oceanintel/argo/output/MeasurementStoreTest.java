package com.oceanintel.argo.output;

import com.oceanintel.argo.config.ArgoIngestProperties;
import com.oceanintel.argo.exception.StoreWriteException;
import com.oceanintel.argo.model.Measurement;
import com.oceanintel.argo.model.RefreshReport;
import com.oceanintel.argo.model.RefreshState;
import com.oceanintel.argo.model.RefreshTrigger;
import com.oceanintel.argo.model.StoreFreshness;
import com.oceanintel.argo.model.UpsertSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static com.oceanintel.argo.output.TestStores.measurement;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MeasurementStoreTest {

    private static final LocalDateTime T1 = LocalDateTime.of(2024, 1, 15, 6, 12);
    private static final LocalDateTime T2 = LocalDateTime.of(2024, 1, 25, 6, 40);

    private EmbeddedDatabase db;
    private JdbcTemplate jdbcTemplate;
    private ArgoIngestProperties properties;
    private MeasurementStore store;

    @BeforeEach
    void setUp() {
        db = TestStores.database();
        jdbcTemplate = new JdbcTemplate(db);
        properties = new ArgoIngestProperties();
        properties.getStore().setChunkSize(2);
        store = TestStores.store(db, properties);
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    private static List<Measurement> profileLevels() {
        return List.of(
                measurement("2902755", T1, 5.0).build(),
                measurement("2902755", T1, 10.0).build(),
                measurement("2902755", T1, 20.0).build(),
                measurement("2902755", T2, 5.0).build());
    }

    @Test
    void insertsNewRows() {
        UpsertSummary summary = store.upsert(profileLevels());

        assertThat(summary).isEqualTo(new UpsertSummary(4, 0, 0));
        StoreFreshness freshness = store.queryFreshness();
        assertThat(freshness.totalMeasurements()).isEqualTo(4);
        assertThat(freshness.totalProfiles()).isEqualTo(2);
        assertThat(freshness.newestTimestamp()).isEqualTo(T2);
        assertThat(freshness.hasRealData()).isTrue();
    }

    @Test
    void upsertingTheSameSetAgainIsIdempotent() {
        store.upsert(profileLevels());
        UpsertSummary second = store.upsert(profileLevels());

        assertThat(second).isEqualTo(new UpsertSummary(0, 4, 0));
        assertThat(store.queryFreshness().totalMeasurements()).isEqualTo(4);
        assertThat(store.queryFreshness().totalProfiles()).isEqualTo(2);
    }

    @Test
    void updateOverwritesValues() {
        store.upsert(List.of(measurement("2902755", T1, 5.0).temperature(28.0).build()));
        store.upsert(List.of(measurement("2902755", T1, 5.0).temperature(27.5).build()));

        Double temperature = jdbcTemplate.queryForObject(
                "SELECT temperature FROM measurements WHERE float_id = ? AND depth = ?", Double.class, "2902755", 5.0);
        assertThat(temperature).isEqualTo(27.5);
    }

    @Test
    void badQualityAndIncompleteRowsAreSkipped() {
        UpsertSummary summary = store.upsert(List.of(
                measurement("2902755", T1, 5.0).build(),
                measurement("2902755", T1, 10.0).qcFlag('3').build(),
                measurement("2902755", T1, 20.0).qcFlag('4').build(),
                measurement(null, T1, 30.0).build(),
                measurement("2902755", null, 40.0).build()));

        assertThat(summary).isEqualTo(new UpsertSummary(1, 0, 4));
        List<String> flags = jdbcTemplate.queryForList("SELECT qc_flag FROM measurements", String.class);
        assertThat(flags).containsExactly("1");
    }

    @Test
    void profileRowCountsItsLevels() {
        store.upsert(profileLevels());

        Integer levels = jdbcTemplate.queryForObject(
                "SELECT level_count FROM profiles WHERE float_id = ? AND measured_at = ?", Integer.class, "2902755", T1);
        assertThat(levels).isEqualTo(3);

        store.upsert(List.of(measurement("2902755", T1, 50.0).build()));
        levels = jdbcTemplate.queryForObject(
                "SELECT level_count FROM profiles WHERE float_id = ? AND measured_at = ?", Integer.class, "2902755", T1);
        assertThat(levels).isEqualTo(4);
    }

    @Test
    void failedChunkKeepsEarlierChunksCommitted() {
        String tooLong = "x".repeat(100);
        List<Measurement> batch = List.of(
                measurement("2902755", T1, 5.0).build(),
                measurement("2902755", T1, 10.0).build(),
                measurement("2902755", T1, 20.0).build(),
                measurement("2902755", T1, 30.0).region(tooLong).build());

        assertThatThrownBy(() -> store.upsert(batch))
                .isInstanceOf(StoreWriteException.class)
                .satisfies(e -> {
                    StoreWriteException failure = (StoreWriteException) e;
                    assertThat(failure.getCommitted()).isEqualTo(new UpsertSummary(2, 0, 0));
                    assertThat(failure.getCommittedRows()).isEqualTo(2);
                });

        // the second chunk rolled back as a whole
        assertThat(store.queryFreshness().totalMeasurements()).isEqualTo(2);
    }

    @Test
    void emptyUpsertTouchesNothing() {
        assertThat(store.upsert(List.of())).isEqualTo(UpsertSummary.EMPTY);
        assertThat(store.queryFreshness().hasRealData()).isFalse();
        assertThat(store.queryFreshness().newestTimestamp()).isNull();
    }

    @Test
    void clearEmptiesDataButKeepsSchemaAndRuns() {
        store.upsert(profileLevels());
        store.recordRun(run("run-1"));

        store.clear();

        assertThat(store.queryFreshness().totalMeasurements()).isZero();
        assertThat(store.queryFreshness().totalProfiles()).isZero();
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM ingest_runs", Integer.class)).isEqualTo(1);
        assertThat(store.upsert(profileLevels()).inserted()).isEqualTo(4);
    }

    @Test
    void ensureSchemaIsIdempotent() {
        store.upsert(profileLevels());
        store.ensureSchema();
        assertThat(store.queryFreshness().totalMeasurements()).isEqualTo(4);
    }

    @Test
    void recordsRunsAndSwallowsAuditFailures() {
        store.recordRun(run("run-1"));
        // duplicate primary key: logged, not thrown
        store.recordRun(run("run-1"));

        assertThat(jdbcTemplate.queryForObject("SELECT status FROM ingest_runs WHERE run_id = ?", String.class, "run-1"))
                .isEqualTo("SUCCEEDED");
    }

    private static RefreshReport run(String runId) {
        return RefreshReport.builder()
                .runId(runId)
                .trigger(RefreshTrigger.MANUAL)
                .startedAt(Instant.parse("2024-03-01T02:00:00Z"))
                .completedAt(Instant.parse("2024-03-01T02:05:00Z"))
                .status(RefreshState.SUCCEEDED)
                .profilesSelected(4)
                .filesFetched(4)
                .upsert(new UpsertSummary(10, 0, 1))
                .build();
    }
}
