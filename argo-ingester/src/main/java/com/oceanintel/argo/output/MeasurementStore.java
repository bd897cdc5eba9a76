package com.oceanintel.argo.output;

import com.oceanintel.argo.config.ArgoIngestProperties;
import com.oceanintel.argo.exception.StoreWriteException;
import com.oceanintel.argo.model.Measurement;
import com.oceanintel.argo.model.RefreshReport;
import com.oceanintel.argo.model.StoreFreshness;
import com.oceanintel.argo.model.UpsertSummary;
import com.oceanintel.argo.service.QcFlags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relational store for ingested profiles.
 *
 * measurements is keyed by (float_id, measured_at, depth), so writing the same
 * file twice updates rows in place instead of duplicating them. Writes are
 * committed in chunks; a failed chunk rolls back on its own and earlier chunks
 * stay committed.
 */
@Component
@Slf4j
public class MeasurementStore {

    private static final String UPDATE_MEASUREMENT = """
            UPDATE measurements
               SET latitude = ?, longitude = ?, pressure = ?, temperature = ?, salinity = ?,
                   dissolved_oxygen = ?, ph = ?, qc_flag = ?, region = ?, file_ref = ?, ingested_at = ?
             WHERE float_id = ? AND measured_at = ? AND depth = ?
            """;

    private static final String INSERT_MEASUREMENT = """
            INSERT INTO measurements
            (float_id, measured_at, depth, latitude, longitude, pressure, temperature, salinity,
             dissolved_oxygen, ph, qc_flag, region, file_ref, ingested_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String UPDATE_PROFILE = """
            UPDATE profiles
               SET latitude = ?, longitude = ?, region = ?, file_ref = ?, ingested_at = ?,
                   level_count = (SELECT COUNT(*) FROM measurements m
                                   WHERE m.float_id = ? AND m.measured_at = ?)
             WHERE float_id = ? AND measured_at = ?
            """;

    private static final String INSERT_PROFILE = """
            INSERT INTO profiles
            (float_id, measured_at, latitude, longitude, region, file_ref, ingested_at, level_count)
            SELECT ?, ?, ?, ?, ?, ?, ?, COUNT(*)
              FROM measurements m
             WHERE m.float_id = ? AND m.measured_at = ?
            """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final int chunkSize;

    public MeasurementStore(JdbcTemplate jdbcTemplate,
                            PlatformTransactionManager transactionManager,
                            ArgoIngestProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout((int) properties.getStore().getWriteTimeout().toSeconds());
        this.chunkSize = properties.getStore().getChunkSize();
    }

    public void ensureSchema() {
        log.info("Ensuring store schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS measurements
            (
                float_id            VARCHAR(16)      NOT NULL,
                measured_at         TIMESTAMP        NOT NULL,
                depth               DOUBLE PRECISION NOT NULL,
                latitude            DOUBLE PRECISION NOT NULL,
                longitude           DOUBLE PRECISION NOT NULL,
                pressure            DOUBLE PRECISION NOT NULL,
                temperature         DOUBLE PRECISION NOT NULL,
                salinity            DOUBLE PRECISION NOT NULL,
                dissolved_oxygen    DOUBLE PRECISION,
                ph                  DOUBLE PRECISION,
                qc_flag             CHAR(1)          NOT NULL,
                region              VARCHAR(64),
                file_ref            VARCHAR(255),
                ingested_at         TIMESTAMP        NOT NULL,
                PRIMARY KEY (float_id, measured_at, depth)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS profiles
            (
                float_id            VARCHAR(16)      NOT NULL,
                measured_at         TIMESTAMP        NOT NULL,
                latitude            DOUBLE PRECISION NOT NULL,
                longitude           DOUBLE PRECISION NOT NULL,
                region              VARCHAR(64),
                file_ref            VARCHAR(255),
                level_count         INT              NOT NULL,
                ingested_at         TIMESTAMP        NOT NULL,
                PRIMARY KEY (float_id, measured_at)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS ingest_runs
            (
                run_id                  VARCHAR(36)   NOT NULL PRIMARY KEY,
                trigger_type            VARCHAR(16)   NOT NULL,
                started_at              TIMESTAMP     NOT NULL,
                completed_at            TIMESTAMP,
                status                  VARCHAR(16)   NOT NULL,
                profiles_selected       INT           NOT NULL,
                files_fetched           INT           NOT NULL,
                fetch_errors            INT           NOT NULL,
                parse_errors            INT           NOT NULL,
                rejected_by_qc          INT           NOT NULL,
                measurements_inserted   INT           NOT NULL,
                measurements_updated    INT           NOT NULL,
                measurements_skipped    INT           NOT NULL,
                cancelled               BOOLEAN       NOT NULL,
                error_message           VARCHAR(2000)
            )
        """);

        log.info("Store schema ready.");
    }

    /**
     * Insert new rows and overwrite existing ones with the same key.
     *
     * Rows with a missing key or a QC flag other than good/probably good are
     * skipped, never written.
     *
     * @throws StoreWriteException when a chunk fails; carries what was committed before it
     */
    public UpsertSummary upsert(List<Measurement> measurements) {
        if (measurements.isEmpty()) return UpsertSummary.EMPTY;

        int total = measurements.size();
        log.info("Upserting {} measurements in chunks of {}", total, chunkSize);

        UpsertSummary committed = UpsertSummary.EMPTY;
        for (int i = 0; i < total; i += chunkSize) {
            List<Measurement> chunk = measurements.subList(i, Math.min(i + chunkSize, total));
            try {
                UpsertSummary chunkSummary = transactionTemplate.execute(status -> writeChunk(chunk));
                committed = committed.plus(chunkSummary);
                log.debug("Committed chunk {}/{}", Math.min(i + chunkSize, total), total);
            } catch (RuntimeException e) {
                log.error("Chunk write failed at offset {}: {}", i, e.getMessage(), e);
                throw new StoreWriteException("Store write failed at offset " + i + " of " + total
                        + ": " + e.getMessage(), committed, i, e);
            }
        }

        log.info("Upsert complete: {} inserted, {} updated, {} skipped",
                committed.inserted(), committed.updated(), committed.skipped());
        return committed;
    }

    public StoreFreshness queryFreshness() {
        Long measurements = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM measurements", Long.class);
        Long profiles = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM profiles", Long.class);
        LocalDateTime newest = jdbcTemplate.queryForObject("SELECT MAX(measured_at) FROM measurements", LocalDateTime.class);
        return new StoreFreshness(measurements == null ? 0 : measurements, profiles == null ? 0 : profiles, newest);
    }

    /**
     * Empty the measurement and profile tables. Run history is kept.
     */
    public void clear() {
        transactionTemplate.executeWithoutResult(status -> {
            int m = jdbcTemplate.update("DELETE FROM measurements");
            int p = jdbcTemplate.update("DELETE FROM profiles");
            log.warn("Store cleared: {} measurements and {} profiles removed", m, p);
        });
    }

    public void recordRun(RefreshReport run) {
        try {
            jdbcTemplate.update("""
                INSERT INTO ingest_runs
                (run_id, trigger_type, started_at, completed_at, status, profiles_selected, files_fetched,
                 fetch_errors, parse_errors, rejected_by_qc, measurements_inserted, measurements_updated,
                 measurements_skipped, cancelled, error_message)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                    run.getRunId(),
                    run.getTrigger().name(),
                    Timestamp.from(run.getStartedAt()),
                    run.getCompletedAt() != null ? Timestamp.from(run.getCompletedAt()) : null,
                    run.getStatus().name(),
                    run.getProfilesSelected(),
                    run.getFilesFetched(),
                    run.getFetchErrors(),
                    run.getParseErrors(),
                    run.getRejectedByQc(),
                    run.getUpsert().inserted(),
                    run.getUpsert().updated(),
                    run.getUpsert().skipped(),
                    run.isCancelled(),
                    truncate(run.getErrorMessage(), 2000));
        } catch (Exception e) {
            log.warn("Failed to write ingest run {}: {}", run.getRunId(), e.getMessage());
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private UpsertSummary writeChunk(List<Measurement> chunk) {
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        int inserted = 0;
        int updated = 0;
        int skipped = 0;
        Map<String, Measurement> touchedProfiles = new LinkedHashMap<>();

        for (Measurement m : chunk) {
            if (!isStorable(m)) {
                skipped++;
                continue;
            }
            int rows = jdbcTemplate.update(UPDATE_MEASUREMENT,
                    m.getLatitude(), m.getLongitude(), m.getPressure(), m.getTemperature(), m.getSalinity(),
                    m.getDissolvedOxygen(), m.getPh(), String.valueOf(m.getQcFlag()), m.getRegion(),
                    m.getFileRef(), now,
                    m.getFloatId(), m.getTimestamp(), m.getDepth());
            if (rows == 0) {
                jdbcTemplate.update(INSERT_MEASUREMENT,
                        m.getFloatId(), m.getTimestamp(), m.getDepth(), m.getLatitude(), m.getLongitude(),
                        m.getPressure(), m.getTemperature(), m.getSalinity(), m.getDissolvedOxygen(), m.getPh(),
                        String.valueOf(m.getQcFlag()), m.getRegion(), m.getFileRef(), now);
                inserted++;
            } else {
                updated++;
            }
            touchedProfiles.putIfAbsent(m.getFloatId() + "|" + m.getTimestamp(), m);
        }

        for (Measurement p : touchedProfiles.values()) {
            upsertProfile(p, now);
        }
        return new UpsertSummary(inserted, updated, skipped);
    }

    private void upsertProfile(Measurement p, LocalDateTime now) {
        int rows = jdbcTemplate.update(UPDATE_PROFILE,
                p.getLatitude(), p.getLongitude(), p.getRegion(), p.getFileRef(), now,
                p.getFloatId(), p.getTimestamp(),
                p.getFloatId(), p.getTimestamp());
        if (rows == 0) {
            jdbcTemplate.update(INSERT_PROFILE,
                    p.getFloatId(), p.getTimestamp(), p.getLatitude(), p.getLongitude(), p.getRegion(),
                    p.getFileRef(), now,
                    p.getFloatId(), p.getTimestamp());
        }
    }

    private boolean isStorable(Measurement m) {
        return m.getFloatId() != null
                && !m.getFloatId().isBlank()
                && m.getTimestamp() != null
                && !Double.isNaN(m.getDepth())
                && QcFlags.isAccepted(m.getQcFlag());
    }

    private String truncate(String val, int max) {
        if (val == null) return null;
        return val.length() <= max ? val : val.substring(0, max);
    }
}
