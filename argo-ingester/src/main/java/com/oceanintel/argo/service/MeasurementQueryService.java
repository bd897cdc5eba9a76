package com.oceanintel.argo.service;

import com.oceanintel.argo.model.Measurement;
import com.oceanintel.argo.model.ProfileSummary;
import com.oceanintel.argo.model.StoreFreshness;
import com.oceanintel.argo.output.MeasurementStore;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Read side of the store, for the dashboard and the HTTP API.
 */
@Service
@RequiredArgsConstructor
public class MeasurementQueryService {

    static final int MAX_LIMIT = 1000;

    private static final RowMapper<ProfileSummary> PROFILE_ROW = (rs, i) -> new ProfileSummary(
            rs.getString("float_id"),
            rs.getObject("measured_at", LocalDateTime.class),
            rs.getDouble("latitude"),
            rs.getDouble("longitude"),
            rs.getString("region"),
            rs.getString("file_ref"),
            rs.getInt("level_count"),
            rs.getObject("ingested_at", LocalDateTime.class));

    private static final RowMapper<Measurement> MEASUREMENT_ROW = (rs, i) -> Measurement.builder()
            .floatId(rs.getString("float_id"))
            .timestamp(rs.getObject("measured_at", LocalDateTime.class))
            .depth(rs.getDouble("depth"))
            .latitude(rs.getDouble("latitude"))
            .longitude(rs.getDouble("longitude"))
            .pressure(rs.getDouble("pressure"))
            .temperature(rs.getDouble("temperature"))
            .salinity(rs.getDouble("salinity"))
            .dissolvedOxygen(rs.getObject("dissolved_oxygen", Double.class))
            .ph(rs.getObject("ph", Double.class))
            .qcFlag(rs.getString("qc_flag").charAt(0))
            .region(rs.getString("region"))
            .fileRef(rs.getString("file_ref"))
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final MeasurementStore store;

    public StoreFreshness freshness() {
        return store.queryFreshness();
    }

    /**
     * Most recent profiles first.
     */
    public List<ProfileSummary> latestProfiles(int limit) {
        return jdbcTemplate.query("""
            SELECT float_id, measured_at, latitude, longitude, region, file_ref, level_count, ingested_at
              FROM profiles
             ORDER BY measured_at DESC, float_id
             LIMIT ?
            """, PROFILE_ROW, checkLimit(limit));
    }

    /**
     * Depth levels of one profile, shallowest first. Without a timestamp the float's
     * latest profile is used.
     */
    public List<Measurement> profileMeasurements(String floatId, LocalDateTime timestamp) {
        if (floatId == null || floatId.isBlank()) {
            throw new IllegalArgumentException("floatId is required");
        }
        LocalDateTime at = timestamp;
        if (at == null) {
            at = jdbcTemplate.queryForObject(
                    "SELECT MAX(measured_at) FROM profiles WHERE float_id = ?", LocalDateTime.class, floatId);
            if (at == null) {
                return List.of();
            }
        }

        return jdbcTemplate.query("""
            SELECT float_id, measured_at, depth, latitude, longitude, pressure, temperature, salinity,
                   dissolved_oxygen, ph, qc_flag, region, file_ref
              FROM measurements
             WHERE float_id = ? AND measured_at = ?
             ORDER BY depth ASC
            """, MEASUREMENT_ROW, floatId, at);
    }

    /**
     * Float and measurement counts per region, with surface-to-bottom averages.
     */
    public List<Map<String, Object>> regionSummary() {
        String sql = """
            SELECT
                region,
                COUNT(DISTINCT float_id)       AS float_count,
                COUNT(*)                       AS measurement_count,
                AVG(temperature)               AS avg_temperature,
                AVG(salinity)                  AS avg_salinity,
                MAX(depth)                     AS max_depth,
                MAX(measured_at)               AS newest
            FROM measurements
            GROUP BY region
            ORDER BY measurement_count DESC
            """;
        return jdbcTemplate.queryForList(sql);
    }

    public List<Map<String, Object>> recentRuns(int limit) {
        return jdbcTemplate.queryForList("""
            SELECT run_id, trigger_type, started_at, completed_at, status, profiles_selected, files_fetched,
                   fetch_errors, parse_errors, rejected_by_qc, measurements_inserted, measurements_updated,
                   measurements_skipped, cancelled, error_message
              FROM ingest_runs
             ORDER BY started_at DESC
             LIMIT ?
            """, checkLimit(limit));
    }

    private int checkLimit(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be within [1, " + MAX_LIMIT + "], was " + limit);
        }
        return limit;
    }
}
