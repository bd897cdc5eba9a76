package com.oceanintel.argo.output;

import com.opencsv.CSVWriter;
import com.oceanintel.argo.config.ArgoIngestProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Exports stored measurements as CSV, one row per depth level.
 *
 * File output pattern: {outputDir}/argo_measurements_{region|all}_{yyyyMMdd_HHmmss}.csv
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MeasurementCsvExporter {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private static final String[] HEADERS = {
            "float_id", "measured_at", "depth",
            "latitude", "longitude",
            "pressure", "temperature", "salinity",
            "dissolved_oxygen", "ph",
            "qc_flag", "region", "file_ref"
    };

    private final JdbcTemplate jdbcTemplate;
    private final ArgoIngestProperties properties;

    /**
     * Stream matching rows to {@code out}, ordered by float, time and depth.
     * Any filter may be null.
     *
     * @return number of data rows written
     */
    public int export(Writer out, String region, LocalDate from, LocalDate to) {
        StringBuilder sql = new StringBuilder("""
            SELECT float_id, measured_at, depth, latitude, longitude, pressure, temperature, salinity,
                   dissolved_oxygen, ph, qc_flag, region, file_ref
              FROM measurements
             WHERE 1 = 1
            """);
        List<Object> args = new ArrayList<>();
        if (region != null && !region.isBlank()) {
            sql.append(" AND region = ?");
            args.add(region);
        }
        if (from != null) {
            sql.append(" AND measured_at >= ?");
            args.add(from.atStartOfDay());
        }
        if (to != null) {
            sql.append(" AND measured_at < ?");
            args.add(to.plusDays(1).atStartOfDay());
        }
        sql.append(" ORDER BY float_id, measured_at, depth");

        AtomicInteger rows = new AtomicInteger();
        CSVWriter writer = new CSVWriter(out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END);

        if (properties.getOutput().getCsv().isIncludeHeader()) {
            writer.writeNext(HEADERS);
        }
        jdbcTemplate.query(sql.toString(), rs -> {
            writer.writeNext(toRow(rs));
            rows.incrementAndGet();
        }, args.toArray());

        try {
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("CSV export failed", e);
        }
        return rows.get();
    }

    /**
     * Export into a new file under the configured output directory.
     */
    public Path exportToFile(String region, LocalDate from, LocalDate to) {
        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        String scope = region == null || region.isBlank() ? "all" : region.replaceAll("[^A-Za-z0-9]+", "_");
        String filename = String.format("argo_measurements_%s_%s.csv", scope, LocalDateTime.now().format(FILE_STAMP));
        Path outputPath = outputDir.resolve(filename);

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            int rows = export(out, region, from, to);
            log.info("Written {} measurements to CSV: {}", rows, outputPath);
            return outputPath;
        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed", e);
        }
    }

    private String[] toRow(ResultSet rs) throws SQLException {
        return new String[]{
                str(rs.getString("float_id")),
                str(rs.getObject("measured_at", LocalDateTime.class)),
                str(rs.getDouble("depth")),
                str(rs.getDouble("latitude")),
                str(rs.getDouble("longitude")),
                str(rs.getDouble("pressure")),
                str(rs.getDouble("temperature")),
                str(rs.getDouble("salinity")),
                str(rs.getObject("dissolved_oxygen")),
                str(rs.getObject("ph")),
                str(rs.getString("qc_flag")),
                str(rs.getString("region")),
                str(rs.getString("file_ref"))
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
