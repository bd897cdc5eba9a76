package com.oceanintel.argo.service;

import com.oceanintel.argo.model.IndexEntry;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;

/**
 * A downloaded copy of the global index, parsed on demand.
 *
 * Index layout (comment lines start with '#', then one header line):
 *   file,date,latitude,longitude,ocean,profiler_type,institution,date_update
 *   aoml/13857/profiles/R13857_001.nc,19970729200300,0.267,-16.032,A,845,AO,20181011180520
 *
 * Each call to {@link #stream()} re-opens the file, so the snapshot is restartable.
 * The stream must be closed by the caller. {@link #scan()} reads the whole copy once
 * and records the size of the index, independent of how far later streams read.
 */
@Slf4j
public class IndexSnapshot {

    private static final DateTimeFormatter INDEX_DATE = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final String HEADER_PREFIX = "file,";
    private static final int MIN_COLUMNS = 4;

    private static final int COL_FILE      = 0;
    private static final int COL_DATE      = 1;
    private static final int COL_LATITUDE  = 2;
    private static final int COL_LONGITUDE = 3;

    private final Path file;
    private final AtomicLong entries = new AtomicLong();
    private final AtomicLong malformed = new AtomicLong();
    private volatile long indexEntries;
    private volatile long indexMalformedLines;

    public IndexSnapshot(Path file) {
        this.file = file;
    }

    /**
     * Lazily parsed entries in index order. Malformed lines are skipped and counted;
     * the counters restart with every new stream.
     */
    public Stream<IndexEntry> stream() {
        entries.set(0);
        malformed.set(0);
        BufferedReader reader = open();
        return reader.lines()
                .map(this::parseLine)
                .flatMap(Optional::stream)
                .peek(e -> entries.incrementAndGet())
                .onClose(() -> {
                    closeQuietly(reader);
                    log.info("Index scan: {} entries, {} malformed lines skipped", entries.get(), malformed.get());
                });
    }

    /**
     * Read the whole copy, checking that it decompresses to the end.
     *
     * @return number of valid entries in the index
     * @throws IOException the copy is not gzip, or is truncated
     */
    public long scan() throws IOException {
        entries.set(0);
        malformed.set(0);
        try (BufferedReader reader = newReader()) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (parseLine(line).isPresent()) {
                    entries.incrementAndGet();
                }
            }
        }
        indexEntries = entries.get();
        indexMalformedLines = malformed.get();
        return indexEntries;
    }

    /** Valid entries in the whole index, as counted by {@link #scan()}. */
    public long getIndexEntries() {
        return indexEntries;
    }

    /** Malformed lines in the whole index, as counted by {@link #scan()}. */
    public long getIndexMalformedLines() {
        return indexMalformedLines;
    }

    /** Entries parsed by the most recent stream. */
    public long getEntryCount() {
        return entries.get();
    }

    /** Malformed lines skipped by the most recent stream. */
    public long getMalformedLines() {
        return malformed.get();
    }

    public Path getFile() {
        return file;
    }

    Optional<IndexEntry> parseLine(String line) {
        if (line.isBlank() || line.startsWith("#") || line.startsWith(HEADER_PREFIX)) {
            return Optional.empty();
        }

        String[] cols = line.split(",", -1);
        if (cols.length < MIN_COLUMNS) {
            malformed.incrementAndGet();
            return Optional.empty();
        }

        String fileRef = cols[COL_FILE].trim();
        String floatId = floatIdOf(fileRef);
        Double lat = parseDouble(cols[COL_LATITUDE]);
        Double lng = parseDouble(cols[COL_LONGITUDE]);
        LocalDateTime date = parseDate(cols[COL_DATE]);

        if (floatId == null || lat == null || lng == null || date == null) {
            malformed.incrementAndGet();
            return Optional.empty();
        }
        return Optional.of(new IndexEntry(fileRef, lat, lng, date, floatId));
    }

    /**
     * dac/float/profiles/file.nc → float. Null when the path has another shape.
     */
    static String floatIdOf(String fileRef) {
        String[] parts = fileRef.split("/");
        if (parts.length < 3 || parts[1].isBlank()) return null;
        return parts[1];
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private BufferedReader open() {
        try {
            return newReader();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open index copy " + file, e);
        }
    }

    private BufferedReader newReader() throws IOException {
        return new BufferedReader(new InputStreamReader(
                new GZIPInputStream(Files.newInputStream(file), 65536), StandardCharsets.US_ASCII), 65536);
    }

    private Double parseDouble(String val) {
        if (val == null || val.isBlank()) return null;
        try {
            double d = Double.parseDouble(val.trim());
            return Double.isNaN(d) ? null : d;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private LocalDateTime parseDate(String val) {
        if (val == null || val.isBlank()) return null;
        try {
            return LocalDateTime.parse(val.trim(), INDEX_DATE);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private void closeQuietly(BufferedReader reader) {
        try {
            reader.close();
        } catch (IOException e) {
            log.warn("Could not close index copy {}: {}", file, e.getMessage());
        }
    }
}
