package com.oceanintel.argo.service;

import com.oceanintel.argo.model.ExtractionResult;
import com.oceanintel.argo.model.Measurement;
import com.oceanintel.argo.model.RawProfileFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ucar.ma2.Array;
import ucar.ma2.ArrayChar;
import ucar.ma2.Index;
import ucar.nc2.Attribute;
import ucar.nc2.NetcdfFile;
import ucar.nc2.Variable;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads Argo core profile files (NetCDF, format 3.1) with netCDF-Java.
 *
 * Variables used, all dimensioned (N_PROF) or (N_PROF, N_LEVELS):
 *   PLATFORM_NUMBER, DATA_MODE, JULD, LATITUDE, LONGITUDE,
 *   PRES, TEMP, PSAL (+ _QC), optionally DOXY, PH_IN_SITU_TOTAL (+ _QC).
 * In 'A' (adjusted) and 'D' (delayed) mode the *_ADJUSTED values and flags are
 * used where the file has them.
 *
 * Fill values are missing, never zero. A level is kept only when the combined
 * PRES/TEMP/PSAL flag is good or probably good.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NetcdfProfileExtractor implements ProfileExtractor {

    static final String PRES = "PRES";
    static final String TEMP = "TEMP";
    static final String PSAL = "PSAL";
    static final String DOXY = "DOXY";
    static final String PH = "PH_IN_SITU_TOTAL";

    /** JULD counts days from this instant, UTC */
    static final LocalDateTime JULD_EPOCH = LocalDateTime.of(1950, 1, 1, 0, 0);

    /** Argo fill conventions: 99999 for measurements and positions, 999999 for JULD */
    private static final double ARGO_FILL = 99999.0;

    private final RegionClassifier regionClassifier;

    @Override
    public ExtractionResult extract(RawProfileFile raw) {
        String fileRef = raw.fileRef();
        NetcdfFile nc;
        try {
            nc = NetcdfFile.openInMemory(fileRef, raw.bytes());
        } catch (Exception e) {
            log.warn("Cannot open {} as NetCDF: {}", fileRef, e.getMessage());
            return ExtractionResult.failure(fileRef, "not a readable NetCDF file: " + e.getMessage());
        }

        try {
            return read(nc, raw);
        } catch (MissingVariableException e) {
            log.warn("Unexpected schema in {}: {}", fileRef, e.getMessage());
            return ExtractionResult.failure(fileRef, e.getMessage());
        } catch (Exception e) {
            log.warn("Failed reading {}: {}", fileRef, e.getMessage());
            return ExtractionResult.failure(fileRef, "unreadable profile data: " + e.getMessage());
        } finally {
            try {
                nc.close();
            } catch (IOException e) {
                log.debug("Close failed for {}: {}", fileRef, e.getMessage());
            }
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ExtractionResult read(NetcdfFile nc, RawProfileFile raw) throws IOException {
        Column juld = Column.required(nc, "JULD");
        Column latitude = Column.required(nc, "LATITUDE");
        Column longitude = Column.required(nc, "LONGITUDE");
        Variable presVar = require(nc, PRES);
        require(nc, TEMP);
        require(nc, PSAL);

        int[] shape = presVar.getShape();
        int nProf = shape.length == 2 ? shape[0] : 1;
        int nLevels = shape.length == 2 ? shape[1] : shape[0];

        char[] dataModes = readDataModes(nc, nProf);
        String[] platforms = readPlatforms(nc, nProf);

        List<Measurement> measurements = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int levelsRead = 0;
        int rejected = 0;
        int skipped = 0;

        Grid[] realtime = Grid.readAll(nc, false);
        Grid[] adjustedGrids = null;

        for (int i = 0; i < nProf; i++) {
            Grid[] grids = realtime;
            if (dataModes[i] == 'A' || dataModes[i] == 'D') {
                if (adjustedGrids == null) {
                    adjustedGrids = Grid.readAll(nc, true);
                }
                grids = adjustedGrids;
            }
            Grid pres = grids[0];
            Grid temp = grids[1];
            Grid psal = grids[2];
            Grid doxy = grids[3];
            Grid ph = grids[4];

            double days = juld.value(i);
            double lat = latitude.value(i);
            double lon = longitude.value(i);
            levelsRead += nLevels;
            if (Double.isNaN(days) || Double.isNaN(lat) || Double.isNaN(lon)) {
                skipped += nLevels;
                continue;
            }

            String floatId = platforms[i] != null ? platforms[i] : raw.floatId();
            LocalDateTime timestamp = JULD_EPOCH.plusSeconds(Math.round(days * 86400.0));
            String region = regionClassifier.classify(lat, lon);

            for (int j = 0; j < nLevels; j++) {
                double p = pres.value(i, j);
                if (Double.isNaN(p) || p < 0) {
                    skipped++;
                    continue;
                }
                double t = temp.value(i, j);
                double s = psal.value(i, j);

                char flag = QcFlags.combine(
                        pres.flag(i, j),
                        Double.isNaN(t) ? QcFlags.MISSING : temp.flag(i, j),
                        Double.isNaN(s) ? QcFlags.MISSING : psal.flag(i, j));
                if (!QcFlags.isAccepted(flag)) {
                    rejected++;
                    continue;
                }

                double depth = PressureDepthConverter.depth(p, lat);
                if (!seen.add(timestamp + "|" + depth)) {
                    // same depth already taken from the primary profile
                    skipped++;
                    continue;
                }

                measurements.add(Measurement.builder()
                        .floatId(floatId)
                        .timestamp(timestamp)
                        .depth(depth)
                        .latitude(lat)
                        .longitude(lon)
                        .pressure(p)
                        .temperature(t)
                        .salinity(s)
                        .dissolvedOxygen(doxy.acceptedValue(i, j))
                        .ph(ph.acceptedValue(i, j))
                        .qcFlag(flag)
                        .region(region)
                        .fileRef(raw.fileRef())
                        .build());
            }
        }

        log.debug("Extracted {}: {} measurements from {} levels ({} rejected by QC, {} skipped)",
                raw.fileRef(), measurements.size(), levelsRead, rejected, skipped);
        return ExtractionResult.success(raw.fileRef(), measurements, levelsRead, rejected, skipped);
    }

    private static Variable require(NetcdfFile nc, String name) {
        Variable v = nc.findVariable(name);
        if (v == null) {
            throw new MissingVariableException(name);
        }
        return v;
    }

    private char[] readDataModes(NetcdfFile nc, int nProf) throws IOException {
        char[] modes = new char[nProf];
        Arrays.fill(modes, 'R');
        Variable v = nc.findVariable("DATA_MODE");
        if (v != null) {
            Array arr = v.read();
            for (int i = 0; i < nProf && i < arr.getSize(); i++) {
                modes[i] = arr.getChar(i);
            }
        }
        return modes;
    }

    private String[] readPlatforms(NetcdfFile nc, int nProf) throws IOException {
        String[] platforms = new String[nProf];
        Variable v = nc.findVariable("PLATFORM_NUMBER");
        if (v == null) {
            return platforms;
        }
        Array arr = v.read();
        if (arr instanceof ArrayChar chars) {
            for (int i = 0; i < nProf; i++) {
                String s = chars.getRank() == 2 ? chars.getString(i) : chars.getString();
                platforms[i] = s == null || s.isBlank() ? null : s.trim();
            }
        }
        return platforms;
    }

    static boolean isFill(double value, double fill) {
        return Double.isNaN(value) || value == fill || Math.abs(value) >= ARGO_FILL;
    }

    private static double fillValueOf(Variable v) {
        Attribute fill = v.findAttribute("_FillValue");
        if (fill != null && fill.getNumericValue() != null) {
            return fill.getNumericValue().doubleValue();
        }
        return ARGO_FILL;
    }

    /**
     * Per-profile variable such as JULD or LATITUDE, with fills mapped to NaN.
     */
    private record Column(Array data, double fill) {

        static Column required(NetcdfFile nc, String name) throws IOException {
            Variable v = require(nc, name);
            return new Column(v.read(), fillValueOf(v));
        }

        double value(int i) {
            if (i >= data.getSize()) return Double.NaN;
            double d = data.getDouble(i);
            return isFill(d, fill) ? Double.NaN : d;
        }
    }

    /**
     * A (N_PROF, N_LEVELS) measurement and its per-level QC flags. An absent
     * optional variable reads as all-missing.
     */
    private record Grid(Array data, Array qc, double fill) {

        static final Grid ABSENT = new Grid(null, null, ARGO_FILL);

        /** PRES, TEMP, PSAL, DOXY, PH_IN_SITU_TOTAL in that order */
        static Grid[] readAll(NetcdfFile nc, boolean adjusted) throws IOException {
            return new Grid[] {
                    of(nc, PRES, adjusted, true),
                    of(nc, TEMP, adjusted, true),
                    of(nc, PSAL, adjusted, true),
                    of(nc, DOXY, adjusted, false),
                    of(nc, PH, adjusted, false)
            };
        }

        static Grid of(NetcdfFile nc, String name, boolean adjusted, boolean required) throws IOException {
            Variable v = null;
            Variable q = null;
            if (adjusted) {
                v = nc.findVariable(name + "_ADJUSTED");
                q = nc.findVariable(name + "_ADJUSTED_QC");
            }
            if (v == null) {
                v = nc.findVariable(name);
                q = nc.findVariable(name + "_QC");
            }
            if (v == null) {
                if (required) throw new MissingVariableException(name);
                return ABSENT;
            }
            return new Grid(v.read(), q != null ? q.read() : null, fillValueOf(v));
        }

        double value(int i, int j) {
            if (data == null) return Double.NaN;
            double d = data.getDouble(at(data, i, j));
            return isFill(d, fill) ? Double.NaN : d;
        }

        /** '0' (no QC) when the file has no flag variable */
        char flag(int i, int j) {
            if (qc == null) return '0';
            return QcFlags.normalise(qc.getChar(at(qc, i, j)));
        }

        Double acceptedValue(int i, int j) {
            double d = value(i, j);
            if (Double.isNaN(d) || !QcFlags.isAccepted(flag(i, j))) return null;
            return d;
        }

        private static Index at(Array arr, int i, int j) {
            Index idx = arr.getIndex();
            return arr.getRank() == 2 ? idx.set(i, j) : idx.set(j);
        }
    }

    static class MissingVariableException extends RuntimeException {
        MissingVariableException(String name) {
            super("required variable " + name + " not found");
        }
    }
}
