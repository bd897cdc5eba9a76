package com.oceanintel.argo.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One depth-resolved, quality-controlled reading ready for the store.
 *
 * Rows are unique on (floatId, timestamp, depth). Only qcFlag '1' (good) and
 * '2' (probably good) are ever persisted.
 */
@Value
@Builder
public class Measurement {

    // ── Identity ────────────────────────────────────────────────────────────
    String floatId;

    /** Profile time in UTC */
    LocalDateTime timestamp;

    /** Metres below the surface, derived from pressure and latitude */
    double depth;

    // ── Position ────────────────────────────────────────────────────────────
    double latitude;
    double longitude;

    // ── Core variables ──────────────────────────────────────────────────────
    /** Sea pressure in decibar */
    double pressure;

    /** In-situ temperature, degrees Celsius */
    double temperature;

    /** Practical salinity, PSU */
    double salinity;

    // ── Optional biogeochemical variables ───────────────────────────────────
    /** Dissolved oxygen, micromol/kg. Null when not measured or not good */
    Double dissolvedOxygen;

    /** pH on the total scale. Null when not measured or not good */
    Double ph;

    /** Combined QC code of the core variables at this level */
    char qcFlag;

    // ── Lineage ─────────────────────────────────────────────────────────────
    String region;
    String fileRef;
}
