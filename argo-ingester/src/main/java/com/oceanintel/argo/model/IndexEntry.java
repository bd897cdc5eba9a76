package com.oceanintel.argo.model;

import java.time.LocalDateTime;

/**
 * One row of the global profile index.
 *
 * @param fileRef   path of the profile file relative to the archive's dac/ root,
 *                  e.g. aoml/13857/profiles/R13857_001.nc
 * @param latitude  degrees north, signed
 * @param longitude degrees east, signed
 * @param date      profile date in UTC
 * @param floatId   WMO platform number (second path segment of fileRef)
 */
public record IndexEntry(String fileRef, double latitude, double longitude,
                         LocalDateTime date, String floatId) {
}
