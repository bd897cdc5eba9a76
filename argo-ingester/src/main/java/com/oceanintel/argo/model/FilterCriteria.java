package com.oceanintel.argo.model;

import lombok.Builder;

import java.time.LocalDate;

/**
 * Geographic box and inclusive date range used to select profiles from the index.
 *
 * lonMin greater than lonMax is only accepted with {@code wrapLongitude}, meaning
 * the box crosses the antimeridian. maxProfiles of 0 means no cap.
 */
@Builder
public record FilterCriteria(double latMin, double latMax,
                             double lonMin, double lonMax,
                             boolean wrapLongitude,
                             LocalDate startDate, LocalDate endDate,
                             int maxProfiles) {

    public FilterCriteria {
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("startDate and endDate are required");
        }
        checkRange("latMin", latMin, -90, 90);
        checkRange("latMax", latMax, -90, 90);
        checkRange("lonMin", lonMin, -180, 180);
        checkRange("lonMax", lonMax, -180, 180);
        if (latMin > latMax) {
            throw new IllegalArgumentException("latMin " + latMin + " is greater than latMax " + latMax);
        }
        if (lonMin > lonMax && !wrapLongitude) {
            throw new IllegalArgumentException("lonMin " + lonMin + " is greater than lonMax " + lonMax
                    + " (set wrapLongitude to select across the antimeridian)");
        }
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("startDate " + startDate + " is after endDate " + endDate);
        }
        if (maxProfiles < 0) {
            throw new IllegalArgumentException("maxProfiles must be >= 0, was " + maxProfiles);
        }
    }

    public boolean containsPosition(double latitude, double longitude) {
        if (latitude < latMin || latitude > latMax) return false;
        if (lonMin <= lonMax) {
            return longitude >= lonMin && longitude <= lonMax;
        }
        return longitude >= lonMin || longitude <= lonMax;
    }

    public boolean containsDate(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    private static void checkRange(String name, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new IllegalArgumentException(name + " must be within [" + min + ", " + max + "], was " + value);
        }
    }
}
