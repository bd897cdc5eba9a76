package com.oceanintel.argo.model;

import java.time.LocalDateTime;

/**
 * What the UI needs to tell real ingested data apart from the sample fallback.
 */
public record StoreFreshness(long totalMeasurements, long totalProfiles, LocalDateTime newestTimestamp) {

    public boolean hasRealData() {
        return totalMeasurements > 0;
    }
}
