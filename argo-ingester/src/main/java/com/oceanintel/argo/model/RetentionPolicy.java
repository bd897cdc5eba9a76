package com.oceanintel.argo.model;

import java.time.Duration;

public record RetentionPolicy(Duration keepFor) {

    public RetentionPolicy {
        if (keepFor == null || keepFor.isNegative()) {
            throw new IllegalArgumentException("retention must be zero or positive");
        }
    }

    public static RetentionPolicy ofDays(int days) {
        if (days < 0) {
            throw new IllegalArgumentException("retentionDays must be >= 0, was " + days);
        }
        return new RetentionPolicy(Duration.ofDays(days));
    }
}
