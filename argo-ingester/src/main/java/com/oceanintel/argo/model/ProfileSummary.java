package com.oceanintel.argo.model;

import java.time.LocalDateTime;

public record ProfileSummary(String floatId, LocalDateTime timestamp,
                             double latitude, double longitude,
                             String region, String fileRef,
                             int levelCount, LocalDateTime ingestedAt) {
}
