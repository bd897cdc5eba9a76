package com.oceanintel.argo.model;

import java.util.List;

public record CleanupReport(int filesDeleted, long bytesFreed, int filesKept, List<String> failures) {
}
