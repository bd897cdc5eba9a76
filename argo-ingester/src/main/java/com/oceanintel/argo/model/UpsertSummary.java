package com.oceanintel.argo.model;

public record UpsertSummary(int inserted, int updated, int skipped) {

    public static final UpsertSummary EMPTY = new UpsertSummary(0, 0, 0);

    public UpsertSummary plus(UpsertSummary other) {
        return new UpsertSummary(inserted + other.inserted, updated + other.updated, skipped + other.skipped);
    }

    /** Rows now present in the store as a result of this upsert. */
    public int written() {
        return inserted + updated;
    }
}
