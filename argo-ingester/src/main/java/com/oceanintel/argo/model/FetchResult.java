package com.oceanintel.argo.model;

/**
 * Outcome of downloading one index entry: exactly one of file or error is set.
 */
public record FetchResult(IndexEntry entry, RawProfileFile file, FetchError error) {

    public static FetchResult success(IndexEntry entry, RawProfileFile file) {
        return new FetchResult(entry, file, null);
    }

    public static FetchResult failure(IndexEntry entry, FetchError error) {
        return new FetchResult(entry, null, error);
    }

    public boolean isSuccess() {
        return file != null;
    }

    /** Same outcome with the file's bytes dropped. */
    public FetchResult withoutPayload() {
        return isSuccess() ? success(entry, file.withoutBytes()) : this;
    }

    public String fileRef() {
        return entry.fileRef();
    }
}
