package com.oceanintel.argo.model;

import java.nio.file.Path;

/**
 * Downloaded bytes of one profile file. The float id comes from the index and is
 * used when the file itself does not carry a platform number.
 */
public record RawProfileFile(String fileRef, String floatId, byte[] bytes, Path localPath) {

    private static final byte[] NO_BYTES = new byte[0];

    public int size() {
        return bytes.length;
    }

    /** Reference to the same file once its payload has been consumed. */
    public RawProfileFile withoutBytes() {
        return new RawProfileFile(fileRef, floatId, NO_BYTES, localPath);
    }
}
