package com.oceanintel.argo.exception;

import java.io.IOException;

/**
 * HTTP 404 from the archive. Not retried.
 */
public class ArchiveNotFoundException extends IOException {

    public ArchiveNotFoundException(String url) {
        super("Not found: " + url);
    }
}
