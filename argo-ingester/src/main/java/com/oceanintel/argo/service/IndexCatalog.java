package com.oceanintel.argo.service;

import com.oceanintel.argo.config.ArgoIngestProperties;
import com.oceanintel.argo.exception.IndexEmptyException;
import com.oceanintel.argo.exception.IndexUnavailableException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Fetches the global Argo profile index (ar_index_global_prof.txt.gz).
 *
 * Every call downloads a fresh copy; nothing is cached between calls. The returned
 * snapshot parses lazily from the local copy and can be streamed more than once.
 */
@Service
@Slf4j
public class IndexCatalog {

    static final String RETRY_NAME = "argoIndex";

    private final ArgoArchiveClient archiveClient;
    private final Retry retry;
    private final Path indexFile;

    public IndexCatalog(ArgoArchiveClient archiveClient, RetryRegistry retryRegistry, ArgoIngestProperties properties) {
        this.archiveClient = archiveClient;
        this.retry = retryRegistry.retry(RETRY_NAME);
        this.indexFile = Paths.get(properties.getFetch().getDownloadDir(), "index", properties.getArchive().getIndexPath());
    }

    /**
     * Download the index and check that it contains at least one readable entry.
     * A copy that is not gzip or ends early counts as a failed download and is retried.
     *
     * @throws IndexUnavailableException the download failed after all retries
     * @throws IndexEmptyException       the download worked but no line parsed
     */
    public IndexSnapshot fetchIndex() {
        IndexSnapshot snapshot = new IndexSnapshot(indexFile);
        long entries;
        try {
            entries = retry.executeCheckedSupplier(() -> {
                archiveClient.downloadIndex(indexFile);
                return snapshot.scan();
            });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IndexUnavailableException("Interrupted while downloading the index", e);
        } catch (Throwable e) {
            log.error("Index unavailable after {} attempts: {}",
                    retry.getRetryConfig().getMaxAttempts(), e.getMessage());
            throw new IndexUnavailableException("Index unavailable from " + archiveClient.indexUrl()
                    + ": " + e.getMessage(), e);
        }

        if (entries == 0) {
            long malformed = snapshot.getIndexMalformedLines();
            log.error("Index downloaded but no entry could be parsed ({} malformed lines)", malformed);
            throw new IndexEmptyException("Index contains no parseable entries (" + malformed
                    + " malformed lines); the index format may have changed", malformed);
        }
        log.info("Index ready: {} entries, {} malformed lines", entries, snapshot.getIndexMalformedLines());
        return snapshot;
    }
}
