package com.oceanintel.argo.service;

import com.oceanintel.argo.config.ArgoIngestProperties;
import com.oceanintel.argo.exception.ArchiveNotFoundException;
import com.oceanintel.argo.model.FetchBatchResult;
import com.oceanintel.argo.model.FetchError;
import com.oceanintel.argo.model.FetchFailureReason;
import com.oceanintel.argo.model.FetchResult;
import com.oceanintel.argo.model.IndexEntry;
import com.oceanintel.argo.model.RawProfileFile;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Downloads profile files in sequential batches, each batch on a bounded pool.
 *
 * At most maxWorkers downloads are in flight. With a batch handler, each batch is
 * handed over as soon as it completes and its payloads are dropped afterwards, so
 * no more than batchSize downloaded files are held at once. Without a handler every
 * payload stays in the returned result.
 * A failed file becomes a {@link FetchError}; it never aborts its batch.
 */
@Service
@Slf4j
public class FileFetcher {

    static final String RETRY_NAME = "argoProfile";

    private final ArgoArchiveClient archiveClient;
    private final Retry retry;
    private final Path downloadDir;

    public FileFetcher(ArgoArchiveClient archiveClient, RetryRegistry retryRegistry, ArgoIngestProperties properties) {
        this.archiveClient = archiveClient;
        this.retry = retryRegistry.retry(RETRY_NAME);
        this.downloadDir = Paths.get(properties.getFetch().getDownloadDir());
    }

    public FetchBatchResult fetchAll(List<IndexEntry> entries, int batchSize, int maxWorkers) {
        return fetchAll(entries, batchSize, maxWorkers, () -> false);
    }

    /**
     * Fetch every entry, results in entry order regardless of which worker finished
     * first. The cancel signal is checked before each batch; a running batch always
     * completes.
     */
    public FetchBatchResult fetchAll(List<IndexEntry> entries, int batchSize, int maxWorkers, BooleanSupplier cancelled) {
        return fetchAll(entries, batchSize, maxWorkers, cancelled, null);
    }

    /**
     * Like {@link #fetchAll(List, int, int, BooleanSupplier)}, handing each completed batch
     * to {@code onBatch} on the calling thread. The returned results keep entries, errors and
     * local paths but no payload bytes.
     */
    public FetchBatchResult fetchAll(List<IndexEntry> entries, int batchSize, int maxWorkers,
                                     BooleanSupplier cancelled, Consumer<List<FetchResult>> onBatch) {
        if (batchSize < 1 || maxWorkers < 1) {
            throw new IllegalArgumentException("batchSize and maxWorkers must be >= 1");
        }
        if (entries.isEmpty()) {
            return new FetchBatchResult(List.of(), 0, false);
        }

        List<FetchResult> results = new ArrayList<>(entries.size());
        int batches = (entries.size() + batchSize - 1) / batchSize;
        boolean stopped = false;

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(maxWorkers, batchSize), workerThreads());
        try {
            for (int start = 0, batchNo = 1; start < entries.size(); start += batchSize, batchNo++) {
                if (cancelled.getAsBoolean()) {
                    log.warn("Fetch cancelled: {} of {} batches done, {} files not attempted",
                            batchNo - 1, batches, entries.size() - start);
                    stopped = true;
                    break;
                }

                List<IndexEntry> batch = entries.subList(start, Math.min(start + batchSize, entries.size()));
                log.info("Fetching batch {}/{} ({} files)", batchNo, batches, batch.size());

                List<Callable<FetchResult>> tasks = new ArrayList<>(batch.size());
                for (IndexEntry entry : batch) {
                    tasks.add(() -> fetchOne(entry));
                }

                // invokeAll returns once every task in the batch is done, futures in task order
                List<Future<FetchResult>> futures = pool.invokeAll(tasks);
                List<FetchResult> done = new ArrayList<>(batch.size());
                for (int i = 0; i < batch.size(); i++) {
                    done.add(resolve(batch.get(i), futures.get(i)));
                }
                if (onBatch == null) {
                    results.addAll(done);
                } else {
                    onBatch.accept(List.copyOf(done));
                    for (FetchResult r : done) {
                        results.add(r.withoutPayload());
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Fetch interrupted after {} of {} files", results.size(), entries.size());
            stopped = true;
        } finally {
            pool.shutdownNow();
        }

        FetchBatchResult result = new FetchBatchResult(List.copyOf(results), entries.size(), stopped);
        log.info("Fetch complete: {} ok, {} failed, {} not attempted",
                result.successCount(), result.errors().size(), entries.size() - results.size());
        return result;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    FetchResult fetchOne(IndexEntry entry) {
        String fileRef = entry.fileRef();
        Path local = downloadDir.resolve(fileName(fileRef));

        if (isCached(local)) {
            try {
                log.debug("Already downloaded: {}", local.getFileName());
                return FetchResult.success(entry, new RawProfileFile(fileRef, entry.floatId(), Files.readAllBytes(local), local));
            } catch (IOException e) {
                log.warn("Cached copy of {} unreadable, downloading again: {}", fileRef, e.getMessage());
            }
        }

        AtomicInteger attempts = new AtomicInteger();
        try {
            byte[] bytes = retry.executeCheckedSupplier(() -> {
                attempts.incrementAndGet();
                return archiveClient.fetchProfile(fileRef);
            });
            return FetchResult.success(entry, new RawProfileFile(fileRef, entry.floatId(), bytes, store(local, bytes)));
        } catch (Throwable e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            FetchError error = new FetchError(fileRef, classify(e), String.valueOf(e.getMessage()), attempts.get());
            log.warn("Download failed: {}", error);
            return FetchResult.failure(entry, error);
        }
    }

    private FetchResult resolve(IndexEntry entry, Future<FetchResult> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // fetchOne catches everything; this is a bug path, still reported per file
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return FetchResult.failure(entry, new FetchError(entry.fileRef(), FetchFailureReason.IO_ERROR,
                    String.valueOf(cause.getMessage()), 0));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failure(entry, new FetchError(entry.fileRef(), FetchFailureReason.INTERRUPTED,
                    "interrupted", 0));
        }
    }

    private boolean isCached(Path local) {
        try {
            return Files.isRegularFile(local) && Files.size(local) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * Keep the downloaded bytes on disk until the retention cleanup removes them.
     * A failed write only costs a re-download next time.
     */
    private Path store(Path local, byte[] bytes) {
        try {
            Files.createDirectories(downloadDir);
            Path tmp = local.resolveSibling(local.getFileName() + ".part");
            Files.write(tmp, bytes);
            Files.move(tmp, local, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return local;
        } catch (IOException e) {
            log.warn("Could not keep a local copy of {}: {}", local.getFileName(), e.getMessage());
            return null;
        }
    }

    static String fileName(String fileRef) {
        int slash = fileRef.lastIndexOf('/');
        return slash >= 0 ? fileRef.substring(slash + 1) : fileRef;
    }

    static FetchFailureReason classify(Throwable e) {
        if (e instanceof ArchiveNotFoundException) return FetchFailureReason.NOT_FOUND;
        if (e instanceof HttpTimeoutException) return FetchFailureReason.TIMEOUT;
        if (e instanceof ConnectException || e instanceof SocketException) return FetchFailureReason.CONNECTION;
        if (e instanceof ArgoArchiveClient.HttpStatusException) return FetchFailureReason.HTTP_ERROR;
        if (e instanceof InterruptedException) return FetchFailureReason.INTERRUPTED;
        return FetchFailureReason.IO_ERROR;
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "argo-fetch-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
