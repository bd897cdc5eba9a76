package com.oceanintel.argo.service;

import com.oceanintel.argo.config.ArgoIngestProperties;
import com.oceanintel.argo.exception.ArchiveNotFoundException;
import com.oceanintel.argo.model.FetchBatchResult;
import com.oceanintel.argo.model.FetchError;
import com.oceanintel.argo.model.FetchFailureReason;
import com.oceanintel.argo.model.FetchResult;
import com.oceanintel.argo.model.IndexEntry;
import com.oceanintel.argo.model.RawProfileFile;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FileFetcherTest {

    @TempDir
    Path downloadDir;

    private ArgoArchiveClient archiveClient;
    private FileFetcher fetcher;

    @BeforeEach
    void setUp() throws Exception {
        ArgoIngestProperties properties = new ArgoIngestProperties();
        properties.getFetch().setDownloadDir(downloadDir.toString());
        archiveClient = mock(ArgoArchiveClient.class);
        when(archiveClient.fetchProfile(anyString()))
                .thenAnswer(inv -> ("bytes of " + inv.getArgument(0)).getBytes(StandardCharsets.UTF_8));
        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(1))
                .ignoreExceptions(ArchiveNotFoundException.class)
                .build());
        fetcher = new FileFetcher(archiveClient, retryRegistry, properties);
    }

    private static List<IndexEntry> entries(int count) {
        List<IndexEntry> entries = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            entries.add(new IndexEntry(String.format("incois/2902755/profiles/R2902755_%03d.nc", i),
                    15.0, 70.0, LocalDateTime.of(2024, 1, i, 0, 0), "2902755"));
        }
        return entries;
    }

    @Test
    void oneFailingFileDoesNotAbortItsBatchAndOrderIsPreserved() throws Exception {
        List<IndexEntry> entries = entries(5);
        String third = entries.get(2).fileRef();
        when(archiveClient.fetchProfile(third)).thenThrow(new IOException("connection reset"));

        FetchBatchResult result = fetcher.fetchAll(entries, 2, 2);

        assertThat(result.results()).extracting(FetchResult::fileRef)
                .containsExactlyElementsOf(entries.stream().map(IndexEntry::fileRef).toList());
        assertThat(result.successCount()).isEqualTo(4);
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.fileRef()).isEqualTo(third);
            assertThat(error.reason()).isEqualTo(FetchFailureReason.IO_ERROR);
            assertThat(error.attempts()).isEqualTo(2);
        });
        assertThat(result.files()).extracting(RawProfileFile::fileRef).doesNotContain(third);
        assertThat(result.cancelled()).isFalse();
    }

    @Test
    void transientFailureIsRetried() throws Exception {
        List<IndexEntry> entries = entries(1);
        String ref = entries.get(0).fileRef();
        when(archiveClient.fetchProfile(ref))
                .thenThrow(new HttpTimeoutException("timed out"))
                .thenReturn(new byte[]{1, 2, 3});

        FetchBatchResult result = fetcher.fetchAll(entries, 5, 2);

        assertThat(result.files()).singleElement().satisfies(f -> assertThat(f.bytes()).containsExactly(1, 2, 3));
        verify(archiveClient, times(2)).fetchProfile(ref);
    }

    @Test
    void notFoundIsReportedWithoutRetry() throws Exception {
        List<IndexEntry> entries = entries(1);
        String ref = entries.get(0).fileRef();
        when(archiveClient.fetchProfile(ref)).thenThrow(new ArchiveNotFoundException("https://example.org/" + ref));

        FetchError error = fetcher.fetchAll(entries, 1, 1).errors().get(0);

        assertThat(error.reason()).isEqualTo(FetchFailureReason.NOT_FOUND);
        assertThat(error.attempts()).isEqualTo(1);
        verify(archiveClient, times(1)).fetchProfile(ref);
    }

    @Test
    void cancellationStopsBeforeTheNextBatch() {
        List<IndexEntry> entries = entries(5);
        AtomicInteger checks = new AtomicInteger();

        FetchBatchResult result = fetcher.fetchAll(entries, 2, 2, () -> checks.incrementAndGet() > 1);

        assertThat(result.cancelled()).isTrue();
        assertThat(result.results()).hasSize(2);
        assertThat(result.requested()).isEqualTo(5);
    }

    @Test
    void batchHandlerSeesEachBatchAndPayloadsAreReleased() {
        List<IndexEntry> entries = entries(6);
        List<Integer> payloadsPerBatch = new ArrayList<>();
        List<String> handled = new ArrayList<>();

        FetchBatchResult result = fetcher.fetchAll(entries, 2, 2, () -> false, batch -> {
            payloadsPerBatch.add((int) batch.stream().filter(r -> r.isSuccess() && r.file().size() > 0).count());
            batch.forEach(r -> handled.add(r.fileRef()));
        });

        assertThat(payloadsPerBatch).containsExactly(2, 2, 2);
        assertThat(handled).containsExactlyElementsOf(entries.stream().map(IndexEntry::fileRef).toList());
        assertThat(result.successCount()).isEqualTo(6);
        assertThat(result.files()).allSatisfy(f -> {
            assertThat(f.bytes()).isEmpty();
            assertThat(f.localPath()).exists();
        });
    }

    @Test
    void cancelledFetchHandsOverOnlyTheBatchesThatRan() {
        AtomicInteger checks = new AtomicInteger();
        List<Integer> batchSizes = new ArrayList<>();

        FetchBatchResult result = fetcher.fetchAll(entries(5), 2, 2, () -> checks.incrementAndGet() > 2,
                batch -> batchSizes.add(batch.size()));

        assertThat(batchSizes).containsExactly(2, 2);
        assertThat(result.cancelled()).isTrue();
        assertThat(result.results()).hasSize(4);
    }

    @Test
    void downloadedFilesAreKeptAndReused() throws Exception {
        List<IndexEntry> entries = entries(1);
        String ref = entries.get(0).fileRef();

        RawProfileFile first = fetcher.fetchAll(entries, 1, 1).files().get(0);
        assertThat(first.localPath()).exists().hasFileName("R2902755_001.nc");

        RawProfileFile second = fetcher.fetchAll(entries, 1, 1).files().get(0);
        assertThat(second.bytes()).isEqualTo(first.bytes());
        verify(archiveClient, times(1)).fetchProfile(eq(ref));
    }

    @Test
    void cachedFileIsUsedWithoutDownloading() throws Exception {
        List<IndexEntry> entries = entries(1);
        Files.write(downloadDir.resolve("R2902755_001.nc"), new byte[]{9, 9});

        RawProfileFile file = fetcher.fetchAll(entries, 1, 1).files().get(0);

        assertThat(file.bytes()).containsExactly(9, 9);
        verify(archiveClient, never()).fetchProfile(anyString());
    }

    @Test
    void emptyInputFetchesNothing() {
        FetchBatchResult result = fetcher.fetchAll(List.of(), 5, 2);
        assertThat(result.results()).isEmpty();
        assertThat(result.cancelled()).isFalse();
    }

    @Test
    void rejectsNonPositiveBatchSettings() {
        assertThatThrownBy(() -> fetcher.fetchAll(entries(1), 0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> fetcher.fetchAll(entries(1), 1, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void classifiesFailures() {
        assertThat(FileFetcher.classify(new ArchiveNotFoundException("u"))).isEqualTo(FetchFailureReason.NOT_FOUND);
        assertThat(FileFetcher.classify(new HttpTimeoutException("t"))).isEqualTo(FetchFailureReason.TIMEOUT);
        assertThat(FileFetcher.classify(new java.net.ConnectException("c"))).isEqualTo(FetchFailureReason.CONNECTION);
        assertThat(FileFetcher.classify(new ArgoArchiveClient.HttpStatusException("u", 503)))
                .isEqualTo(FetchFailureReason.HTTP_ERROR);
        assertThat(FileFetcher.classify(new IOException("x"))).isEqualTo(FetchFailureReason.IO_ERROR);
    }
}
