package com.oceanintel.argo.service;

import com.oceanintel.argo.config.ArgoIngestProperties;
import com.oceanintel.argo.exception.ArchiveNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

/**
 * Plain HTTP access to an Argo GDAC mirror.
 *
 * Layout of the mirror:
 *   {baseUrl}ar_index_global_prof.txt.gz           global profile index
 *   {baseUrl}dac/{dac}/{float}/profiles/R*.nc       one file per float cycle
 *
 * No retries here; callers wrap these calls in their own Resilience4j retry.
 */
@Service
@Slf4j
public class ArgoArchiveClient {

    private final ArgoIngestProperties properties;
    private final HttpClient httpClient;

    public ArgoArchiveClient(ArgoIngestProperties properties) {
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getArchive().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Stream the global index to a local file. Written to a sibling temp file first
     * so a broken download never replaces a good one.
     */
    public void downloadIndex(Path destination) throws IOException, InterruptedException {
        String url = indexUrl();
        log.info("Downloading global index from: {}", url);

        HttpResponse<InputStream> response = send(url, properties.getArchive().getIndexTimeout(),
                HttpResponse.BodyHandlers.ofInputStream());

        Files.createDirectories(destination.toAbsolutePath().getParent());
        Path tmp = destination.resolveSibling(destination.getFileName() + ".part");
        try (InputStream body = response.body()) {
            long bytes = Files.copy(body, tmp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(tmp, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Index downloaded: {} bytes", bytes);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Fetch one profile file into memory. Profile files are small (tens of kB).
     */
    public byte[] fetchProfile(String fileRef) throws IOException, InterruptedException {
        String url = profileUrl(fileRef);
        log.debug("Fetching profile: {}", url);
        HttpResponse<byte[]> response = send(url, properties.getArchive().getProfileTimeout(),
                HttpResponse.BodyHandlers.ofByteArray());
        return response.body();
    }

    public String indexUrl() {
        return properties.getArchive().getBaseUrl() + properties.getArchive().getIndexPath();
    }

    public String profileUrl(String fileRef) {
        return properties.getArchive().getBaseUrl() + properties.getArchive().getProfilePrefix() + fileRef;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> HttpResponse<T> send(String url, Duration timeout, HttpResponse.BodyHandler<T> handler)
            throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .GET()
                .build();

        HttpResponse<T> response = httpClient.send(request, handler);

        if (response.statusCode() == 404) {
            discard(response);
            throw new ArchiveNotFoundException(url);
        }
        if (response.statusCode() != 200) {
            discard(response);
            throw new HttpStatusException(url, response.statusCode());
        }
        return response;
    }

    private void discard(HttpResponse<?> response) throws IOException {
        if (response.body() instanceof InputStream in) {
            in.close();
        }
    }

    /**
     * Non-200, non-404 answer from the archive. Retried like any other I/O failure.
     */
    public static class HttpStatusException extends IOException {

        public HttpStatusException(String url, int statusCode) {
            super("HTTP " + statusCode + " from " + url);
        }
    }
}
