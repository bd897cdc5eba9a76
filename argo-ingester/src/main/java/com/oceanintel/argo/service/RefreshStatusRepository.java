package com.oceanintel.argo.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.oceanintel.argo.config.ArgoIngestProperties;
import com.oceanintel.argo.model.RefreshState;
import com.oceanintel.argo.model.RefreshStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Keeps the latest {@link RefreshStatus} in a JSON file so the status page and
 * the scheduler's first-run decision survive a restart.
 */
@Component
@Slf4j
public class RefreshStatusRepository {

    private final ObjectMapper objectMapper;
    private final Path statusFile;

    public RefreshStatusRepository(ObjectMapper objectMapper, ArgoIngestProperties properties) {
        this.objectMapper = objectMapper;
        this.statusFile = Paths.get(properties.getStore().getStatusFile());
    }

    /**
     * The persisted status, or {@link RefreshStatus#initial()} when there is none or
     * it cannot be read. A status left in RUNNING means the process died mid-run; it
     * comes back as FAILED.
     */
    public RefreshStatus load() {
        if (!Files.isRegularFile(statusFile)) {
            log.info("No refresh status at {}, starting fresh", statusFile);
            return RefreshStatus.initial();
        }
        try {
            RefreshStatus status = objectMapper.readValue(statusFile.toFile(), RefreshStatus.class);
            if (status.getState() == RefreshState.RUNNING) {
                log.warn("Previous refresh {} was interrupted (process stopped mid-run)", status.getLastRunId());
                return status.toBuilder()
                        .state(RefreshState.FAILED)
                        .lastError("interrupted: the process stopped while the refresh was running")
                        .errorCount(status.getErrorCount() + 1)
                        .summary("interrupted")
                        .build();
            }
            return status;
        } catch (IOException e) {
            log.warn("Unreadable refresh status at {}, starting fresh: {}", statusFile, e.getMessage());
            return RefreshStatus.initial();
        }
    }

    /**
     * Best effort: a failed write is logged and the in-memory status stays authoritative.
     */
    public void save(RefreshStatus status) {
        try {
            Path parent = statusFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = statusFile.resolveSibling(statusFile.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), status);
            Files.move(tmp, statusFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.warn("Could not write refresh status to {}: {}", statusFile, e.getMessage());
        }
    }

    public Path getStatusFile() {
        return statusFile;
    }
}
