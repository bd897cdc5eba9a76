package com.oceanintel.argo.config;

import com.oceanintel.argo.model.FilterCriteria;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
@Slf4j
@RequiredArgsConstructor
public class ArgoIngestConfiguration {

    private final ArgoIngestProperties properties;

    /**
     * Cross-field checks the annotations can't express. Fails startup rather than
     * the first run.
     */
    @PostConstruct
    public void validate() {
        FilterCriteria criteria = properties.toCriteria(clock());
        if (properties.getScheduling().getInterval().isZero() || properties.getScheduling().getInterval().isNegative()) {
            throw new IllegalArgumentException("argo-ingest.scheduling.interval must be positive");
        }
        if (!properties.getArchive().getBaseUrl().endsWith("/")) {
            throw new IllegalArgumentException("argo-ingest.archive.base-url must end with '/'");
        }
        log.info("Ingest window: lat [{}, {}], lon [{}, {}], {} to {}, max {} profiles, batches of {} with {} workers",
                criteria.latMin(), criteria.latMax(), criteria.lonMin(), criteria.lonMax(),
                criteria.startDate(), criteria.endDate(), criteria.maxProfiles(),
                properties.getFetch().getBatchSize(), properties.getFetch().getMaxWorkers());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Single thread: periodic runs never overlap on the timer itself. */
    @Bean
    public TaskScheduler refreshTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("argo-refresh-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(300);
        return scheduler;
    }
}
