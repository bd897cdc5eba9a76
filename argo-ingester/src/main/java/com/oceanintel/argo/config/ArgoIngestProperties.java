package com.oceanintel.argo.config;

import com.oceanintel.argo.model.FilterCriteria;
import com.oceanintel.argo.model.RefreshRequest;
import com.oceanintel.argo.model.RefreshTrigger;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "argo-ingest")
@Validated
@Data
public class ArgoIngestProperties {

    @Valid
    private Archive archive = new Archive();
    @Valid
    private Region region = new Region();
    @Valid
    private Fetch fetch = new Fetch();
    @Valid
    private Scheduling scheduling = new Scheduling();
    @Valid
    private Retention retention = new Retention();
    @Valid
    private Store store = new Store();
    @Valid
    private Regions regions = new Regions();
    @Valid
    private Output output = new Output();

    @Data
    public static class Archive {
        /** GDAC mirror root, must end with a slash */
        @NotBlank
        private String baseUrl = "https://data-argo.ifremer.fr/";
        @NotBlank
        private String indexPath = "ar_index_global_prof.txt.gz";
        /** Prefix between the base URL and an index file reference */
        private String profilePrefix = "dac/";
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(30);
        @NotNull
        private Duration indexTimeout = Duration.ofMinutes(10);
        @NotNull
        private Duration profileTimeout = Duration.ofSeconds(120);
    }

    @Data
    public static class Region {
        private double latMin = 10.0;
        private double latMax = 25.0;
        private double lonMin = 65.0;
        private double lonMax = 85.0;
        private boolean wrapLongitude = false;

        /** Fixed window. Ignored when windowDays is positive */
        private LocalDate startDate;
        private LocalDate endDate;

        /** Rolling window ending today (UTC). 0 disables it */
        @Min(0)
        private int windowDays = 60;

        @Min(0)
        private int maxProfiles = 50;
    }

    @Data
    public static class Fetch {
        @Min(1)
        private int batchSize = 5;
        @Min(1)
        private int maxWorkers = 2;
        @NotBlank
        private String downloadDir = "data/argo_downloads";
    }

    @Data
    public static class Scheduling {
        private boolean enabled = true;
        @NotNull
        private Duration interval = Duration.ofHours(24);
        /** Run straight away when there has never been a successful run */
        private boolean runOnStartup = true;
        /** Clean old downloads after every scheduled run */
        private boolean cleanupAfterRun = true;
    }

    @Data
    public static class Retention {
        @Min(0)
        private int days = 7;
    }

    @Data
    public static class Store {
        @NotBlank
        private String statusFile = "data/refresh-status.json";
        @Min(1)
        private int chunkSize = 1000;
        @NotNull
        private Duration writeTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Regions {
        private String fallbackName = "Indian Ocean";
        private List<NamedBox> boxes = new ArrayList<>(List.of(
                new NamedBox("Arabian Sea", 5.0, 25.0, 50.0, 75.0),
                new NamedBox("Bay of Bengal", 5.0, 25.0, 75.0, 95.0)));
    }

    @Data
    public static class NamedBox {
        private String name;
        private double latMin;
        private double latMax;
        private double lonMin;
        private double lonMax;

        public NamedBox() {
        }

        public NamedBox(String name, double latMin, double latMax, double lonMin, double lonMax) {
            this.name = name;
            this.latMin = latMin;
            this.latMax = latMax;
            this.lonMin = lonMin;
            this.lonMax = lonMax;
        }
    }

    @Data
    public static class Output {
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String outputDir = "data/export";
            private boolean includeHeader = true;
        }
    }

    /**
     * Criteria for a run starting now. With a rolling window the dates move with
     * the clock; the box and the cap never change after startup.
     */
    public FilterCriteria toCriteria(Clock clock) {
        LocalDate start = region.getStartDate();
        LocalDate end = region.getEndDate();
        if (region.getWindowDays() > 0) {
            end = LocalDate.now(clock.withZone(ZoneOffset.UTC));
            start = end.minusDays(region.getWindowDays());
        }
        return FilterCriteria.builder()
                .latMin(region.getLatMin())
                .latMax(region.getLatMax())
                .lonMin(region.getLonMin())
                .lonMax(region.getLonMax())
                .wrapLongitude(region.isWrapLongitude())
                .startDate(start)
                .endDate(end)
                .maxProfiles(region.getMaxProfiles())
                .build();
    }

    public RefreshRequest toRefreshRequest(Clock clock, RefreshTrigger trigger) {
        return new RefreshRequest(toCriteria(clock), fetch.getBatchSize(), fetch.getMaxWorkers(), trigger);
    }
}
