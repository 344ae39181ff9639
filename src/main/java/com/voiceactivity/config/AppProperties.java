package com.voiceactivity.config;

import com.voiceactivity.domain.model.report.ReportConfig;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    /**
     * Zone used to attribute a session to a calendar day.
     */
    @NotBlank
    private String zoneId = "UTC";

    private final Tracker tracker = new Tracker();
    private final Cache cache = new Cache();
    private final Guild guild = new Guild();
    private final Report report = new Report();

    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }

    @Data
    public static class Tracker {
        private Duration sessionTtl = Duration.ofHours(24);
        private Duration staleAfter = Duration.ofHours(24);
        @Positive
        private int dispatcherStripes = 8;
        private List<String> observationMarkers = new ArrayList<>(List.of("[관전]", "[대기]"));
    }

    @Data
    public static class Cache {
        private Duration liveActivityTtl = Duration.ofMinutes(5);
        private Duration guildSettingsTtl = Duration.ofMinutes(10);
        private Duration reportTtl = Duration.ofHours(2);
        private Duration reportMinTtl = Duration.ofHours(2);
        private Duration reportMaxTtl = Duration.ofHours(6);
        @Positive
        private long localMaxEntries = 10_000;
    }

    @Data
    public static class Guild {
        @Positive
        private int defaultActivityThresholdHours = 30;
        private List<String> afkRoleKeywords = new ArrayList<>(List.of("AFK", "잠수", "휴식"));
    }

    @Data
    public static class Report {
        @Positive
        private int batchSize = 50;
        @Positive
        private int maxConcurrentBatches = 3;
        private int maxRetries = 3;
        @Positive
        private long retryBaseDelayMs = 1000;
        private int maxErrors = 3;
        @Positive
        private int partialEveryBatches = 3;
        private int activePreviewLimit = 20;
        private int otherPreviewLimit = 10;
        private long progressIntervalMs = 2000;
        @Positive
        private long memoryCleanupThresholdMb = 200;
        @Positive
        private long maxMemoryMb = 256;
        private Duration operationRetention = Duration.ofHours(1);
        private boolean requestGc = true;
        private Duration sseTimeout = Duration.ofMinutes(5);

        public ReportConfig toReportConfig() {
            return ReportConfig.builder()
                    .batchSize(batchSize)
                    .maxConcurrentBatches(maxConcurrentBatches)
                    .maxRetries(maxRetries)
                    .retryBaseDelayMs(retryBaseDelayMs)
                    .maxErrors(maxErrors)
                    .partialEveryBatches(partialEveryBatches)
                    .activePreviewLimit(activePreviewLimit)
                    .otherPreviewLimit(otherPreviewLimit)
                    .progressIntervalMs(progressIntervalMs)
                    .build();
        }
    }
}
