package com.voiceactivity.domain.model.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportConfig {

    @Builder.Default
    private int batchSize = 50;

    @Builder.Default
    private int maxConcurrentBatches = 3;

    /** Retries after the first attempt. */
    @Builder.Default
    private int maxRetries = 3;

    @Builder.Default
    private long retryBaseDelayMs = 1000;

    /** Failed batches tolerated before the operation ends in ERROR. */
    @Builder.Default
    private int maxErrors = 3;

    @Builder.Default
    private int partialEveryBatches = 3;

    @Builder.Default
    private int activePreviewLimit = 20;

    @Builder.Default
    private int otherPreviewLimit = 10;

    @Builder.Default
    private long progressIntervalMs = 2000;

    @Builder.Default
    private boolean enablePartialResults = true;

    @Builder.Default
    private boolean enableErrorRecovery = true;

    @Builder.Default
    private boolean useCache = true;

    /** Overrides role and guild thresholds when set. */
    private Integer minActivityHours;
}
