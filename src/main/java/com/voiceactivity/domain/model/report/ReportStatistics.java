package com.voiceactivity.domain.model.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportStatistics {

    private int totalMembers;
    private int activeCount;
    private int inactiveCount;
    private int afkCount;
    private long averageActivityMs;
    private long thresholdMs;
    private long processingTimeMs;
    private long memoryPeakBytes;
    private int batchesProcessed;
    private int errorsRecovered;
    private int retries;
}
