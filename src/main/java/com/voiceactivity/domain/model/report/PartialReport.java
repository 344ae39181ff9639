package com.voiceactivity.domain.model.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Bounded preview of the buckets so far. Never part of the final result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PartialReport {

    private String operationId;
    private int completedBatches;
    private int totalBatches;
    private int processedUsers;
    private int activeCount;
    private int inactiveCount;
    private int afkCount;
    private ClassifiedUsers preview;
}
