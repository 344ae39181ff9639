package com.voiceactivity.domain.model.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportProgress {

    private String operationId;
    private ReportStage stage;
    private int processedUsers;
    private int totalUsers;
    private int completedBatches;
    private int totalBatches;
    private int percentage;
    private long elapsedMs;
}
