package com.voiceactivity.domain.model.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperationStatus {

    private String operationId;
    private String guildId;
    private ReportStage stage;
    private ReportProgress progress;
    private boolean cancelRequested;
    private int errorCount;
    private int maxInFlightObserved;
    private Instant startedAt;
    private Instant finishedAt;
    private ReportResult result;
}
