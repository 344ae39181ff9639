package com.voiceactivity.domain.model.report;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to a started report. The future always completes normally with
 * the terminal {@link ReportResult}.
 */
@Getter
@AllArgsConstructor
public class ReportOperation {

    private final String operationId;
    private final CompletableFuture<ReportResult> result;
}
