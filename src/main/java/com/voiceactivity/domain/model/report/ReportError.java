package com.voiceactivity.domain.model.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Structured failure of a report operation. Partial results already
 * emitted before the failure stay valid.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportError {

    public static final String MEMBER_FETCH_FAILED = "MEMBER_FETCH_FAILED";
    public static final String ERROR_BUDGET_EXHAUSTED = "ERROR_BUDGET_EXHAUSTED";
    public static final String BATCH_FAILED = "BATCH_FAILED";
    public static final String GENERATION_FAILED = "GENERATION_FAILED";

    private String code;
    private String message;
    private ReportStage stage;
    private boolean recoverable;
    private int retryCount;

    @Builder.Default
    private Map<String, Object> context = new HashMap<>();

    private Instant timestamp;
}
