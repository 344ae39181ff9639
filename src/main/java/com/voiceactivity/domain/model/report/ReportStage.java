package com.voiceactivity.domain.model.report;

/**
 * Lifecycle of one report generation operation.
 */
public enum ReportStage {
    INITIALIZING,
    FETCHING_MEMBERS,
    PROCESSING_DATA,
    GENERATING_PARTIAL,
    FINALIZING,
    COMPLETED,
    ERROR,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == CANCELLED;
    }
}
