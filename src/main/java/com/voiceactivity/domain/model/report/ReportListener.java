package com.voiceactivity.domain.model.report;

/**
 * Subscriber to one report operation. Exactly one of {@link #onComplete},
 * {@link #onError} or {@link #onCancelled} is delivered last.
 */
public interface ReportListener {

    ReportListener NO_OP = new ReportListener() {
    };

    default void onProgress(ReportProgress progress) {
    }

    default void onPartialResult(PartialReport partial) {
    }

    default void onComplete(ReportResult result) {
    }

    default void onError(ReportError error, ReportResult partialResult) {
    }

    default void onCancelled(ReportResult partialResult) {
    }
}
