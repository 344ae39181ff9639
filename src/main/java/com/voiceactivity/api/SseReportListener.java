package com.voiceactivity.api;

import com.voiceactivity.domain.model.report.PartialReport;
import com.voiceactivity.domain.model.report.ReportError;
import com.voiceactivity.domain.model.report.ReportListener;
import com.voiceactivity.domain.model.report.ReportProgress;
import com.voiceactivity.domain.model.report.ReportResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;

/**
 * Streams one report's events to a Server-Sent Events client.
 * Event names: progress, partial, complete, error, cancelled.
 */
@Slf4j
class SseReportListener implements ReportListener {

    private final SseEmitter emitter;

    SseReportListener(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void onProgress(ReportProgress progress) {
        send("progress", progress);
    }

    @Override
    public void onPartialResult(PartialReport partial) {
        send("partial", partial);
    }

    @Override
    public void onComplete(ReportResult result) {
        send("complete", result);
        emitter.complete();
    }

    @Override
    public void onError(ReportError error, ReportResult partialResult) {
        send("error", Map.of("error", error, "partialResult", partialResult));
        emitter.complete();
    }

    @Override
    public void onCancelled(ReportResult partialResult) {
        send("cancelled", partialResult);
        emitter.complete();
    }

    private void send(String name, Object data) {
        try {
            emitter.send(SseEmitter.event().name(name).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("SSE client gone, dropping {} event: {}", name, e.getMessage());
        }
    }
}
