package com.voiceactivity.api;

import com.voiceactivity.config.AppProperties;
import com.voiceactivity.domain.model.report.MemoryStats;
import com.voiceactivity.domain.model.report.OperationStatus;
import com.voiceactivity.domain.model.report.ReportOperation;
import com.voiceactivity.domain.model.report.ReportRequest;
import com.voiceactivity.domain.service.ReportGenerationEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Report generation.
 *
 * Endpoints:
 * - POST /api/v1/reports - Start a report, returns the operation id
 * - GET /api/v1/reports/{operationId} - Status, and the result once finished
 * - GET /api/v1/reports/{operationId}/events - Progress/partial/final stream (SSE)
 * - DELETE /api/v1/reports/{operationId} - Cancel
 * - GET /api/v1/reports/memory - Memory monitor counters
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/reports")
@RequiredArgsConstructor
public class ReportController {

    private final ReportGenerationEngine engine;
    private final AppProperties properties;

    @PostMapping
    public ResponseEntity<Map<String, String>> startReport(@Valid @RequestBody ReportRequest request) {
        log.info("Start report: guild={}, filter={}, {}..{}",
                request.getGuildId(), request.getRoleFilter(), request.getStartDate(), request.getEndDate());

        ReportOperation operation = engine.generateReport(request, null);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("operationId", operation.getOperationId()));
    }

    @GetMapping("/{operationId}")
    public ResponseEntity<OperationStatus> getStatus(@PathVariable String operationId) {
        return engine.getOperationStatus(operationId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NoSuchElementException("Report not found: " + operationId));
    }

    @GetMapping(path = "/{operationId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@PathVariable String operationId) {
        SseEmitter emitter = new SseEmitter(properties.getReport().getSseTimeout().toMillis());
        if (!engine.subscribe(operationId, new SseReportListener(emitter))) {
            throw new NoSuchElementException("Report not found: " + operationId);
        }
        return emitter;
    }

    @DeleteMapping("/{operationId}")
    public ResponseEntity<Map<String, Object>> cancelReport(@PathVariable String operationId) {
        log.info("Cancel report: {}", operationId);
        boolean cancelled = engine.cancelReport(operationId);
        return ResponseEntity.ok(Map.of("operationId", operationId, "cancelled", cancelled));
    }

    @GetMapping("/memory")
    public ResponseEntity<MemoryStats> getMemoryStats() {
        return ResponseEntity.ok(engine.getMemoryStats());
    }
}
