package com.voiceactivity.domain.service;

import com.voiceactivity.domain.model.report.OperationStatus;
import com.voiceactivity.domain.model.report.PartialReport;
import com.voiceactivity.domain.model.report.ReportConfig;
import com.voiceactivity.domain.model.report.ReportListener;
import com.voiceactivity.domain.model.report.ReportProgress;
import com.voiceactivity.domain.model.report.ReportRequest;
import com.voiceactivity.domain.model.report.ReportResult;
import com.voiceactivity.domain.model.report.ReportStage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable state of one report operation. Counters are written only by the
 * operation's orchestrator thread, except those marked atomic.
 */
class OperationContext {

    final String operationId;
    final ReportRequest request;
    final ReportConfig config;
    final Instant startedAt;
    final long startedAtMillis;

    private final List<ReportListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    final AtomicInteger retries = new AtomicInteger();
    final List<String> skippedUserIds = new ArrayList<>();

    volatile ReportStage stage = ReportStage.INITIALIZING;
    volatile int totalUsers;
    volatile int totalBatches;
    volatile int completedBatches;
    volatile int processedUsers;
    volatile int errorCount;
    volatile int recoveredErrors;
    volatile long thresholdMs;
    volatile long lastProgressAt = -1;
    volatile Instant finishedAt;
    volatile ReportResult result;
    volatile ReportProgress lastProgress;
    volatile PartialReport lastPartial;

    OperationContext(String operationId, ReportRequest request, ReportConfig config, Instant startedAt) {
        this.operationId = operationId;
        this.request = request;
        this.config = config;
        this.startedAt = startedAt;
        this.startedAtMillis = startedAt.toEpochMilli();
    }

    boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /**
     * @return false once the operation is finalizing or finished, or when
     *         cancellation was already requested
     */
    synchronized boolean requestCancel() {
        if (stage == ReportStage.FINALIZING || stage.isTerminal()) {
            return false;
        }
        return cancelRequested.compareAndSet(false, true);
    }

    /**
     * Moves to FINALIZING unless a cancellation got in first.
     */
    synchronized boolean enterFinalizing() {
        if (cancelRequested.get()) {
            return false;
        }
        stage = ReportStage.FINALIZING;
        return true;
    }

    int inFlight() {
        return inFlight.get();
    }

    void admit() {
        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
    }

    void release() {
        inFlight.decrementAndGet();
    }

    int maxInFlightObserved() {
        return maxInFlight.get();
    }

    /**
     * @return false when the operation already finished; the caller should
     *         deliver the stored result instead
     */
    synchronized boolean addListener(ReportListener listener) {
        if (stage.isTerminal()) {
            return false;
        }
        listeners.add(listener);
        return true;
    }

    /**
     * Records the terminal result and returns the listeners to notify.
     */
    synchronized List<ReportListener> finish(ReportResult terminal, Instant now) {
        this.result = terminal;
        this.stage = terminal.getStage();
        this.finishedAt = now;
        return List.copyOf(listeners);
    }

    List<ReportListener> listeners() {
        return listeners;
    }

    ReportProgress progress(long nowMillis) {
        int percentage = totalUsers == 0 ? (stage.isTerminal() ? 100 : 0) : (int) (processedUsers * 100L / totalUsers);
        return ReportProgress.builder()
                .operationId(operationId)
                .stage(stage)
                .processedUsers(processedUsers)
                .totalUsers(totalUsers)
                .completedBatches(completedBatches)
                .totalBatches(totalBatches)
                .percentage(percentage)
                .elapsedMs(nowMillis - startedAtMillis)
                .build();
    }

    OperationStatus status(long nowMillis) {
        return OperationStatus.builder()
                .operationId(operationId)
                .guildId(request.getGuildId())
                .stage(stage)
                .progress(progress(nowMillis))
                .cancelRequested(isCancelRequested())
                .errorCount(errorCount)
                .maxInFlightObserved(maxInFlightObserved())
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .result(result)
                .build();
    }
}
