package com.voiceactivity.domain.service;

import com.voiceactivity.config.AppProperties;
import com.voiceactivity.domain.model.GuildMember;
import com.voiceactivity.domain.model.report.ClassifiedUsers;
import com.voiceactivity.domain.model.report.MemoryStats;
import com.voiceactivity.domain.model.report.OperationStatus;
import com.voiceactivity.domain.model.report.PartialReport;
import com.voiceactivity.domain.model.report.ReportConfig;
import com.voiceactivity.domain.model.report.ReportError;
import com.voiceactivity.domain.model.report.ReportListener;
import com.voiceactivity.domain.model.report.ReportOperation;
import com.voiceactivity.domain.model.report.ReportProgress;
import com.voiceactivity.domain.model.report.ReportRequest;
import com.voiceactivity.domain.model.report.ReportResult;
import com.voiceactivity.domain.model.report.ReportStage;
import com.voiceactivity.domain.model.report.ReportStatistics;
import com.voiceactivity.domain.model.report.UserActivityEntry;
import com.voiceactivity.infrastructure.directory.MemberDirectory;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Batch/streaming report generation.
 *
 * Processing Flow:
 * 1. Serve from the report cache when possible
 * 2. Load the members to report on and split them into fixed-size batches
 * 3. Keep at most maxConcurrentBatches batches in flight; admit the next one
 *    as each completes (completion queue polled every 100 ms)
 * 4. Retry a failing batch with exponential backoff, then count it against
 *    the error budget
 * 5. Emit a bounded preview every K batches and rate-limited progress
 * 6. Sample memory after each batch and clean up above the threshold
 * 7. Sort, cache and deliver the final result
 *
 * Stages: INITIALIZING, FETCHING_MEMBERS, PROCESSING_DATA, GENERATING_PARTIAL,
 * FINALIZING, then COMPLETED, ERROR or CANCELLED.
 *
 * Cancellation is checked before every admission. Batches already running
 * are left to finish and their results are dropped.
 */
@Slf4j
@Service
public class ReportGenerationEngine {

    private static final long POLL_INTERVAL_MS = 100;

    private final MemberDirectory memberDirectory;
    private final UserClassificationService classificationService;
    private final ReportCacheService reportCache;
    private final MemoryMonitor memoryMonitor;
    private final Executor orchestratorExecutor;
    private final Executor batchExecutor;
    private final AppProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Map<String, OperationContext> operations = new ConcurrentHashMap<>();

    public ReportGenerationEngine(MemberDirectory memberDirectory,
                                  UserClassificationService classificationService,
                                  ReportCacheService reportCache,
                                  MemoryMonitor memoryMonitor,
                                  @Qualifier("reportOrchestratorExecutor") Executor orchestratorExecutor,
                                  @Qualifier("reportBatchExecutor") Executor batchExecutor,
                                  AppProperties properties,
                                  Clock clock,
                                  MeterRegistry meterRegistry) {
        this.memberDirectory = memberDirectory;
        this.classificationService = classificationService;
        this.reportCache = reportCache;
        this.memoryMonitor = memoryMonitor;
        this.orchestratorExecutor = orchestratorExecutor;
        this.batchExecutor = batchExecutor;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        memoryMonitor.registerCleanupTask(this::evictStaleOperations);
    }

    /**
     * Starts a report and returns immediately.
     *
     * The listener receives progress, partial results and exactly one
     * terminal event. The returned future never completes exceptionally.
     */
    public ReportOperation generateReport(ReportRequest request, ReportListener listener) {
        validate(request);
        ReportConfig config = request.getConfig() != null
                ? request.getConfig()
                : properties.getReport().toReportConfig();

        String operationId = UUID.randomUUID().toString();
        OperationContext ctx = new OperationContext(operationId, request, config, clock.instant());
        ctx.addListener(listener != null ? listener : ReportListener.NO_OP);
        operations.put(operationId, ctx);

        log.info("Report {} started: guild={}, filter={}, range={}..{}",
                operationId, request.getGuildId(), request.getRoleFilter(), request.getStartDate(), request.getEndDate());

        try {
            CompletableFuture<ReportResult> future = CompletableFuture.supplyAsync(() -> run(ctx), orchestratorExecutor);
            return new ReportOperation(operationId, future);
        } catch (RejectedExecutionException e) {
            operations.remove(operationId);
            throw new IllegalStateException("Too many reports in progress, try again later", e);
        }
    }

    /**
     * @return false when the operation is unknown, already finalizing or finished
     */
    public boolean cancelReport(String operationId) {
        OperationContext ctx = operations.get(operationId);
        if (ctx == null || ctx.stage.isTerminal()) {
            return false;
        }
        boolean requested = ctx.requestCancel();
        if (requested) {
            log.info("Cancellation requested for report {}", operationId);
        }
        return requested;
    }

    /**
     * Attaches another subscriber. A running operation first replays its latest
     * partial result and progress event; a finished one delivers its terminal
     * event right away.
     *
     * @return false when the operation is unknown
     */
    public boolean subscribe(String operationId, ReportListener listener) {
        OperationContext ctx = operations.get(operationId);
        if (ctx == null) {
            return false;
        }
        if (!ctx.addListener(listener)) {
            deliverTerminal(listener, ctx.result);
            return true;
        }
        PartialReport partial = ctx.lastPartial;
        if (partial != null) {
            dispatch(List.of(listener), l -> l.onPartialResult(partial));
        }
        ReportProgress progress = ctx.lastProgress;
        if (progress != null) {
            dispatch(List.of(listener), l -> l.onProgress(progress));
        }
        return true;
    }

    public Optional<OperationStatus> getOperationStatus(String operationId) {
        return Optional.ofNullable(operations.get(operationId)).map(ctx -> ctx.status(clock.millis()));
    }

    public MemoryStats getMemoryStats() {
        return memoryMonitor.getStats();
    }

    public int getActiveOperationCount() {
        return (int) operations.values().stream().filter(ctx -> !ctx.stage.isTerminal()).count();
    }

    /**
     * Drops finished operations older than the retention window.
     */
    @Scheduled(fixedDelayString = "${app.report.operation-sweep-interval-ms:600000}")
    public int evictStaleOperations() {
        Instant cutoff = clock.instant().minus(properties.getReport().getOperationRetention());
        List<String> stale = operations.values().stream()
                .filter(ctx -> ctx.stage.isTerminal() && ctx.finishedAt != null && ctx.finishedAt.isBefore(cutoff))
                .map(ctx -> ctx.operationId)
                .toList();
        stale.forEach(operations::remove);
        if (!stale.isEmpty()) {
            log.info("Evicted {} finished report operations", stale.size());
        }
        return stale.size();
    }

    private ReportResult run(OperationContext ctx) {
        ReportRequest request = ctx.request;
        ReportConfig config = ctx.config;
        ClassifiedUsers accumulated = new ClassifiedUsers();
        String cacheKey = reportCache.cacheKey(request);

        try {
            if (config.isUseCache()) {
                Optional<ReportResult> cached = reportCache.find(cacheKey);
                if (cached.isPresent()) {
                    return completeFromCache(ctx, cached.get());
                }
            }

            ctx.stage = ReportStage.FETCHING_MEMBERS;
            List<GuildMember> members;
            try {
                members = memberDirectory.findMembers(request.getGuildId(), request.getRoleFilter());
            } catch (RuntimeException e) {
                return fail(ctx, ReportError.MEMBER_FETCH_FAILED,
                        "Could not load guild members: " + e.getMessage(), true, accumulated);
            }

            List<List<GuildMember>> batches = partition(members, config.getBatchSize());
            ctx.totalUsers = members.size();
            ctx.totalBatches = batches.size();
            ctx.thresholdMs = classificationService.resolveThresholdMs(
                    request.getGuildId(), request.getRoleFilter(), config.getMinActivityHours());
            ctx.stage = ReportStage.PROCESSING_DATA;
            emitProgress(ctx, true);

            Retry retry = buildRetry(ctx);
            CompletionService<BatchOutcome> completion = new ExecutorCompletionService<>(batchExecutor);
            int next = 0;

            while (next < batches.size() || ctx.inFlight() > 0) {
                while (ctx.inFlight() < config.getMaxConcurrentBatches() && next < batches.size()
                        && !ctx.isCancelRequested()) {
                    int index = next++;
                    List<GuildMember> batch = batches.get(index);
                    ctx.admit();
                    completion.submit(() -> processBatch(ctx, retry, index, batch));
                }

                if (ctx.isCancelRequested()) {
                    return cancelled(ctx, accumulated);
                }

                Future<BatchOutcome> done = completion.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (done == null) {
                    continue;
                }
                ctx.release();
                BatchOutcome outcome = done.get();

                if (ctx.isCancelRequested()) {
                    return cancelled(ctx, accumulated);
                }

                if (outcome.isFailed()) {
                    ctx.errorCount++;
                    if (!config.isEnableErrorRecovery()) {
                        return fail(ctx, ReportError.BATCH_FAILED,
                                "Batch " + (outcome.getIndex() + 1) + " failed: " + outcome.getError().getMessage(),
                                true, accumulated);
                    }
                    if (ctx.errorCount > config.getMaxErrors()) {
                        return fail(ctx, ReportError.ERROR_BUDGET_EXHAUSTED,
                                ctx.errorCount + " batches failed, budget is " + config.getMaxErrors(),
                                true, accumulated);
                    }
                    ctx.recoveredErrors++;
                    batches.get(outcome.getIndex()).forEach(member -> ctx.skippedUserIds.add(member.getUserId()));
                    log.warn("Report {}: skipping failed batch {} ({} of {} tolerated errors used)",
                            ctx.operationId, outcome.getIndex() + 1, ctx.errorCount, config.getMaxErrors());
                } else {
                    accumulated.addAll(outcome.getUsers());
                }

                ctx.completedBatches++;
                ctx.processedUsers += outcome.getSize();
                emitProgress(ctx, false);

                if (config.isEnablePartialResults()
                        && ctx.completedBatches % config.getPartialEveryBatches() == 0
                        && ctx.completedBatches < ctx.totalBatches) {
                    emitPartial(ctx, accumulated);
                }

                memoryMonitor.checkAndCleanup();
            }

            if (!ctx.enterFinalizing()) {
                return cancelled(ctx, accumulated);
            }
            emitProgress(ctx, true);
            accumulated.sortByTimeDescending();
            ReportResult result = buildResult(ctx, accumulated, ReportStage.COMPLETED, null);

            if (result.isDegraded()) {
                log.warn("Report {} completed without {} members from failed batches; result not cached",
                        ctx.operationId, ctx.skippedUserIds.size());
            } else if (config.isUseCache()) {
                try {
                    reportCache.save(cacheKey, request, result);
                } catch (RuntimeException e) {
                    log.warn("Report {}: could not cache result: {}", ctx.operationId, e.getMessage());
                }
            }

            count(result.isDegraded() ? "degraded" : "completed");
            log.info("Report {} completed: {} members, {} batches, {} ms",
                    ctx.operationId, ctx.totalUsers, ctx.completedBatches, result.getStatistics().getProcessingTimeMs());
            dispatch(ctx.finish(result, clock.instant()), listener -> listener.onComplete(result));
            return result;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(ctx, ReportError.GENERATION_FAILED, "Report generation interrupted", false, accumulated);
        } catch (ExecutionException | RuntimeException e) {
            log.error("Report {} failed: {}", ctx.operationId, e.getMessage(), e);
            return fail(ctx, ReportError.GENERATION_FAILED, e.getMessage(), false, accumulated);
        }
    }

    private BatchOutcome processBatch(OperationContext ctx, Retry retry, int index, List<GuildMember> batch) {
        ReportRequest request = ctx.request;
        try {
            ClassifiedUsers users = retry.executeSupplier(() -> {
                if (ctx.isCancelRequested()) {
                    return new ClassifiedUsers();
                }
                return classificationService.classify(request.getGuildId(), batch,
                        request.getStartDate(), request.getEndDate(), ctx.thresholdMs);
            });
            Counter.builder("report.batches")
                    .tag("result", "success")
                    .register(meterRegistry)
                    .increment();
            return new BatchOutcome(index, batch.size(), users, null);

        } catch (RuntimeException e) {
            log.error("Report {}: batch {} failed after {} attempts: {}",
                    ctx.operationId, index + 1, ctx.config.getMaxRetries() + 1, e.getMessage());
            Counter.builder("report.batches")
                    .tag("result", "failed")
                    .register(meterRegistry)
                    .increment();
            return new BatchOutcome(index, batch.size(), new ClassifiedUsers(), e);
        }
    }

    /**
     * Delay before retry n (1-based) is base * 2^(n-1).
     */
    private Retry buildRetry(OperationContext ctx) {
        ReportConfig config = ctx.config;
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, config.getMaxRetries() + 1))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Math.max(1, config.getRetryBaseDelayMs()), 2.0))
                .build();
        Retry retry = Retry.of("report-batch-" + ctx.operationId, retryConfig);
        retry.getEventPublisher().onRetry(event -> {
            ctx.retries.incrementAndGet();
            log.warn("Report {}: retrying batch (attempt {}) in {} ms: {}", ctx.operationId,
                    event.getNumberOfRetryAttempts() + 1, event.getWaitInterval().toMillis(),
                    event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown");
        });
        return retry;
    }

    private ReportResult completeFromCache(OperationContext ctx, ReportResult cached) {
        if (!ctx.enterFinalizing()) {
            return cancelled(ctx, new ClassifiedUsers());
        }
        cached.setOperationId(ctx.operationId);
        cached.setFromCache(true);
        cached.setStage(ReportStage.COMPLETED);
        Counter.builder("report.cache")
                .tag("result", "hit")
                .register(meterRegistry)
                .increment();
        count("cached");
        log.info("Report {} served from cache", ctx.operationId);
        dispatch(ctx.finish(cached, clock.instant()), listener -> listener.onComplete(cached));
        return cached;
    }

    private ReportResult cancelled(OperationContext ctx, ClassifiedUsers accumulated) {
        accumulated.sortByTimeDescending();
        ReportResult result = buildResult(ctx, accumulated, ReportStage.CANCELLED, null);
        count("cancelled");
        log.info("Report {} cancelled after {} of {} batches", ctx.operationId, ctx.completedBatches, ctx.totalBatches);
        dispatch(ctx.finish(result, clock.instant()), listener -> listener.onCancelled(result));
        return result;
    }

    private ReportResult fail(OperationContext ctx, String code, String message, boolean recoverable,
                              ClassifiedUsers accumulated) {
        Map<String, Object> context = new HashMap<>();
        context.put("operationId", ctx.operationId);
        context.put("guildId", ctx.request.getGuildId());
        context.put("completedBatches", ctx.completedBatches);
        context.put("totalBatches", ctx.totalBatches);
        context.put("errorCount", ctx.errorCount);

        ReportError error = ReportError.builder()
                .code(code)
                .message(message)
                .stage(ctx.stage)
                .recoverable(recoverable)
                .retryCount(ctx.retries.get())
                .context(context)
                .timestamp(clock.instant())
                .build();

        accumulated.sortByTimeDescending();
        ReportResult result = buildResult(ctx, accumulated, ReportStage.ERROR, error);
        count("error");
        log.error("Report {} failed in {}: [{}] {}", ctx.operationId, error.getStage(), code, message);
        dispatch(ctx.finish(result, clock.instant()), listener -> listener.onError(error, result));
        return result;
    }

    private ReportResult buildResult(OperationContext ctx, ClassifiedUsers users, ReportStage stage, ReportError error) {
        List<UserActivityEntry> everyone = new ArrayList<>();
        everyone.addAll(users.getActive());
        everyone.addAll(users.getInactive());
        everyone.addAll(users.getAfk());
        long average = everyone.isEmpty() ? 0
                : everyone.stream().mapToLong(UserActivityEntry::getTotalTimeMs).sum() / everyone.size();

        boolean degraded = !ctx.skippedUserIds.isEmpty();
        ReportStatistics statistics = ReportStatistics.builder()
                .totalMembers(ctx.totalUsers)
                .activeCount(users.getActive().size())
                .inactiveCount(users.getInactive().size())
                .afkCount(users.getAfk().size())
                .averageActivityMs(average)
                .thresholdMs(ctx.thresholdMs)
                .processingTimeMs(clock.millis() - ctx.startedAtMillis)
                .memoryPeakBytes(memoryMonitor.getStats().getPeakBytes())
                .batchesProcessed(ctx.completedBatches)
                .errorsRecovered(ctx.recoveredErrors)
                .retries(ctx.retries.get())
                .build();

        return ReportResult.builder()
                .operationId(ctx.operationId)
                .guildId(ctx.request.getGuildId())
                .roleFilter(ctx.request.getRoleFilter())
                .startDate(ctx.request.getStartDate())
                .endDate(ctx.request.getEndDate())
                .stage(stage)
                .complete(stage == ReportStage.COMPLETED && !degraded)
                .degraded(degraded)
                .skippedUserIds(new ArrayList<>(ctx.skippedUserIds))
                .fromCache(false)
                .users(users)
                .statistics(statistics)
                .error(error)
                .generatedAt(clock.instant())
                .build();
    }

    private void emitProgress(OperationContext ctx, boolean force) {
        long now = clock.millis();
        if (!force && ctx.lastProgressAt >= 0 && now - ctx.lastProgressAt < ctx.config.getProgressIntervalMs()) {
            return;
        }
        ctx.lastProgressAt = now;
        ReportProgress progress = ctx.progress(now);
        ctx.lastProgress = progress;
        dispatch(ctx.listeners(), listener -> listener.onProgress(progress));
    }

    private void emitPartial(OperationContext ctx, ClassifiedUsers accumulated) {
        ctx.stage = ReportStage.GENERATING_PARTIAL;
        PartialReport partial = PartialReport.builder()
                .operationId(ctx.operationId)
                .completedBatches(ctx.completedBatches)
                .totalBatches(ctx.totalBatches)
                .processedUsers(ctx.processedUsers)
                .activeCount(accumulated.getActive().size())
                .inactiveCount(accumulated.getInactive().size())
                .afkCount(accumulated.getAfk().size())
                .preview(accumulated.preview(ctx.config.getActivePreviewLimit(), ctx.config.getOtherPreviewLimit()))
                .build();
        ctx.lastPartial = partial;
        dispatch(ctx.listeners(), listener -> listener.onPartialResult(partial));
        ctx.stage = ReportStage.PROCESSING_DATA;
    }

    private void deliverTerminal(ReportListener listener, ReportResult result) {
        switch (result.getStage()) {
            case COMPLETED -> dispatch(List.of(listener), l -> l.onComplete(result));
            case CANCELLED -> dispatch(List.of(listener), l -> l.onCancelled(result));
            default -> dispatch(List.of(listener), l -> l.onError(result.getError(), result));
        }
    }

    private void dispatch(List<ReportListener> listeners, Consumer<ReportListener> event) {
        for (ReportListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Report listener failed: {}", e.getMessage());
            }
        }
    }

    private void count(String result) {
        Counter.builder("report.operations")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private static List<List<GuildMember>> partition(List<GuildMember> members, int batchSize) {
        int size = Math.max(1, batchSize);
        List<List<GuildMember>> batches = new ArrayList<>();
        for (int i = 0; i < members.size(); i += size) {
            batches.add(new ArrayList<>(members.subList(i, Math.min(i + size, members.size()))));
        }
        return batches;
    }

    private static void validate(ReportRequest request) {
        if (request == null || request.getGuildId() == null || request.getGuildId().isBlank()) {
            throw new IllegalArgumentException("Report requires a guild id");
        }
        if (request.getStartDate() == null || request.getEndDate() == null) {
            throw new IllegalArgumentException("Report requires a start and end date");
        }
        if (request.getEndDate().isBefore(request.getStartDate())) {
            throw new IllegalArgumentException("Report end date is before start date");
        }
        ReportConfig config = request.getConfig();
        if (config != null && (config.getBatchSize() <= 0 || config.getMaxConcurrentBatches() <= 0
                || config.getPartialEveryBatches() <= 0 || config.getMaxRetries() < 0 || config.getMaxErrors() < 0)) {
            throw new IllegalArgumentException("Invalid report configuration: " + config);
        }
    }

    @Value
    private static class BatchOutcome {
        int index;
        int size;
        ClassifiedUsers users;
        RuntimeException error;

        boolean isFailed() {
            return error != null;
        }
    }
}
