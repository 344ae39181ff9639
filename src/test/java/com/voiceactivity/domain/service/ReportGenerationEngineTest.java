package com.voiceactivity.domain.service;

import com.voiceactivity.config.AppProperties;
import com.voiceactivity.domain.model.GuildMember;
import com.voiceactivity.domain.model.report.ClassifiedUsers;
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
import com.voiceactivity.domain.model.report.UserActivityEntry;
import com.voiceactivity.infrastructure.directory.MemberDirectory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.Answer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReportGenerationEngineTest {

    private static final String GUILD = "guild-1";
    private static final LocalDate START = LocalDate.of(2024, 3, 1);
    private static final LocalDate END = LocalDate.of(2024, 3, 31);
    private static final long HOUR_MS = Duration.ofHours(1).toMillis();

    @Mock
    private MemberDirectory memberDirectory;

    @Mock
    private UserClassificationService classificationService;

    @Mock
    private ReportCacheService reportCache;

    private ExecutorService orchestratorExecutor;
    private ExecutorService batchExecutor;
    private AppProperties properties;
    private AtomicLong usedMemory;
    private MemoryMonitor memoryMonitor;
    private MutableClock clock;
    private ReportGenerationEngine engine;

    @BeforeEach
    void setUp() {
        orchestratorExecutor = Executors.newCachedThreadPool();
        batchExecutor = Executors.newFixedThreadPool(8);
        properties = new AppProperties();
        properties.getReport().setRequestGc(false);
        usedMemory = new AtomicLong(10L * 1024 * 1024);
        memoryMonitor = new MemoryMonitor(usedMemory::get, properties);
        clock = new MutableClock(Instant.parse("2024-04-01T09:00:00Z"));
        engine = new ReportGenerationEngine(memberDirectory, classificationService, reportCache, memoryMonitor,
                orchestratorExecutor, batchExecutor, properties, clock, new SimpleMeterRegistry());
    }

    @AfterEach
    void tearDown() {
        orchestratorExecutor.shutdownNow();
        batchExecutor.shutdownNow();
    }

    @Test
    void testGenerateReport_ClassifiesEveryMember() throws Exception {
        // Given
        when(memberDirectory.findMembers(GUILD, null)).thenReturn(members(7));
        when(classificationService.classify(eq(GUILD), anyList(), eq(START), eq(END), anyLong()))
                .thenAnswer(activeAndInactive());
        RecordingListener listener = new RecordingListener();

        // When
        ReportOperation operation = engine.generateReport(request(config().batchSize(2).build()), listener);
        ReportResult result = operation.getResult().get(10, TimeUnit.SECONDS);

        // Then
        assertEquals(ReportStage.COMPLETED, result.getStage());
        assertTrue(result.isComplete());
        assertFalse(result.isDegraded());
        assertTrue(result.getSkippedUserIds().isEmpty());
        assertEquals(7, result.getUsers().size());
        assertEquals(4, result.getUsers().getActive().size());
        assertEquals(3, result.getUsers().getInactive().size());
        assertEquals(7, result.getStatistics().getTotalMembers());
        assertEquals(4, result.getStatistics().getBatchesProcessed());
        assertEquals(List.of("u6", "u4", "u2", "u0"), ids(result.getUsers().getActive()));
        assertEquals(1, listener.completed.size());
        assertTrue(listener.errors.isEmpty());
        assertFalse(listener.progress.isEmpty());
        verify(reportCache).save(any(), any(ReportRequest.class), eq(result));
    }

    @Test
    void testGenerateReport_NeverExceedsConcurrencyBound() throws Exception {
        // Given
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        when(memberDirectory.findMembers(GUILD, null)).thenReturn(members(20));
        when(classificationService.classify(eq(GUILD), anyList(), eq(START), eq(END), anyLong()))
                .thenAnswer(invocation -> {
                    maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                    try {
                        Thread.sleep(20);
                        return new ClassifiedUsers();
                    } finally {
                        running.decrementAndGet();
                    }
                });

        // When
        ReportOperation operation = engine.generateReport(
                request(config().batchSize(1).maxConcurrentBatches(3).build()), ReportListener.NO_OP);
        ReportResult result = operation.getResult().get(10, TimeUnit.SECONDS);

        // Then
        assertEquals(ReportStage.COMPLETED, result.getStage());
        assertTrue(maxRunning.get() <= 3, "max concurrent batches was " + maxRunning.get());
        OperationStatus status = engine.getOperationStatus(operation.getOperationId()).orElseThrow();
        assertTrue(status.getMaxInFlightObserved() <= 3);
        assertEquals(20, result.getStatistics().getBatchesProcessed());
    }

    @Test
    void testCancelReport_DuringSecondBatch_NoFurtherBatchesStart() throws Exception {
        // Given: 10 batches, one at a time, the second one blocks until released
        CountDownLatch secondBatchStarted = new CountDownLatch(1);
        CountDownLatch releaseSecondBatch = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        when(memberDirectory.findMembers(GUILD, null)).thenReturn(members(10));
        when(classificationService.classify(eq(GUILD), anyList(), eq(START), eq(END), anyLong()))
                .thenAnswer(invocation -> {
                    if (calls.incrementAndGet() == 2) {
                        secondBatchStarted.countDown();
                        releaseSecondBatch.await(5, TimeUnit.SECONDS);
                    }
                    return new ClassifiedUsers();
                });
        RecordingListener listener = new RecordingListener();

        ReportOperation operation = engine.generateReport(
                request(config().batchSize(1).maxConcurrentBatches(1).build()), listener);
        assertTrue(secondBatchStarted.await(5, TimeUnit.SECONDS));

        // When
        boolean cancelled = engine.cancelReport(operation.getOperationId());
        releaseSecondBatch.countDown();
        ReportResult result = operation.getResult().get(10, TimeUnit.SECONDS);

        // Then
        assertTrue(cancelled);
        assertEquals(ReportStage.CANCELLED, result.getStage());
        assertFalse(result.isComplete());
        assertEquals(1, listener.cancelled.size());
        assertTrue(listener.completed.isEmpty());
        assertEquals(2, calls.get());
        verify(reportCache, never()).save(any(), any(), any());
        assertFalse(engine.cancelReport(operation.getOperationId()));
    }

    @Test
    void testCancelReport_WhileFinalizing_RefusedAndReportCompletes() throws Exception {
        // Given: a subscriber that tries to cancel as soon as finalizing starts
        when(memberDirectory.findMembers(GUILD, null)).thenReturn(members(2));
        when(classificationService.classify(eq(GUILD), anyList(), eq(START), eq(END), anyLong()))
                .thenAnswer(activeAndInactive());
        List<Boolean> cancelAttempts = new CopyOnWriteArrayList<>();
        RecordingListener listener = new RecordingListener() {
            @Override
            public void onProgress(ReportProgress update) {
                super.onProgress(update);
                if (update.getStage() == ReportStage.FINALIZING) {
                    cancelAttempts.add(engine.cancelReport(update.getOperationId()));
                }
            }
        };

        // When
        ReportResult result = engine.generateReport(request(config().build()), listener)
                .getResult().get(10, TimeUnit.SECONDS);

        // Then
        assertEquals(List.of(false), cancelAttempts);
        assertEquals(ReportStage.COMPLETED, result.getStage());
        assertEquals(1, listener.completed.size());
        assertTrue(listener.cancelled.isEmpty());
    }

    @Test
    void testSubscribe_RunningOperation_ReplaysLatestPartialAndProgress() throws Exception {
        // Given: one batch at a time, a partial after every batch, the second batch blocks
        CountDownLatch secondBatchStarted = new CountDownLatch(1);
        CountDownLatch releaseSecondBatch = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        when(memberDirectory.findMembers(GUILD, null)).thenReturn(members(3));
        when(classificationService.classify(eq(GUILD), anyList(), eq(START), eq(END), anyLong()))
                .thenAnswer(invocation -> {
                    if (calls.incrementAndGet() == 2) {
                        secondBatchStarted.countDown();
                        releaseSecondBatch.await(5, TimeUnit.SECONDS);
                    }
                    return activeAndInactive().answer(invocation);
                });
        ReportOperation operation = engine.generateReport(request(config()
                .batchSize(1)
                .maxConcurrentBatches(1)
                .partialEveryBatches(1)
                .build()), null);
        assertTrue(secondBatchStarted.await(5, TimeUnit.SECONDS));
        RecordingListener late = new RecordingListener();

        // When
        boolean subscribed = engine.subscribe(operation.getOperationId(), late);
        List<PartialReport> replayedPartials = List.copyOf(late.partials);
        List<ReportProgress> replayedProgress = List.copyOf(late.progress);
        releaseSecondBatch.countDown();
        operation.getResult().get(10, TimeUnit.SECONDS);

        // Then
        assertTrue(subscribed);
        assertEquals(1, replayedPartials.size());
        assertEquals(1, replayedPartials.get(0).getCompletedBatches());
        assertEquals(1, replayedProgress.size());
        assertEquals(1, replayedProgress.get(0).getCompletedBatches());
        assertEquals(1, late.completed.size());
    }

    @Test
    void testGenerateReport_FailingBatchRetriedWithBackoff() throws Exception {
        // Given
        when(memberDirectory.findMembers(GUILD, null)).thenReturn(members(2));
        when(classificationService.classify(eq(GUILD), anyList(), eq(START), eq(END), anyLong()))
                .thenThrow(new IllegalStateException("query timeout"))
                .thenThrow(new IllegalStateException("query timeout"))
                .thenAnswer(activeAndInactive());

        // When
        ReportResult result = engine.generateReport(request(config().build()), ReportListener.NO_OP)
                .getResult().get(10, TimeUnit.SECONDS);

        // Then
        assertEquals(ReportStage.COMPLETED, result.getStage());
        assertEquals(2, result.getStatistics().getRetries());
        assertEquals(0, result.getStatistics().getErrorsRecovered());
        assertEquals(2, result.getUsers().size());
    }

    @Test
    void testGenerateReport_FailedBatchWithinBudget_Skipped() throws Exception {
        // Given: the batch holding u2 always fails
        when(memberDirectory.findMembers(GUILD, null)).thenReturn(members(4));
        when(classificationService.classify(eq(GUILD), anyList(), eq(START), eq(END), anyLong()))
                .thenAnswer(invocation -> {
                    List<GuildMember> batch = invocation.getArgument(1);
                    if (batch.get(0).getUserId().equals("u2")) {
                        throw new IllegalStateException("connection reset");
                    }
                    return activeAndInactive().answer(invocation);
                });

        // When
        ReportResult result = engine.generateReport(
                request(config().batchSize(1).maxRetries(1).build()), ReportListener.NO_OP)
                .getResult().get(10, TimeUnit.SECONDS);

        // Then
        assertEquals(ReportStage.COMPLETED, result.getStage());
        assertEquals(3, result.getUsers().size());
        assertEquals(1, result.getStatistics().getErrorsRecovered());
        assertTrue(result.isDegraded());
        assertFalse(result.isComplete());
        assertEquals(List.of("u2"), result.getSkippedUserIds());
        verify(classificationService, times(5)).classify(eq(GUILD), anyList(), eq(START), eq(END), anyLong());
        verify(reportCache, never()).save(any(), any(), any());
    }

    @Test
    void testGenerateReport_ErrorBudgetExhausted() throws Exception {
        // Given
        when(memberDirectory.findMembers(GUILD, null)).thenReturn(members(5));
        when(classificationService.classify(eq(GUILD), anyList(), eq(START), eq(END), anyLong()))
                .thenThrow(new IllegalStateException("database down"));
        RecordingListener listener = new RecordingListener();

        // When
        ReportResult result = engine.generateReport(
                request(config().batchSize(1).maxConcurrentBatches(1).maxRetries(0).maxErrors(1).build()), listener)
                .getResult().get(10, TimeUnit.SECONDS);

        // Then
        assertEquals(ReportStage.ERROR, result.getStage());
        assertEquals(ReportError.ERROR_BUDGET_EXHAUSTED, result.getError().getCode());
        assertEquals(ReportStage.PROCESSING_DATA, result.getError().getStage());
        assertEquals(1, listener.errors.size());
        assertEquals(2, listener.errors.get(0).getContext().get("errorCount"));
        verify(classificationService, times(2)).classify(eq(GUILD), anyList(), eq(START), eq(END), anyLong());
    }

    @Test
    void testGenerateReport_RecoveryDisabled_FirstFailureEndsReport() throws Exception {
        when(memberDirectory.findMembers(GUILD, null)).thenReturn(members(3));
        when(classificationService.classify(eq(GUILD), anyList(), eq(START), eq(END), anyLong()))
                .thenThrow(new IllegalStateException("database down"));

        ReportResult result = engine.generateReport(
                request(config().batchSize(1).maxConcurrentBatches(1).maxRetries(0).enableErrorRecovery(false).build()),
                ReportListener.NO_OP).getResult().get(10, TimeUnit.SECONDS);

        assertEquals(ReportStage.ERROR, result.getStage());
        assertEquals(ReportError.BATCH_FAILED, result.getError().getCode());
    }

    @Test
    void testGenerateReport_PartialResultsEveryKBatches_BoundedPreview() throws Exception {
        // Given
        when(memberDirectory.findMembers(GUILD, null)).thenReturn(members(20));
        when(classificationService.classify(eq(GUILD), anyList(), eq(START), eq(END), anyLong()))
                .thenAnswer(activeAndInactive());
        RecordingListener listener = new RecordingListener();

        // When
        ReportResult result = engine.generateReport(request(config()
                        .batchSize(2)
                        .partialEveryBatches(3)
                        .activePreviewLimit(2)
                        .otherPreviewLimit(1)
                        .build()), listener)
                .getResult().get(10, TimeUnit.SECONDS);

        // Then: 10 batches, partials after batches 3, 6 and 9
        assertEquals(ReportStage.COMPLETED, result.getStage());
        assertEquals(3, listener.partials.size());
        for (PartialReport partial : listener.partials) {
            assertTrue(partial.getPreview().getActive().size() <= 2);
            assertTrue(partial.getPreview().getInactive().size() <= 1);
            assertTrue(partial.getPreview().getAfk().size() <= 1);
        }
        assertEquals(List.of(3, 6, 9), listener.partials.stream().map(PartialReport::getCompletedBatches).toList());
        assertEquals(6, listener.partials.get(0).getActiveCount() + listener.partials.get(0).getInactiveCount());
        assertEquals(20, result.getUsers().size());
    }

    @Test
    void testGenerateReport_CachedResult_SkipsProcessing() throws Exception {
        // Given
        ReportResult cached = ReportResult.builder()
                .guildId(GUILD)
                .stage(ReportStage.COMPLETED)
                .complete(true)
                .users(new ClassifiedUsers())
                .build();
        when(reportCache.cacheKey(any())).thenReturn("report:guild-1:all:default:2024-03-01:2024-03-31");
        when(reportCache.find("report:guild-1:all:default:2024-03-01:2024-03-31")).thenReturn(Optional.of(cached));
        RecordingListener listener = new RecordingListener();

        // When
        ReportResult result = engine.generateReport(request(config().build()), listener)
                .getResult().get(10, TimeUnit.SECONDS);

        // Then
        assertTrue(result.isFromCache());
        assertEquals(1, listener.completed.size());
        verifyNoInteractions(memberDirectory, classificationService);
    }

    @Test
    void testGenerateReport_MemberFetchFails() throws Exception {
        when(memberDirectory.findMembers(GUILD, null)).thenThrow(new IllegalStateException("directory unavailable"));
        RecordingListener listener = new RecordingListener();

        ReportResult result = engine.generateReport(request(config().build()), listener)
                .getResult().get(10, TimeUnit.SECONDS);

        assertEquals(ReportStage.ERROR, result.getStage());
        assertEquals(ReportError.MEMBER_FETCH_FAILED, result.getError().getCode());
        assertEquals(ReportStage.FETCHING_MEMBERS, result.getError().getStage());
        assertEquals(1, listener.errors.size());
    }

    @Test
    void testGenerateReport_NoMembers_CompletesEmpty() throws Exception {
        when(memberDirectory.findMembers(GUILD, "Member")).thenReturn(List.of());

        ReportRequest request = request(config().build());
        request.setRoleFilter("Member");
        ReportResult result = engine.generateReport(request, ReportListener.NO_OP).getResult().get(10, TimeUnit.SECONDS);

        assertEquals(ReportStage.COMPLETED, result.getStage());
        assertEquals(0, result.getUsers().size());
        verify(classificationService, never()).classify(any(), anyList(), any(), any(), anyLong());
    }

    @Test
    void testGenerateReport_MemoryAboveThreshold_CleanupRunsPerBatch() throws Exception {
        // Given
        usedMemory.set(300L * 1024 * 1024);
        when(memberDirectory.findMembers(GUILD, null)).thenReturn(members(4));
        when(classificationService.classify(eq(GUILD), anyList(), eq(START), eq(END), anyLong()))
                .thenAnswer(activeAndInactive());

        // When
        ReportResult result = engine.generateReport(request(config().batchSize(1).build()), ReportListener.NO_OP)
                .getResult().get(10, TimeUnit.SECONDS);

        // Then
        assertEquals(ReportStage.COMPLETED, result.getStage());
        assertEquals(4, memoryMonitor.getStats().getCleanupsPerformed());
        assertEquals(300L * 1024 * 1024, result.getStatistics().getMemoryPeakBytes());
    }

    @Test
    void testSubscribe_FinishedOperation_DeliversTerminalEvent() throws Exception {
        // Given
        when(memberDirectory.findMembers(GUILD, null)).thenReturn(members(1));
        when(classificationService.classify(eq(GUILD), anyList(), eq(START), eq(END), anyLong()))
                .thenAnswer(activeAndInactive());
        ReportOperation operation = engine.generateReport(request(config().build()), ReportListener.NO_OP);
        operation.getResult().get(10, TimeUnit.SECONDS);
        RecordingListener late = new RecordingListener();

        // When
        boolean subscribed = engine.subscribe(operation.getOperationId(), late);

        // Then
        assertTrue(subscribed);
        assertEquals(1, late.completed.size());
        assertFalse(engine.subscribe("unknown", late));
    }

    @Test
    void testEvictStaleOperations_AfterRetentionWindow() throws Exception {
        // Given
        when(memberDirectory.findMembers(GUILD, null)).thenReturn(List.of());
        ReportOperation operation = engine.generateReport(request(config().build()), ReportListener.NO_OP);
        operation.getResult().get(10, TimeUnit.SECONDS);
        assertEquals(0, engine.evictStaleOperations());

        // When
        clock.advance(Duration.ofHours(2));
        int evicted = engine.evictStaleOperations();

        // Then
        assertEquals(1, evicted);
        assertTrue(engine.getOperationStatus(operation.getOperationId()).isEmpty());
    }

    @Test
    void testGenerateReport_InvalidRange_Rejected() {
        ReportRequest request = request(config().build());
        request.setEndDate(START.minusDays(1));

        assertThrows(IllegalArgumentException.class, () -> engine.generateReport(request, ReportListener.NO_OP));
        assertEquals(0, engine.getActiveOperationCount());
    }

    private static ReportConfig.ReportConfigBuilder config() {
        return ReportConfig.builder()
                .retryBaseDelayMs(1)
                .progressIntervalMs(0);
    }

    private static ReportRequest request(ReportConfig config) {
        return ReportRequest.builder()
                .guildId(GUILD)
                .startDate(START)
                .endDate(END)
                .config(config)
                .build();
    }

    private static List<GuildMember> members(int count) {
        List<GuildMember> members = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            members.add(GuildMember.builder().userId("u" + i).displayName("User " + i).build());
        }
        return members;
    }

    /**
     * Even-numbered users are active with i hours, odd-numbered users are inactive.
     */
    private static Answer<ClassifiedUsers> activeAndInactive() {
        return invocation -> {
            List<GuildMember> batch = invocation.getArgument(1);
            ClassifiedUsers users = new ClassifiedUsers();
            for (GuildMember member : batch) {
                int index = Integer.parseInt(member.getUserId().substring(1));
                UserActivityEntry entry = UserActivityEntry.builder()
                        .userId(member.getUserId())
                        .displayName(member.label())
                        .totalTimeMs(index * HOUR_MS)
                        .build();
                if (index % 2 == 0) {
                    users.getActive().add(entry);
                } else {
                    users.getInactive().add(entry);
                }
            }
            return users;
        };
    }

    private static List<String> ids(List<UserActivityEntry> entries) {
        return entries.stream().map(UserActivityEntry::getUserId).toList();
    }

    private static class RecordingListener implements ReportListener {

        final List<ReportProgress> progress = new CopyOnWriteArrayList<>();
        final List<PartialReport> partials = new CopyOnWriteArrayList<>();
        final List<ReportResult> completed = new CopyOnWriteArrayList<>();
        final List<ReportError> errors = new CopyOnWriteArrayList<>();
        final List<ReportResult> cancelled = new CopyOnWriteArrayList<>();

        @Override
        public void onProgress(ReportProgress update) {
            progress.add(update);
        }

        @Override
        public void onPartialResult(PartialReport partial) {
            partials.add(partial);
        }

        @Override
        public void onComplete(ReportResult result) {
            completed.add(result);
        }

        @Override
        public void onError(ReportError error, ReportResult partialResult) {
            errors.add(error);
        }

        @Override
        public void onCancelled(ReportResult partialResult) {
            cancelled.add(partialResult);
        }
    }

    private static class MutableClock extends Clock {

        private volatile Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
