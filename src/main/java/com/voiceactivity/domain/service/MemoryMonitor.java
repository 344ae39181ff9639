package com.voiceactivity.domain.service;

import com.voiceactivity.config.AppProperties;
import com.voiceactivity.domain.model.report.MemoryStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Samples memory and runs registered cleanup tasks when usage crosses the
 * cleanup threshold. Also checked periodically against 80% of the maximum.
 */
@Slf4j
@Component
public class MemoryMonitor {

    private static final long MB = 1024L * 1024L;
    private static final double WARNING_RATIO = 0.8;

    private final MemoryProbe probe;
    private final AppProperties properties;
    private final List<Runnable> cleanupTasks = new CopyOnWriteArrayList<>();
    private final AtomicLong peakBytes = new AtomicLong();
    private final AtomicLong cleanups = new AtomicLong();

    public MemoryMonitor(MemoryProbe probe, AppProperties properties) {
        this.probe = probe;
        this.properties = properties;
    }

    public void registerCleanupTask(Runnable task) {
        cleanupTasks.add(task);
    }

    /**
     * @return true when a cleanup pass ran
     */
    public boolean checkAndCleanup() {
        long used = sample();
        if (used <= cleanupThresholdBytes()) {
            return false;
        }
        log.warn("Memory usage {} MB above cleanup threshold {} MB, cleaning up",
                used / MB, properties.getReport().getMemoryCleanupThresholdMb());
        cleanup();
        return true;
    }

    @Scheduled(fixedDelayString = "${app.report.memory-check-interval-ms:10000}")
    public void periodicCheck() {
        long used = sample();
        long max = properties.getReport().getMaxMemoryMb() * MB;
        if (used > max * WARNING_RATIO) {
            log.warn("Memory usage {} MB above {}% of {} MB", used / MB, (int) (WARNING_RATIO * 100), max / MB);
            cleanup();
        }
    }

    public long currentUsage() {
        return sample();
    }

    public MemoryStats getStats() {
        return MemoryStats.builder()
                .usedBytes(probe.usedBytes())
                .peakBytes(peakBytes.get())
                .cleanupThresholdBytes(cleanupThresholdBytes())
                .maxBytes(properties.getReport().getMaxMemoryMb() * MB)
                .cleanupsPerformed(cleanups.get())
                .build();
    }

    private void cleanup() {
        for (Runnable task : cleanupTasks) {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Memory cleanup task failed: {}", e.getMessage(), e);
            }
        }
        if (properties.getReport().isRequestGc()) {
            System.gc();
        }
        cleanups.incrementAndGet();
    }

    private long sample() {
        long used = probe.usedBytes();
        peakBytes.accumulateAndGet(used, Math::max);
        return used;
    }

    private long cleanupThresholdBytes() {
        return properties.getReport().getMemoryCleanupThresholdMb() * MB;
    }
}
