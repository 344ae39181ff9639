package com.voiceactivity.domain.service;

import com.voiceactivity.config.AppProperties;
import com.voiceactivity.domain.model.report.MemoryStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class MemoryMonitorTest {

    private static final long MB = 1024L * 1024L;

    private final AtomicLong used = new AtomicLong();
    private MemoryMonitor monitor;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        properties.getReport().setRequestGc(false);
        monitor = new MemoryMonitor(used::get, properties);
    }

    @Test
    void testCheckAndCleanup_BelowThreshold_NoCleanup() {
        // Given
        AtomicInteger runs = new AtomicInteger();
        monitor.registerCleanupTask(runs::incrementAndGet);
        used.set(150 * MB);

        // When
        boolean cleaned = monitor.checkAndCleanup();

        // Then
        assertFalse(cleaned);
        assertEquals(0, runs.get());
    }

    @Test
    void testCheckAndCleanup_AboveThreshold_RunsEveryTask() {
        // Given
        AtomicInteger runs = new AtomicInteger();
        monitor.registerCleanupTask(() -> {
            throw new IllegalStateException("broken task");
        });
        monitor.registerCleanupTask(runs::incrementAndGet);
        used.set(250 * MB);

        // When
        boolean cleaned = monitor.checkAndCleanup();

        // Then
        assertTrue(cleaned);
        assertEquals(1, runs.get());
        assertEquals(1, monitor.getStats().getCleanupsPerformed());
    }

    @Test
    void testPeriodicCheck_AboveWarningRatio() {
        // Given: 80% of 256 MB is 204.8 MB
        AtomicInteger runs = new AtomicInteger();
        monitor.registerCleanupTask(runs::incrementAndGet);

        // When
        used.set(200 * MB);
        monitor.periodicCheck();
        used.set(210 * MB);
        monitor.periodicCheck();

        // Then
        assertEquals(1, runs.get());
    }

    @Test
    void testGetStats_TracksPeak() {
        used.set(120 * MB);
        monitor.currentUsage();
        used.set(80 * MB);

        MemoryStats stats = monitor.getStats();

        assertEquals(80 * MB, stats.getUsedBytes());
        assertEquals(120 * MB, stats.getPeakBytes());
        assertEquals(200 * MB, stats.getCleanupThresholdBytes());
        assertEquals(256 * MB, stats.getMaxBytes());
    }
}
