package com.voiceactivity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Voice Activity Service
 *
 * Tracks per-user voice presence sessions for many guilds, rolls completed
 * sessions up into daily, weekly and monthly aggregates, and generates
 * activity reports over those aggregates.
 *
 * Architecture:
 * - Session tracker fed by presence transition events (per-user ordered)
 * - Redis for live session state and hot cache, Caffeine as in-process fallback
 * - PostgreSQL for raw sessions and the three rollup tables
 * - Granularity router choosing the cheapest rollup for a date range
 * - Batch/streaming report engine with bounded concurrency, retry and
 *   memory backpressure
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class VoiceActivityApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceActivityApplication.class, args);
    }
}
