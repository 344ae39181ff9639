package com.voiceactivity.config;

import com.voiceactivity.domain.service.MemoryProbe;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Heap usage of the running JVM.
     */
    @Bean
    public MemoryProbe memoryProbe() {
        return () -> {
            Runtime runtime = Runtime.getRuntime();
            return runtime.totalMemory() - runtime.freeMemory();
        };
    }
}
