package com.voiceactivity.domain.service;

/**
 * Current memory usage of the process in bytes.
 */
@FunctionalInterface
public interface MemoryProbe {

    long usedBytes();
}
