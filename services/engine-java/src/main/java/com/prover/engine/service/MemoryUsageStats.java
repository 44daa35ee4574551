package com.prover.engine.service;

/**
 * Heap figures sampled during a batch, in bytes.
 */
public record MemoryUsageStats(long peakHeapBytes, long currentHeapBytes, long budgetBytes) {
}
