package com.prover.engine.service;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class MemorySamplerTest {

    @Test
    void interleavedSessionsKeepTheirOwnPeaks() {
        AtomicLong heap = new AtomicLong(100);
        MemorySampler sampler = new MemorySampler(heap::get);

        MemorySampler.Session first = sampler.start();
        heap.set(5_000);
        first.sample();
        heap.set(200);
        MemorySampler.Session second = sampler.start();
        heap.set(300);
        second.sample();
        first.sample();

        assertThat(first.stats(10_000)).isEqualTo(new MemoryUsageStats(5_000, 300, 10_000));
        assertThat(second.stats(10_000)).isEqualTo(new MemoryUsageStats(300, 300, 10_000));
    }

    @Test
    void startTakesAnInitialSample() {
        MemorySampler.Session session = new MemorySampler(() -> 42L).start();

        assertThat(session.stats(100)).isEqualTo(new MemoryUsageStats(42, 42, 100));
    }
}
