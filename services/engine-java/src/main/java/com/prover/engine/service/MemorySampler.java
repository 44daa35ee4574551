package com.prover.engine.service;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Point-in-time heap sampling. Each document run opens its own {@link Session}, which keeps the running peak
 * of that run only. Samples are taken between invariants.
 */
public class MemorySampler {

    private final LongSupplier usedHeap;

    public MemorySampler(LongSupplier usedHeap) {
        this.usedHeap = usedHeap;
    }

    public static MemorySampler heap() {
        MemoryMXBean bean = ManagementFactory.getMemoryMXBean();
        return new MemorySampler(() -> bean.getHeapMemoryUsage().getUsed());
    }

    /**
     * Opens a session and takes its first sample.
     */
    public Session start() {
        Session session = new Session();
        session.sample();
        return session;
    }

    public final class Session {
        private final AtomicLong peak = new AtomicLong();
        private final AtomicLong last = new AtomicLong();

        private Session() {
        }

        public long sample() {
            long used = usedHeap.getAsLong();
            last.set(used);
            peak.accumulateAndGet(used, Math::max);
            return used;
        }

        public MemoryUsageStats stats(long budgetBytes) {
            return new MemoryUsageStats(peak.get(), last.get(), budgetBytes);
        }
    }
}
