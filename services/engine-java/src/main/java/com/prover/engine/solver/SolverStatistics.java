package com.prover.engine.solver;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe accumulator shared by every instrumented view of the satisfiability backend.
 */
public class SolverStatistics {

    private final AtomicLong calls = new AtomicLong();
    private final AtomicLong nanos = new AtomicLong();
    private final AtomicLong unknown = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    void record(long elapsedNanos, SatisfiabilityResult result) {
        calls.incrementAndGet();
        nanos.addAndGet(elapsedNanos);
        if (result instanceof SatisfiabilityResult.Unknown) unknown.incrementAndGet();
    }

    void recordError(long elapsedNanos) {
        calls.incrementAndGet();
        nanos.addAndGet(elapsedNanos);
        errors.incrementAndGet();
    }

    public SmtSolverStats snapshot() {
        return new SmtSolverStats(calls.get(), Duration.ofNanos(nanos.get()), unknown.get(), errors.get());
    }
}
