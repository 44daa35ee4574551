package com.prover.engine.proof;

import com.prover.engine.VerificationException;

import java.time.Duration;

/**
 * Cooperative time limit, checked at recursion points. Never interrupts a running step.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(0L, Long.MAX_VALUE);

    private final long startNanos;
    private final long budgetNanos;

    private Deadline(long startNanos, long budgetNanos) {
        this.startNanos = startNanos;
        this.budgetNanos = budgetNanos;
    }

    public static Deadline after(Duration budget) {
        return new Deadline(System.nanoTime(), budget.toNanos());
    }

    public static Deadline none() {
        return NONE;
    }

    public boolean expired() {
        return this != NONE && System.nanoTime() - startNanos >= budgetNanos;
    }

    public void check() throws VerificationException {
        if (expired()) {
            throw new VerificationException("proof timeout of " + Duration.ofNanos(budgetNanos).toMillis()
                    + "ms exceeded");
        }
    }
}
