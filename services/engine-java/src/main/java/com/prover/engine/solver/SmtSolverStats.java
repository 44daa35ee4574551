package com.prover.engine.solver;

import java.time.Duration;

/**
 * Counters of satisfiability backend interactions.
 */
public record SmtSolverStats(long solverCalls, Duration solverTime, long unknownResults, long errors) {

    public static final SmtSolverStats ZERO = new SmtSolverStats(0, Duration.ZERO, 0, 0);

    public SmtSolverStats minus(SmtSolverStats earlier) {
        return new SmtSolverStats(solverCalls - earlier.solverCalls, solverTime.minus(earlier.solverTime),
                unknownResults - earlier.unknownResults, errors - earlier.errors);
    }
}
