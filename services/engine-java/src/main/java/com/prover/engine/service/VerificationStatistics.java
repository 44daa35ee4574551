package com.prover.engine.service;

import com.prover.engine.solver.SmtSolverStats;

import java.time.Duration;
import java.util.Map;

/**
 * @param methodDistribution number of verified invariants per winning method, keyed by its rendering
 */
public record VerificationStatistics(
        Duration totalTime,
        int invariantsProcessed,
        int invariantsVerified,
        int proofsGenerated,
        Duration averageProofTime,
        MemoryUsageStats memoryUsage,
        SmtSolverStats solverStats,
        Map<String, Integer> methodDistribution) {

    public VerificationStatistics {
        methodDistribution = Map.copyOf(methodDistribution);
    }
}
