package com.prover.engine.solver;

/**
 * Tagged outcome of a satisfiability check.
 */
public sealed interface SatisfiabilityResult
        permits SatisfiabilityResult.Satisfiable, SatisfiabilityResult.Unsatisfiable, SatisfiabilityResult.Unknown {

    record Satisfiable(ConstraintModel model) implements SatisfiabilityResult {
    }

    record Unsatisfiable(UnsatisfiabilityProof proof) implements SatisfiabilityResult {
    }

    record Unknown(String reason) implements SatisfiabilityResult {
    }
}
