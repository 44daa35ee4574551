package com.prover.engine.proof;

/**
 * Size summary of a finished proof.
 *
 * @param logicalDepth     largest dependency fan-in of a single step, not the depth of the dependency graph
 * @param complexityRating 0 to 10, bucketed from the step count
 */
public record ProofComplexity(
        int steps,
        int logicalDepth,
        int axiomsUsed,
        int lemmasRequired,
        int sizeEstimate,
        int complexityRating) {

    public boolean isWithinLimits(int maxComplexity) {
        return sizeEstimate <= maxComplexity;
    }

    public boolean isSimple() {
        return complexityRating <= 3;
    }

    public boolean isComplex() {
        return complexityRating >= 7;
    }
}
