package com.prover.engine.proof;

import com.prover.engine.logic.PropertyFormula;

import java.time.Duration;
import java.util.List;

/**
 * A finished proof as stored in the cache and reported to callers.
 *
 * @param method the strategy that produced the steps
 */
public record FormalProof(
        String id,
        PropertyFormula statement,
        List<ProofStep> steps,
        ProofValidation validation,
        Duration generationTime,
        ProofComplexity complexity,
        VerificationMethod method) {

    public FormalProof {
        steps = List.copyOf(steps);
    }
}
