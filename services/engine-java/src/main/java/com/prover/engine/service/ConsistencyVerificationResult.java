package com.prover.engine.service;

import com.prover.engine.proof.FormalProof;
import com.prover.engine.solver.ConstraintModel;

import java.util.List;
import java.util.Optional;

/**
 * @param model              set for consistent sets
 * @param inconsistencyProof set for inconsistent sets
 */
public record ConsistencyVerificationResult(
        ConsistencyStatus status,
        List<InvariantInteraction> interactions,
        ConstraintModel model,
        FormalProof inconsistencyProof) {

    public ConsistencyVerificationResult {
        interactions = List.copyOf(interactions);
    }

    public Optional<FormalProof> proof() {
        return Optional.ofNullable(inconsistencyProof);
    }
}
