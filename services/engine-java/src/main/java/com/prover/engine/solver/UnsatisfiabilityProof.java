package com.prover.engine.solver;

import java.util.List;

/**
 * Evidence that a constraint set has no model.
 *
 * @param conflictingConstraints the constraints that jointly conflict, as readable labels
 */
public record UnsatisfiabilityProof(List<String> conflictingConstraints, String reason) {

    public UnsatisfiabilityProof {
        conflictingConstraints = List.copyOf(conflictingConstraints);
    }
}
