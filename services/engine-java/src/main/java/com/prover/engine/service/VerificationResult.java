package com.prover.engine.service;

import com.prover.engine.proof.FormalProof;
import com.prover.engine.solver.ConstraintModel;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of {@link DocumentVerifier#verifyDocument}.
 *
 * @param model witness of the global consistency check, null when it was not satisfiable
 */
public record VerificationResult(
        VerificationStatus status,
        List<VerifiedInvariant> verifiedInvariants,
        List<FormalProof> proofs,
        ConstraintModel model,
        VerificationStatistics statistics,
        List<String> warnings) {

    public VerificationResult {
        verifiedInvariants = List.copyOf(verifiedInvariants);
        proofs = List.copyOf(proofs);
        warnings = List.copyOf(warnings);
    }

    public Optional<ConstraintModel> satisfiabilityModel() {
        return Optional.ofNullable(model);
    }
}
