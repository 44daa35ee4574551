package com.prover.engine.proof;

/**
 * Outcome of checking a proof. {@code Valid} only means the step validator accepted it.
 */
public sealed interface ProofValidation
        permits ProofValidation.Valid, ProofValidation.Invalid, ProofValidation.Unknown {

    ProofValidation VALID = new Valid();
    ProofValidation UNKNOWN = new Unknown();

    record Valid() implements ProofValidation {
    }

    record Invalid(String reason) implements ProofValidation {
    }

    record Unknown() implements ProofValidation {
    }
}
