package com.prover.engine.service;

import com.prover.engine.invariant.DiscoveredInvariant;
import com.prover.engine.proof.FormalProof;
import com.prover.engine.proof.VerificationMethod;

import java.time.Duration;

/**
 * @param verificationConfidence the discovery confidence the invariant was accepted with
 * @param verificationTime       wall time spent on this invariant, cache lookups included
 */
public record VerifiedInvariant(DiscoveredInvariant invariant, FormalProof proof, double verificationConfidence,
                                VerificationMethod verificationMethod, Duration verificationTime) {
}
