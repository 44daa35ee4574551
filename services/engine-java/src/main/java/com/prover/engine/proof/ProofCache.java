package com.prover.engine.proof;

import com.prover.engine.logic.FormulaFingerprint;

import java.util.Optional;

/**
 * Content-addressed proof store. Implementations must be safe for concurrent use; proofs stored under one
 * fingerprint are interchangeable, so the last write wins.
 */
public interface ProofCache {

    Optional<FormalProof> get(FormulaFingerprint key);

    void put(FormulaFingerprint key, FormalProof proof);

    int size();

    void clear();
}
