package com.prover.engine.service;

import com.prover.engine.VerificationException;
import com.prover.engine.config.VerificationSettings;
import com.prover.engine.logic.FormulaFingerprint;
import com.prover.engine.logic.PropertyFormula;
import com.prover.engine.proof.ComplexityCalculator;
import com.prover.engine.proof.Deadline;
import com.prover.engine.proof.FormalProof;
import com.prover.engine.proof.ProofCache;
import com.prover.engine.proof.ProofStep;
import com.prover.engine.proof.ProofValidation;
import com.prover.engine.proof.VerificationMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Proves single formulas with the configured strategies and memoizes the results by fingerprint.
 */
public class PropertyVerifier {

    private static final Logger log = LoggerFactory.getLogger(PropertyVerifier.class);

    private final StrategyDispatcher dispatcher;
    private final ProofCache cache;
    private final VerificationSettings settings;

    public PropertyVerifier(StrategyDispatcher dispatcher, ProofCache cache, VerificationSettings settings) {
        this.dispatcher = dispatcher;
        this.cache = cache;
        this.settings = settings;
    }

    /**
     * Returns a proof of {@code property}, from the cache when an identical formula was proved before.
     *
     * @throws VerificationException when every enabled method fails
     */
    public FormalProof verifyProperty(PropertyFormula property) throws VerificationException {
        FormulaFingerprint key = FormulaFingerprint.of(property);
        if (settings.enableProofCache()) {
            Optional<FormalProof> cached = cache.get(key);
            if (cached.isPresent()) {
                log.debug("Proof cache hit for {}", property);
                return cached.get();
            }
        }

        long start = System.nanoTime();
        Deadline deadline = Deadline.after(settings.proofTimeout());
        StrategyDispatcher.Attempt attempt = dispatcher.tryInOrder(property, settings.enabledMethods(), deadline);
        FormalProof proof = finalizeProof(property, attempt.steps(), Duration.ofNanos(System.nanoTime() - start),
                attempt.method());

        if (settings.enableProofCache()) {
            cache.put(key, proof);
        }
        return proof;
    }

    /**
     * Wraps accepted steps into a stored proof record. {@code VALID} here means the validator did not reject
     * the steps.
     */
    public FormalProof finalizeProof(PropertyFormula statement, List<ProofStep> steps, Duration generationTime,
                                     VerificationMethod method) {
        return new FormalProof("proof_" + UUID.randomUUID(), statement, steps, ProofValidation.VALID,
                generationTime, ComplexityCalculator.calculate(steps), method);
    }

    public ProofCache cache() {
        return cache;
    }
}
