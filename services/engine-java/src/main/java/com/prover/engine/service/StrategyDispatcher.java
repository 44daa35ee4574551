package com.prover.engine.service;

import com.prover.engine.EngineException;
import com.prover.engine.VerificationException;
import com.prover.engine.logic.PropertyFormula;
import com.prover.engine.proof.ComplexityCalculator;
import com.prover.engine.proof.ContradictionProofConstructor;
import com.prover.engine.proof.Deadline;
import com.prover.engine.proof.DirectProofConstructor;
import com.prover.engine.proof.ProofComplexity;
import com.prover.engine.proof.ProofStep;
import com.prover.engine.proof.VerificationMethod;
import com.prover.engine.solver.AutomatedProver;
import com.prover.engine.solver.SatisfiabilityBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps strategy tags to strategies and tries them in order, first success wins.
 *
 * <p>A hybrid method is the same ordered trial over its members, so nesting needs no special handling.
 */
public class StrategyDispatcher {

    private static final Logger log = LoggerFactory.getLogger(StrategyDispatcher.class);

    /**
     * A successful attempt: the top-level method that succeeded and its steps.
     */
    public record Attempt(VerificationMethod method, List<ProofStep> steps) {
    }

    private final Map<VerificationMethod.Kind, ProofStrategy> strategies;
    private final int maxProofComplexity;

    public StrategyDispatcher(Map<VerificationMethod.Kind, ProofStrategy> strategies, int maxProofComplexity) {
        this.strategies = Map.copyOf(strategies);
        this.maxProofComplexity = maxProofComplexity;
    }

    public static StrategyDispatcher standard(DirectProofConstructor direct,
                                              ContradictionProofConstructor contradiction,
                                              SatisfiabilityBackend backend,
                                              AutomatedProver prover,
                                              int maxProofComplexity) {
        Map<VerificationMethod.Kind, ProofStrategy> strategies = new EnumMap<>(VerificationMethod.Kind.class);
        strategies.put(VerificationMethod.Kind.DIRECT_PROOF, direct::construct);
        strategies.put(VerificationMethod.Kind.PROOF_BY_CONTRADICTION, contradiction::construct);
        strategies.put(VerificationMethod.Kind.SMT_SOLVER_VERIFICATION, new SmtSolverStrategy(backend));
        strategies.put(VerificationMethod.Kind.AUTOMATED_PROOF, new AutomatedProofStrategy(prover));
        return new StrategyDispatcher(strategies, maxProofComplexity);
    }

    public List<ProofStep> tryVerificationMethod(PropertyFormula formula, VerificationMethod method,
                                                 Deadline deadline) throws VerificationException {
        if (method.isHybrid()) {
            return tryInOrder(formula, method.members(), deadline).steps();
        }
        ProofStrategy strategy = strategies.get(method.kind());
        if (strategy == null) {
            throw new VerificationException("No strategy registered for " + method);
        }
        deadline.check();
        List<ProofStep> steps;
        try {
            steps = strategy.attempt(formula, deadline);
        } catch (VerificationException e) {
            throw e;
        } catch (EngineException e) {
            throw new VerificationException(e.getMessage(), e);
        } catch (RuntimeException e) {
            log.warn("{} raised an unexpected error for {}", method, formula, e);
            throw new VerificationException("Unexpected error: " + e, e);
        }
        ProofComplexity complexity = ComplexityCalculator.calculate(steps);
        if (!complexity.isWithinLimits(maxProofComplexity)) {
            throw new VerificationException("Proof size estimate " + complexity.sizeEstimate()
                    + " exceeds the limit of " + maxProofComplexity);
        }
        return steps;
    }

    public Attempt tryInOrder(PropertyFormula formula, List<VerificationMethod> methods, Deadline deadline)
            throws VerificationException {
        List<String> reasons = new ArrayList<>();
        for (VerificationMethod method : methods) {
            try {
                List<ProofStep> steps = tryVerificationMethod(formula, method, deadline);
                log.debug("{} proved {} in {} steps", method, formula, steps.size());
                return new Attempt(method, steps);
            } catch (VerificationException e) {
                log.debug("{} failed for {}: {}", method, formula, e.getMessage());
                reasons.add(method + ": " + e.getMessage());
            }
        }
        throw new VerificationException("All verification methods failed [" + String.join("; ", reasons) + "]");
    }
}
