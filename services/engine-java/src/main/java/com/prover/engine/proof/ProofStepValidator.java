package com.prover.engine.proof;

import com.prover.engine.VerificationException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks the form of a step list: dense numbering, backward-only dependencies and minimum premise counts
 * for the introduction rules it knows. Rules it does not know are accepted.
 */
public class ProofStepValidator {

    public static final Map<String, Integer> DEFAULT_MIN_PREMISES = Map.of(
            ProofRules.UNIVERSAL_INTRODUCTION, 1,
            ProofRules.IMPLICATION_INTRODUCTION, 2,
            ProofRules.CONJUNCTION_INTRODUCTION, 2,
            ProofRules.NEGATION_INTRODUCTION, 2,
            ProofRules.CONTRADICTION_DERIVATION, 2,
            ProofRules.DISJUNCTION_INTRODUCTION, 1,
            ProofRules.CONTRADICTION_ELIMINATION, 1);

    public static final Set<String> LEAF_RULES = Set.of(
            ProofRules.AXIOM_APPLICATION,
            ProofRules.ASSUMPTION,
            ProofRules.ARBITRARY_VARIABLE_INTRODUCTION,
            ProofRules.ASSUMPTION_APPLICATION,
            ProofRules.NEGATION_ASSUMPTION,
            ProofRules.PREMISE,
            ProofRules.SMT_VERIFICATION,
            ProofRules.AUTOMATED_PROOF);

    private final Map<String, Integer> minPremises;

    public ProofStepValidator() {
        this(DEFAULT_MIN_PREMISES);
    }

    public ProofStepValidator(Map<String, Integer> minPremises) {
        this.minPremises = Map.copyOf(minPremises);
    }

    /**
     * Returns a validator that additionally requires {@code premises} premises for {@code rule}.
     */
    public ProofStepValidator withRule(String rule, int premises) {
        Map<String, Integer> extended = new HashMap<>(minPremises);
        extended.put(rule, premises);
        return new ProofStepValidator(extended);
    }

    public void validate(List<ProofStep> steps) throws VerificationException {
        for (int i = 0; i < steps.size(); i++) {
            ProofStep step = steps.get(i);
            if (step.stepNumber() != i + 1) {
                throw new VerificationException("Step numbers must be dense: expected " + (i + 1) + ", found "
                        + step.stepNumber());
            }
            for (int dependency : step.dependencies()) {
                if (dependency < 1 || dependency >= step.stepNumber()) {
                    throw new VerificationException("Invalid dependency " + dependency + " in step "
                            + step.stepNumber());
                }
            }
            if (LEAF_RULES.contains(step.ruleName())) {
                continue;
            }
            Integer required = minPremises.get(step.ruleName());
            if (required != null && step.premises().size() < required) {
                throw new VerificationException(step.ruleName() + " in step " + step.stepNumber() + " requires "
                        + required + " premises, found " + step.premises().size());
            }
        }
    }
}
