package com.prover.engine.proof;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * One step of a proof. Every dependency refers to an earlier step, so the step list is already in
 * topological order.
 *
 * @param stepNumber   1-based, dense position in the proof
 * @param ruleName     open rule identifier, see {@link ProofRules}
 * @param dependencies numbers of the steps this one builds on, ascending
 */
public record ProofStep(
        int stepNumber,
        String ruleName,
        List<String> premises,
        String conclusion,
        String justification,
        Set<Integer> dependencies) {

    public ProofStep {
        Objects.requireNonNull(ruleName, "ruleName");
        premises = List.copyOf(premises);
        dependencies = Collections.unmodifiableSortedSet(new TreeSet<>(dependencies));
    }

    public static ProofStep leaf(int stepNumber, String ruleName, String conclusion, String justification) {
        return new ProofStep(stepNumber, ruleName, List.of(), conclusion, justification, Set.of());
    }
}
