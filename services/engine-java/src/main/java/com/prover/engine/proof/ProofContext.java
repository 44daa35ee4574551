package com.prover.engine.proof;

import com.prover.engine.VerificationException;
import com.prover.engine.logic.Atomic;
import com.prover.engine.logic.Formula;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Mutable state of one proof construction: the emitted steps, the live assumption stack, introduced
 * arbitrary variables, recursion depth and deadline. Owned by a single construction, never shared.
 */
final class ProofContext {

    record AtomicSource(String rule, List<String> premises, String justification) {
    }

    record Mark(int steps, int assumptions) {
    }

    private final List<Atomic> axioms;
    private final List<Formula> assumptions = new ArrayList<>();
    private final Set<String> arbitraryVariables = new HashSet<>();
    private final List<ProofStep> steps = new ArrayList<>();
    private final int maxDepth;
    private final Deadline deadline;
    private int depth;

    ProofContext(List<Atomic> axioms, int maxDepth, Deadline deadline) {
        this.axioms = axioms;
        this.maxDepth = maxDepth;
        this.deadline = deadline;
    }

    ProofStep emit(String rule, List<String> premises, String conclusion, String justification,
                   Set<Integer> dependencies) {
        ProofStep step = new ProofStep(steps.size() + 1, rule, premises, conclusion, justification, dependencies);
        steps.add(step);
        return step;
    }

    int lastStepNumber() {
        return steps.size();
    }

    /**
     * Numbers of every step emitted so far.
     */
    Set<Integer> priorSteps() {
        return IntStream.rangeClosed(1, steps.size()).boxed().collect(Collectors.toSet());
    }

    List<ProofStep> steps() {
        return List.copyOf(steps);
    }

    void enter() throws VerificationException {
        deadline.check();
        if (depth >= maxDepth) {
            throw new VerificationException("maximum verification depth of " + maxDepth + " exceeded");
        }
        depth++;
    }

    void exit() {
        depth--;
    }

    /**
     * @return 1-based position of the new assumption on the stack
     */
    int pushAssumption(Formula assumption) {
        assumptions.add(assumption);
        return assumptions.size();
    }

    void popAssumption() {
        assumptions.remove(assumptions.size() - 1);
    }

    String introduceArbitraryVariable(String variable) {
        String name = variable + "_arbitrary";
        int suffix = 1;
        while (!arbitraryVariables.add(name)) {
            name = variable + "_arbitrary" + (++suffix);
        }
        return name;
    }

    /**
     * Looks for a built-in axiom, then a live atomic assumption, with the goal's predicate and arity.
     */
    Optional<AtomicSource> findAtomicProof(Atomic goal) {
        for (Atomic axiom : axioms) {
            if (goal.matches(axiom)) {
                return Optional.of(new AtomicSource(ProofRules.AXIOM_APPLICATION, List.of(),
                        "Axiom: " + axiom.predicate()));
            }
        }
        for (int i = 0; i < assumptions.size(); i++) {
            if (assumptions.get(i) instanceof Atomic assumed && goal.matches(assumed)) {
                return Optional.of(new AtomicSource(ProofRules.ASSUMPTION_APPLICATION,
                        List.of("Assumption " + (i + 1)), "From assumption: " + assumed.render()));
            }
        }
        return Optional.empty();
    }

    Mark mark() {
        return new Mark(steps.size(), assumptions.size());
    }

    void rollback(Mark mark) {
        steps.subList(mark.steps(), steps.size()).clear();
        assumptions.subList(mark.assumptions(), assumptions.size()).clear();
    }
}
