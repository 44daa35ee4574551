package com.prover.engine.proof;

import java.util.List;

public final class ComplexityCalculator {

    static final int SIZE_PER_STEP = 50;
    static final int STEPS_PER_RATING_POINT = 10;
    static final int MAX_RATING = 10;

    private ComplexityCalculator() {
    }

    public static ProofComplexity calculate(List<ProofStep> steps) {
        int fanIn = steps.stream().mapToInt(s -> s.dependencies().size()).max().orElse(0);
        int axioms = (int) steps.stream().filter(s -> s.ruleName().contains("AXIOM")).count();
        int lemmas = (int) steps.stream().filter(s -> s.ruleName().contains("LEMMA")).count();
        int rating = Math.min(steps.size() / STEPS_PER_RATING_POINT, MAX_RATING);
        return new ProofComplexity(steps.size(), fanIn, axioms, lemmas, steps.size() * SIZE_PER_STEP, rating);
    }
}
