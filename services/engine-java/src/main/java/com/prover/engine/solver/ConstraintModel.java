package com.prover.engine.solver;

import java.util.Map;
import java.util.TreeMap;

/**
 * A satisfying assignment: truth value per atom, keyed by the atom's rendered form.
 */
public record ConstraintModel(Map<String, Boolean> predicateInterpretations) {

    public ConstraintModel {
        predicateInterpretations = Map.copyOf(predicateInterpretations);
    }

    public static ConstraintModel empty() {
        return new ConstraintModel(Map.of());
    }

    public boolean isEmpty() {
        return predicateInterpretations.isEmpty();
    }

    @Override
    public String toString() {
        return new TreeMap<>(predicateInterpretations).toString();
    }
}
