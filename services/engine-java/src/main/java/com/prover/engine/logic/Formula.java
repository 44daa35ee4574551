package com.prover.engine.logic;

import java.util.List;

/**
 * The closed set of formula shapes the proof constructors pattern-match on.
 *
 * <p>Substitution is not capture-avoiding. A quantifier that binds a variable of the same name as the one
 * being substituted is returned unchanged, and replacement terms are never renamed to dodge capture. Formulas
 * fed to the engine are assumed not to shadow bound variables; the constructors only ever substitute fresh
 * symbols, which cannot be captured.
 */
public sealed interface Formula
        permits Universal, Existential, Implication, Conjunction, Disjunction, Negation, Atomic {

    /**
     * Replaces every free occurrence of {@code variable} with {@code replacement}.
     */
    Formula substitute(String variable, Term replacement);

    /**
     * Direct sub-formulas, in order.
     */
    List<Formula> children();

    /**
     * Human readable logical notation.
     */
    String render();
}
