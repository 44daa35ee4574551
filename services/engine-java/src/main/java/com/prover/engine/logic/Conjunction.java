package com.prover.engine.logic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An n-ary conjunction. The model accepts any arity; the direct proof constructor requires at least two parts.
 */
public record Conjunction(List<Formula> parts) implements Formula {

    public Conjunction {
        parts = List.copyOf(parts);
    }

    public static Conjunction of(Formula... parts) {
        return new Conjunction(List.of(parts));
    }

    @Override
    public Formula substitute(String variable, Term replacement) {
        return new Conjunction(parts.stream().map(f -> f.substitute(variable, replacement)).toList());
    }

    @Override
    public List<Formula> children() {
        return parts;
    }

    @Override
    public String render() {
        return "(" + parts.stream().map(Formula::render).collect(Collectors.joining(" ∧ ")) + ")";
    }

    @Override
    public String toString() {
        return render();
    }
}
