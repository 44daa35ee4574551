package com.prover.engine.logic;

import java.util.List;
import java.util.stream.Collectors;

public record Disjunction(List<Formula> parts) implements Formula {

    public Disjunction {
        parts = List.copyOf(parts);
    }

    public static Disjunction of(Formula... parts) {
        return new Disjunction(List.of(parts));
    }

    @Override
    public Formula substitute(String variable, Term replacement) {
        return new Disjunction(parts.stream().map(f -> f.substitute(variable, replacement)).toList());
    }

    @Override
    public List<Formula> children() {
        return parts;
    }

    @Override
    public String render() {
        return "(" + parts.stream().map(Formula::render).collect(Collectors.joining(" ∨ ")) + ")";
    }

    @Override
    public String toString() {
        return render();
    }
}
