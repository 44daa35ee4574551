package com.prover.engine.logic;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A predicate applied to an ordered list of terms. {@code typeSignature} is null when absent.
 */
public record Atomic(String predicate, List<Term> terms, TypeSignature typeSignature) implements Formula {

    public Atomic {
        Objects.requireNonNull(predicate, "predicate");
        terms = List.copyOf(terms);
    }

    public static Atomic of(String predicate, Term... terms) {
        return new Atomic(predicate, List.of(terms), null);
    }

    public int arity() {
        return terms.size();
    }

    /**
     * Same predicate name and argument count. Term values are not unified.
     */
    public boolean matches(Atomic other) {
        return predicate.equals(other.predicate) && terms.size() == other.terms.size();
    }

    @Override
    public Formula substitute(String variable, Term replacement) {
        return new Atomic(predicate, terms.stream().map(t -> t.substitute(variable, replacement)).toList(),
                typeSignature);
    }

    @Override
    public List<Formula> children() {
        return List.of();
    }

    @Override
    public String render() {
        if (terms.isEmpty()) return predicate;
        return predicate + "(" + terms.stream().map(Term::render).collect(Collectors.joining(", ")) + ")";
    }

    @Override
    public String toString() {
        return render();
    }
}
