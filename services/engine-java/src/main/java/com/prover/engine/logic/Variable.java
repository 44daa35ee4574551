package com.prover.engine.logic;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A named variable with an optional type; {@code type} is null when untyped.
 */
public record Variable(String name, String type) implements Term {

    public Variable {
        Objects.requireNonNull(name, "name");
    }

    public static Variable of(String name) {
        return new Variable(name, null);
    }

    @Override
    public Term substitute(String variable, Term replacement) {
        return name.equals(variable) ? replacement : this;
    }

    @Override
    public Set<String> variables() {
        return new HashSet<>(Set.of(name));
    }

    @Override
    public String render() {
        return name;
    }

    @Override
    public String toString() {
        return render();
    }
}
