package com.prover.engine.logic;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

public record Constant(String value, String type) implements Term {

    public Constant {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(type, "type");
    }

    @Override
    public Term substitute(String variable, Term replacement) {
        return this;
    }

    @Override
    public Set<String> variables() {
        return new HashSet<>();
    }

    @Override
    public String render() {
        return value;
    }

    @Override
    public String toString() {
        return render();
    }
}
