package com.prover.engine.logic;

import java.util.Objects;

/**
 * A bound variable with its optional type.
 */
public record Quantifier(String variable, String type) {

    public Quantifier {
        Objects.requireNonNull(variable, "variable");
    }

    public static Quantifier of(String variable) {
        return new Quantifier(variable, null);
    }

    String render() {
        return type == null ? variable : variable + ":" + type;
    }
}
