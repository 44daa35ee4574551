package com.prover.engine.invariant;

import com.prover.engine.logic.PropertyFormula;

import java.util.Objects;

/**
 * An invariant produced by discovery. Read-only for the engine.
 *
 * @param confidence discovery confidence in [0, 1]
 */
public record DiscoveredInvariant(
        String id,
        String name,
        PropertyFormula formula,
        double confidence,
        InvariantType invariantType) {

    public DiscoveredInvariant {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(formula, "formula");
        Objects.requireNonNull(invariantType, "invariantType");
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be in [0,1], was " + confidence);
        }
        if (name == null) name = id;
    }
}
