package com.prover.engine.invariant;

public enum InvariantType {
    TYPE_STRUCTURAL,
    TYPE_MEMBERSHIP,
    FUNCTIONAL_PROPERTY,
    FUNCTIONAL_MONOTONICITY,
    RELATIONAL_INVARIANT,
    NUMERICAL_INVARIANT,
    LOGICAL_INVARIANT,
    TEMPORAL_INVARIANT,
    STRUCTURAL_INVARIANT
}
