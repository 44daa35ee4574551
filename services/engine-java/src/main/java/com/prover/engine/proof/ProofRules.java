package com.prover.engine.proof;

/**
 * Rule names emitted by the built-in strategies. Rule names are open strings; other producers may use their own.
 */
public final class ProofRules {

    public static final String ARBITRARY_VARIABLE_INTRODUCTION = "ARBITRARY_VARIABLE_INTRODUCTION";
    public static final String UNIVERSAL_INTRODUCTION = "UNIVERSAL_INTRODUCTION";
    public static final String ASSUMPTION = "ASSUMPTION";
    public static final String IMPLICATION_INTRODUCTION = "IMPLICATION_INTRODUCTION";
    public static final String CONJUNCTION_INTRODUCTION = "CONJUNCTION_INTRODUCTION";
    public static final String AXIOM_APPLICATION = "AXIOM_APPLICATION";
    public static final String ASSUMPTION_APPLICATION = "ASSUMPTION_APPLICATION";

    public static final String NEGATION_ASSUMPTION = "NEGATION_ASSUMPTION";
    public static final String NEGATION_INTRODUCTION = "NEGATION_INTRODUCTION";
    public static final String DISJUNCTION_INTRODUCTION = "DISJUNCTION_INTRODUCTION";
    public static final String CONTRADICTION_DERIVATION = "CONTRADICTION_DERIVATION";
    public static final String CONTRADICTION_ELIMINATION = "CONTRADICTION_ELIMINATION";

    public static final String SMT_VERIFICATION = "SMT_VERIFICATION";
    public static final String AUTOMATED_PROOF = "AUTOMATED_PROOF";

    public static final String PREMISE = "PREMISE";
    public static final String INCONSISTENCY_DETECTION = "INCONSISTENCY_DETECTION";

    private ProofRules() {
    }
}
