package com.prover.engine.logic;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Content key of a formula: SHA-256 over a canonical, length-prefixed encoding of the tree.
 *
 * <p>Two formulas get the same fingerprint iff they are structurally identical, including term types and
 * type signatures. The encoding does not depend on {@code toString} or record field order.
 */
public record FormulaFingerprint(String hex) {

    public static FormulaFingerprint of(PropertyFormula formula) {
        return of(formula.structure());
    }

    public static FormulaFingerprint of(Formula formula) {
        StringBuilder out = new StringBuilder();
        encode(formula, out);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(out.toString().getBytes(StandardCharsets.UTF_8));
            return new FormulaFingerprint(HexFormat.of().formatHex(hash));
        } catch (NoSuchAlgorithmException e) {
            // every JVM ships SHA-256
            throw new IllegalStateException(e);
        }
    }

    public static String canonical(Formula formula) {
        StringBuilder out = new StringBuilder();
        encode(formula, out);
        return out.toString();
    }

    private static void encode(Formula formula, StringBuilder out) {
        if (formula instanceof Universal universal) {
            out.append('A');
            encode(universal.quantifier(), out);
            encode(universal.body(), out);
        } else if (formula instanceof Existential existential) {
            out.append('E');
            encode(existential.quantifier(), out);
            encode(existential.body(), out);
        } else if (formula instanceof Implication implication) {
            out.append('I');
            encode(implication.antecedent(), out);
            encode(implication.consequent(), out);
        } else if (formula instanceof Conjunction conjunction) {
            out.append('C');
            encodeAll(conjunction.parts(), out);
        } else if (formula instanceof Disjunction disjunction) {
            out.append('D');
            encodeAll(disjunction.parts(), out);
        } else if (formula instanceof Negation negation) {
            out.append('N');
            encode(negation.formula(), out);
        } else if (formula instanceof Atomic atomic) {
            out.append('P');
            string(atomic.predicate(), out);
            out.append(atomic.terms().size()).append('[');
            for (Term term : atomic.terms()) encode(term, out);
            out.append(']');
            TypeSignature signature = atomic.typeSignature();
            if (signature == null) {
                out.append('-');
            } else {
                out.append('S').append(signature.inputs().size());
                for (String input : signature.inputs()) string(input, out);
                string(signature.output(), out);
            }
        }
    }

    private static void encodeAll(List<Formula> formulas, StringBuilder out) {
        out.append(formulas.size()).append('[');
        for (Formula formula : formulas) encode(formula, out);
        out.append(']');
    }

    private static void encode(Quantifier quantifier, StringBuilder out) {
        string(quantifier.variable(), out);
        nullable(quantifier.type(), out);
    }

    private static void encode(Term term, StringBuilder out) {
        if (term instanceof Variable variable) {
            out.append('v');
            string(variable.name(), out);
            nullable(variable.type(), out);
        } else if (term instanceof Constant constant) {
            out.append('c');
            string(constant.value(), out);
            string(constant.type(), out);
        } else if (term instanceof Function function) {
            out.append('f');
            string(function.name(), out);
            out.append(function.args().size()).append('[');
            for (Term arg : function.args()) encode(arg, out);
            out.append(']');
        }
    }

    private static void nullable(String value, StringBuilder out) {
        if (value == null) {
            out.append('-');
        } else {
            string(value, out);
        }
    }

    private static void string(String value, StringBuilder out) {
        out.append(value.length()).append('#').append(value);
    }

    @Override
    public String toString() {
        return hex;
    }
}
