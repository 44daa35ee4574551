package com.prover.engine.proof;

import com.prover.engine.VerificationException;
import com.prover.engine.logic.Atomic;
import com.prover.engine.logic.Conjunction;
import com.prover.engine.logic.Formula;
import com.prover.engine.logic.Implication;
import com.prover.engine.logic.PropertyFormula;
import com.prover.engine.logic.Quantifier;
import com.prover.engine.logic.Universal;
import com.prover.engine.logic.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Natural-deduction proof construction by structural recursion over the goal.
 *
 * <p>Supports universal quantification, implication, conjunction and atomic goals. Atomic goals are closed by a
 * built-in axiom or a live assumption with the same predicate and arity. Existential, disjunctive and
 * negated goals are rejected so that the next configured strategy gets its turn.
 */
public class DirectProofConstructor {

    public static final List<Atomic> BUILTIN_AXIOMS = List.of(
            new Atomic("TypeSafe", List.of(new Variable("x", "Any")), null),
            new Atomic("WellFormed", List.of(new Variable("d", "Document")), null));

    private final List<Atomic> axioms;
    private final ProofStepValidator validator;
    private final int maxDepth;

    public DirectProofConstructor(ProofStepValidator validator, int maxDepth) {
        this(BUILTIN_AXIOMS, validator, maxDepth);
    }

    public DirectProofConstructor(List<Atomic> axioms, ProofStepValidator validator, int maxDepth) {
        this.axioms = List.copyOf(axioms);
        this.validator = validator;
        this.maxDepth = maxDepth;
    }

    public List<ProofStep> construct(PropertyFormula formula, Deadline deadline) throws VerificationException {
        ProofContext context = newContext(deadline);
        prove(formula.structure(), context);
        validator.validate(context.steps());
        return context.steps();
    }

    ProofContext newContext(Deadline deadline) {
        return new ProofContext(axioms, maxDepth, deadline);
    }

    ProofStepValidator validator() {
        return validator;
    }

    void prove(Formula goal, ProofContext context) throws VerificationException {
        context.enter();
        try {
            if (goal instanceof Universal universal) {
                proveUniversal(universal, context);
            } else if (goal instanceof Implication implication) {
                proveImplication(implication, context);
            } else if (goal instanceof Conjunction conjunction) {
                proveConjunction(conjunction, context);
            } else if (goal instanceof Atomic atomic) {
                proveAtomic(atomic, context);
            } else {
                throw new VerificationException("Direct proof not supported for "
                        + goal.getClass().getSimpleName().toLowerCase() + ": " + goal.render());
            }
        } finally {
            context.exit();
        }
    }

    private void proveUniversal(Universal universal, ProofContext context) throws VerificationException {
        Quantifier quantifier = universal.quantifier();
        String fresh = context.introduceArbitraryVariable(quantifier.variable());
        context.emit(ProofRules.ARBITRARY_VARIABLE_INTRODUCTION, List.of(), "Let " + fresh + " be arbitrary",
                "Introduce arbitrary variable " + fresh + " for " + quantifier.variable(), Set.of());

        Formula instantiated = universal.body().substitute(quantifier.variable(),
                new Variable(fresh, quantifier.type()));
        prove(instantiated, context);

        context.emit(ProofRules.UNIVERSAL_INTRODUCTION, List.of("For arbitrary " + fresh), universal.render(),
                fresh + " is arbitrary and the body holds for it", context.priorSteps());
    }

    private void proveImplication(Implication implication, ProofContext context) throws VerificationException {
        int assumption = context.pushAssumption(implication.antecedent());
        context.emit(ProofRules.ASSUMPTION, List.of(), implication.antecedent().render(),
                "Assume antecedent for implication proof", Set.of());
        try {
            prove(implication.consequent(), context);
        } finally {
            context.popAssumption();
        }
        context.emit(ProofRules.IMPLICATION_INTRODUCTION,
                List.of(implication.antecedent().render(), implication.consequent().render()), implication.render(),
                "Discharge assumption " + assumption + " to complete the implication", context.priorSteps());
    }

    private void proveConjunction(Conjunction conjunction, ProofContext context) throws VerificationException {
        List<Formula> parts = conjunction.parts();
        if (parts.size() < 2) {
            throw new VerificationException("Conjunction must have at least 2 conjuncts, found " + parts.size());
        }
        List<String> premises = new ArrayList<>();
        for (int i = 0; i < parts.size(); i++) {
            prove(parts.get(i), context);
            premises.add("Conjunct " + (i + 1) + ": " + parts.get(i).render());
        }
        context.emit(ProofRules.CONJUNCTION_INTRODUCTION, premises, conjunction.render(),
                "All conjuncts proven independently", context.priorSteps());
    }

    private void proveAtomic(Atomic atomic, ProofContext context) throws VerificationException {
        ProofContext.AtomicSource source = context.findAtomicProof(atomic)
                .orElseThrow(() -> new VerificationException("Cannot prove atomic formula: " + atomic.render()));
        context.emit(source.rule(), source.premises(), atomic.render(), source.justification(), Set.of());
    }
}
