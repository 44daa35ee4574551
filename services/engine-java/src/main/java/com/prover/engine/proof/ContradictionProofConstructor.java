package com.prover.engine.proof;

import com.prover.engine.VerificationException;
import com.prover.engine.logic.Disjunction;
import com.prover.engine.logic.Formula;
import com.prover.engine.logic.Negation;
import com.prover.engine.logic.PropertyFormula;

import java.util.List;
import java.util.Set;

/**
 * Reductio ad absurdum: assume the negated goal, derive the goal under that assumption, conclude falsum and
 * discharge.
 *
 * <p>The goal itself is derived by the direct constructor, except for disjunctions, which are derived from one
 * provable disjunct or, for a complementary pair {@code A ∨ ¬A}, by excluded middle.
 */
public class ContradictionProofConstructor {

    static final String FALSUM = "⊥";

    private final DirectProofConstructor direct;

    public ContradictionProofConstructor(DirectProofConstructor direct) {
        this.direct = direct;
    }

    public List<ProofStep> construct(PropertyFormula formula, Deadline deadline) throws VerificationException {
        ProofContext context = direct.newContext(deadline);
        Formula goal = formula.structure();
        Negation negated = new Negation(goal);

        context.pushAssumption(negated);
        int assumption = context.emit(ProofRules.NEGATION_ASSUMPTION, List.of(), negated.render(),
                "Assume the negation of the goal", Set.of()).stepNumber();
        int derived = derive(goal, context, assumption);
        context.emit(ProofRules.CONTRADICTION_DERIVATION, List.of(negated.render(), goal.render()), FALSUM,
                "The goal contradicts its assumed negation", Set.of(assumption, derived));
        context.popAssumption();
        context.emit(ProofRules.CONTRADICTION_ELIMINATION, List.of(FALSUM), goal.render(),
                "The negated goal leads to absurdity", context.priorSteps());

        direct.validator().validate(context.steps());
        return context.steps();
    }

    private int derive(Formula goal, ProofContext context, int negationStep) throws VerificationException {
        if (goal instanceof Disjunction disjunction) {
            context.enter();
            try {
                return deriveDisjunction(disjunction, context, negationStep);
            } finally {
                context.exit();
            }
        }
        direct.prove(goal, context);
        return context.lastStepNumber();
    }

    private int deriveDisjunction(Disjunction disjunction, ProofContext context, int negationStep)
            throws VerificationException {
        for (Formula disjunct : disjunction.parts()) {
            ProofContext.Mark mark = context.mark();
            try {
                direct.prove(disjunct, context);
            } catch (VerificationException e) {
                context.rollback(mark);
                continue;
            }
            return context.emit(ProofRules.DISJUNCTION_INTRODUCTION, List.of(disjunct.render()),
                    disjunction.render(), "Introduce the disjunction from a proven disjunct",
                    Set.of(context.lastStepNumber())).stepNumber();
        }
        for (Formula disjunct : disjunction.parts()) {
            if (disjunction.parts().contains(new Negation(disjunct))) {
                return excludedMiddle(disjunct, disjunction, context, negationStep);
            }
        }
        throw new VerificationException("No disjunct of " + disjunction.render() + " is derivable");
    }

    /**
     * Derives {@code ... A ∨ ... ¬A ...} under its own negation: assuming A yields the disjunction and hence
     * falsum, so ¬A holds, which again yields the disjunction.
     */
    private int excludedMiddle(Formula literal, Disjunction disjunction, ProofContext context, int negationStep) {
        String negatedGoal = new Negation(disjunction).render();
        context.pushAssumption(literal);
        int assumed = context.emit(ProofRules.ASSUMPTION, List.of(), literal.render(),
                "Assume one side of the complementary pair", Set.of()).stepNumber();
        int weakened = context.emit(ProofRules.DISJUNCTION_INTRODUCTION, List.of(literal.render()),
                disjunction.render(), "Introduce the disjunction from the assumed disjunct",
                Set.of(assumed)).stepNumber();
        int absurd = context.emit(ProofRules.CONTRADICTION_DERIVATION, List.of(negatedGoal, disjunction.render()),
                FALSUM, "The disjunction contradicts the assumed negation of the goal",
                Set.of(negationStep, weakened)).stepNumber();
        context.popAssumption();
        Negation complement = new Negation(literal);
        int refuted = context.emit(ProofRules.NEGATION_INTRODUCTION, List.of(literal.render(), FALSUM),
                complement.render(), "Discharge the assumption that led to absurdity",
                Set.of(assumed, absurd)).stepNumber();
        return context.emit(ProofRules.DISJUNCTION_INTRODUCTION, List.of(complement.render()), disjunction.render(),
                "Introduce the disjunction from the complementary disjunct", Set.of(refuted)).stepNumber();
    }
}
