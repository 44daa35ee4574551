package com.prover.engine.solver;

import com.prover.engine.CollaboratorException;
import com.prover.engine.logic.Negation;
import com.prover.engine.logic.PropertyFormula;

import java.util.List;
import java.util.OptionalLong;

/**
 * Proves formulas whose propositional skeleton is a tautology.
 */
public class TautologyProver implements AutomatedProver {

    private static final String NAME = "prover";

    private final int maxAtoms;

    public TautologyProver(int maxAtoms) {
        this.maxAtoms = maxAtoms;
    }

    @Override
    public ProofTree proveFormula(PropertyFormula formula) throws CollaboratorException {
        PropositionalAbstraction negated = PropositionalAbstraction.of(List.of(new Negation(formula.structure())));
        if (negated.atomCount() > maxAtoms) {
            throw new CollaboratorException(NAME, negated.atomCount() + " atoms exceed the limit of " + maxAtoms);
        }
        OptionalLong counterexample = negated.findModel();
        if (counterexample.isPresent()) {
            throw new CollaboratorException(NAME, "no proof of " + formula.render() + ", counter-assignment "
                    + negated.toModel(counterexample.getAsLong()));
        }
        return new ProofTree(formula.render(), "truth-table", 1L << negated.atomCount());
    }
}
