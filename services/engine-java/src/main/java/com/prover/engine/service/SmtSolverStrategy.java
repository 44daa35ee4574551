package com.prover.engine.service;

import com.prover.engine.CollaboratorException;
import com.prover.engine.VerificationException;
import com.prover.engine.logic.Negation;
import com.prover.engine.logic.PropertyFormula;
import com.prover.engine.proof.Deadline;
import com.prover.engine.proof.ProofRules;
import com.prover.engine.proof.ProofStep;
import com.prover.engine.solver.SatisfiabilityBackend;
import com.prover.engine.solver.SatisfiabilityResult;

import java.util.List;

/**
 * Valid iff the backend reports the negated formula unsatisfiable.
 */
public class SmtSolverStrategy implements ProofStrategy {

    private final SatisfiabilityBackend backend;

    public SmtSolverStrategy(SatisfiabilityBackend backend) {
        this.backend = backend;
    }

    @Override
    public List<ProofStep> attempt(PropertyFormula formula, Deadline deadline)
            throws VerificationException, CollaboratorException {
        PropertyFormula negated = PropertyFormula.of(new Negation(formula.structure()));
        SatisfiabilityResult result = backend.checkFormula(negated);
        if (result instanceof SatisfiabilityResult.Unsatisfiable) {
            return List.of(ProofStep.leaf(1, ProofRules.SMT_VERIFICATION,
                    formula.render() + " verified by SMT solver",
                    "Negation " + negated.render() + " is unsatisfiable"));
        }
        if (result instanceof SatisfiabilityResult.Unknown unknown) {
            throw new VerificationException("SMT verification inconclusive: " + unknown.reason());
        }
        throw new VerificationException("SMT verification failed: negation of " + formula.render()
                + " is satisfiable");
    }
}
