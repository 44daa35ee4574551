package com.prover.engine.service;

import com.prover.engine.CollaboratorException;
import com.prover.engine.logic.PropertyFormula;
import com.prover.engine.proof.Deadline;
import com.prover.engine.proof.ProofRules;
import com.prover.engine.proof.ProofStep;
import com.prover.engine.solver.AutomatedProver;
import com.prover.engine.solver.ProofTree;

import java.util.List;

public class AutomatedProofStrategy implements ProofStrategy {

    private final AutomatedProver prover;

    public AutomatedProofStrategy(AutomatedProver prover) {
        this.prover = prover;
    }

    @Override
    public List<ProofStep> attempt(PropertyFormula formula, Deadline deadline) throws CollaboratorException {
        ProofTree tree = prover.proveFormula(formula);
        return List.of(ProofStep.leaf(1, ProofRules.AUTOMATED_PROOF, formula.render() + " proven automatically",
                "Automated theorem prover success (" + tree.method() + ")"));
    }
}
