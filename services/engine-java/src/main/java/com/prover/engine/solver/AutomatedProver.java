package com.prover.engine.solver;

import com.prover.engine.CollaboratorException;
import com.prover.engine.logic.PropertyFormula;

/**
 * An automated theorem prover. Failing to find a proof is reported as an exception.
 */
public interface AutomatedProver {

    ProofTree proveFormula(PropertyFormula formula) throws CollaboratorException;
}
