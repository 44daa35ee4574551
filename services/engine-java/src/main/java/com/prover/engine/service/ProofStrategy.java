package com.prover.engine.service;

import com.prover.engine.EngineException;
import com.prover.engine.logic.PropertyFormula;
import com.prover.engine.proof.Deadline;
import com.prover.engine.proof.ProofStep;

import java.util.List;

/**
 * One way of producing a proof. Throwing means "this strategy does not apply, try the next".
 */
@FunctionalInterface
public interface ProofStrategy {

    List<ProofStep> attempt(PropertyFormula formula, Deadline deadline) throws EngineException;
}
