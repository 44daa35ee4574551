package com.prover.engine.solver;

/**
 * Certificate returned by an automated prover. The engine only observes that one was returned.
 */
public record ProofTree(String goal, String method, long casesChecked) {
}
