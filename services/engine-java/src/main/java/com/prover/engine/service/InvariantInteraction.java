package com.prover.engine.service;

/**
 * Relation between two invariants of one set.
 *
 * @param strength 1.0 for conflicts and implications, predicate overlap for supportive pairs, 0 otherwise
 */
public record InvariantInteraction(String firstId, String secondId, InteractionType type, double strength) {
}
