package com.prover.engine.invariant;

import com.prover.engine.logic.Formula;

/**
 * An invariant as written in a document, before discovery has vetted it.
 */
public record InvariantDeclaration(String id, String name, Formula formula, double confidence, InvariantType type) {
}
