package com.prover.engine.invariant;

import java.util.List;

/**
 * A specification document as handed to the engine: identity plus the invariants it declares.
 */
public record SpecDocument(String docId, String title, List<InvariantDeclaration> declarations) {

    public SpecDocument {
        declarations = List.copyOf(declarations);
    }
}
