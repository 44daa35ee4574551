package com.prover.engine.invariant;

import com.prover.engine.CollaboratorException;

import java.util.List;

/**
 * Finds the invariants a document asserts.
 */
public interface InvariantDiscovery {

    List<DiscoveredInvariant> discoverInvariants(SpecDocument document) throws CollaboratorException;
}
