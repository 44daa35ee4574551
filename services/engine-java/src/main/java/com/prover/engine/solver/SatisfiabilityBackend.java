package com.prover.engine.solver;

import com.prover.engine.CollaboratorException;
import com.prover.engine.invariant.DiscoveredInvariant;
import com.prover.engine.logic.PropertyFormula;

import java.util.List;

/**
 * Satisfiability checking, normally backed by an SMT solver.
 */
public interface SatisfiabilityBackend {

    /**
     * Checks the conjunction of all invariant formulas.
     */
    SatisfiabilityResult checkInvariants(List<DiscoveredInvariant> invariants) throws CollaboratorException;

    SatisfiabilityResult checkFormula(PropertyFormula formula) throws CollaboratorException;
}
