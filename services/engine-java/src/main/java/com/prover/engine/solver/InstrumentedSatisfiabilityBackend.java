package com.prover.engine.solver;

import com.prover.engine.CollaboratorException;
import com.prover.engine.invariant.DiscoveredInvariant;
import com.prover.engine.logic.PropertyFormula;

import java.util.List;

/**
 * Records call counts and solver time of a delegate backend.
 */
public class InstrumentedSatisfiabilityBackend implements SatisfiabilityBackend {

    private final SatisfiabilityBackend delegate;
    private final SolverStatistics statistics;

    public InstrumentedSatisfiabilityBackend(SatisfiabilityBackend delegate, SolverStatistics statistics) {
        this.delegate = delegate;
        this.statistics = statistics;
    }

    @Override
    public SatisfiabilityResult checkInvariants(List<DiscoveredInvariant> invariants) throws CollaboratorException {
        long start = System.nanoTime();
        try {
            SatisfiabilityResult result = delegate.checkInvariants(invariants);
            statistics.record(System.nanoTime() - start, result);
            return result;
        } catch (CollaboratorException e) {
            statistics.recordError(System.nanoTime() - start);
            throw e;
        }
    }

    @Override
    public SatisfiabilityResult checkFormula(PropertyFormula formula) throws CollaboratorException {
        long start = System.nanoTime();
        try {
            SatisfiabilityResult result = delegate.checkFormula(formula);
            statistics.record(System.nanoTime() - start, result);
            return result;
        } catch (CollaboratorException e) {
            statistics.recordError(System.nanoTime() - start);
            throw e;
        }
    }

    public SolverStatistics statistics() {
        return statistics;
    }
}
