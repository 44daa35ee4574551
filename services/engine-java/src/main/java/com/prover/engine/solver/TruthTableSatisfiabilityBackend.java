package com.prover.engine.solver;

import com.prover.engine.CollaboratorException;
import com.prover.engine.invariant.DiscoveredInvariant;
import com.prover.engine.logic.Formula;
import com.prover.engine.logic.PropertyFormula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalLong;

/**
 * In-process satisfiability backend that enumerates assignments of the propositional skeleton.
 *
 * <p>Used when no external SMT solver is wired in. Bounded by {@code maxAtoms}; larger problems are
 * reported as {@link SatisfiabilityResult.Unknown}.
 */
public class TruthTableSatisfiabilityBackend implements SatisfiabilityBackend {

    private static final Logger log = LoggerFactory.getLogger(TruthTableSatisfiabilityBackend.class);

    private final int maxAtoms;

    public TruthTableSatisfiabilityBackend(int maxAtoms) {
        if (maxAtoms < 1 || maxAtoms > 62) {
            throw new IllegalArgumentException("maxAtoms must be in [1,62], was " + maxAtoms);
        }
        this.maxAtoms = maxAtoms;
    }

    @Override
    public SatisfiabilityResult checkInvariants(List<DiscoveredInvariant> invariants) throws CollaboratorException {
        if (invariants.isEmpty()) {
            return new SatisfiabilityResult.Satisfiable(ConstraintModel.empty());
        }
        List<Formula> formulas = invariants.stream().map(inv -> inv.formula().structure()).toList();
        PropositionalAbstraction abstraction = PropositionalAbstraction.of(formulas);
        if (abstraction.atomCount() > maxAtoms) {
            return tooLarge(abstraction);
        }
        OptionalLong model = abstraction.findModel();
        if (model.isPresent()) {
            return satisfiable(abstraction, model.getAsLong());
        }
        List<String> conflicting = new ArrayList<>();
        boolean[] core = minimalCore(abstraction);
        for (int i = 0; i < core.length; i++) {
            if (core[i]) {
                DiscoveredInvariant inv = invariants.get(i);
                conflicting.add(inv.id() + ": " + inv.formula().render());
            }
        }
        log.debug("Invariant set is unsatisfiable, core of {} constraints", conflicting.size());
        return new SatisfiabilityResult.Unsatisfiable(new UnsatisfiabilityProof(conflicting,
                "no assignment satisfies the conjunction of the conflicting constraints"));
    }

    @Override
    public SatisfiabilityResult checkFormula(PropertyFormula formula) throws CollaboratorException {
        PropositionalAbstraction abstraction = PropositionalAbstraction.of(List.of(formula.structure()));
        if (abstraction.atomCount() > maxAtoms) {
            return tooLarge(abstraction);
        }
        OptionalLong model = abstraction.findModel();
        if (model.isPresent()) {
            return satisfiable(abstraction, model.getAsLong());
        }
        return new SatisfiabilityResult.Unsatisfiable(new UnsatisfiabilityProof(List.of(formula.render()),
                "the propositional skeleton has no model"));
    }

    private SatisfiabilityResult satisfiable(PropositionalAbstraction abstraction, long assignment) {
        if (abstraction.quantified()) {
            return new SatisfiabilityResult.Unknown("skeleton is satisfiable but quantified constraints are not decided");
        }
        return new SatisfiabilityResult.Satisfiable(abstraction.toModel(assignment));
    }

    private SatisfiabilityResult tooLarge(PropositionalAbstraction abstraction) {
        return new SatisfiabilityResult.Unknown(abstraction.atomCount() + " atoms exceed the limit of " + maxAtoms);
    }

    /**
     * Deletion-based minimal unsatisfiable subset: drop each constraint whose removal keeps the rest unsatisfiable.
     */
    private static boolean[] minimalCore(PropositionalAbstraction abstraction) {
        boolean[] core = new boolean[abstraction.formulaCount()];
        Arrays.fill(core, true);
        for (int i = 0; i < core.length; i++) {
            core[i] = false;
            if (abstraction.findModel(core).isPresent()) {
                core[i] = true;
            }
        }
        return core;
    }
}
