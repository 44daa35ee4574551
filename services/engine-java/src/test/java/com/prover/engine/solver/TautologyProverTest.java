package com.prover.engine.solver;

import com.prover.engine.CollaboratorException;
import com.prover.engine.logic.Atomic;
import com.prover.engine.logic.Disjunction;
import com.prover.engine.logic.Implication;
import com.prover.engine.logic.Negation;
import com.prover.engine.logic.PropertyFormula;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TautologyProverTest {

    private final TautologyProver prover = new TautologyProver(20);

    @Test
    void provesTautologies() throws Exception {
        Atomic p = Atomic.of("P");
        Atomic q = Atomic.of("Q");
        PropertyFormula formula = PropertyFormula.of(Disjunction.of(new Implication(p, q), p));

        ProofTree tree = prover.proveFormula(formula);

        assertThat(tree.goal()).isEqualTo(formula.render());
        assertThat(tree.method()).isEqualTo("truth-table");
        assertThat(tree.casesChecked()).isEqualTo(4);
    }

    @Test
    void contingentFormulaIsRejectedWithCounterAssignment() {
        PropertyFormula formula = PropertyFormula.of(new Negation(Atomic.of("P")));

        assertThatThrownBy(() -> prover.proveFormula(formula))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("prover: no proof of ¬P")
                .satisfies(e -> assertThat(((CollaboratorException) e).collaborator()).isEqualTo("prover"));
    }
}
