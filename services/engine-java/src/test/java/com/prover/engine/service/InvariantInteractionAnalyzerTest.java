package com.prover.engine.service;

import com.prover.engine.invariant.DiscoveredInvariant;
import com.prover.engine.invariant.InvariantType;
import com.prover.engine.logic.Atomic;
import com.prover.engine.logic.Conjunction;
import com.prover.engine.logic.Formula;
import com.prover.engine.logic.Implication;
import com.prover.engine.logic.Negation;
import com.prover.engine.logic.PropertyFormula;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class InvariantInteractionAnalyzerTest {

    private final InvariantInteractionAnalyzer analyzer = new InvariantInteractionAnalyzer();

    private static DiscoveredInvariant invariant(String id, Formula formula) {
        return new DiscoveredInvariant(id, id, PropertyFormula.of(formula), 1.0, InvariantType.RELATIONAL_INVARIANT);
    }

    @Test
    void classifiesEveryUnorderedPair() {
        Atomic p = Atomic.of("P");
        List<DiscoveredInvariant> invariants = List.of(
                invariant("p", p),
                invariant("not-p", new Negation(p)),
                invariant("q-implies-p", new Implication(Atomic.of("Q"), p)),
                invariant("s", Atomic.of("S")));

        List<InvariantInteraction> interactions = analyzer.analyze(invariants);

        assertThat(interactions).hasSize(6);
        assertThat(interactions).contains(
                new InvariantInteraction("p", "not-p", InteractionType.CONFLICTING, 1.0),
                new InvariantInteraction("p", "q-implies-p", InteractionType.IMPLICATION, 1.0),
                new InvariantInteraction("p", "s", InteractionType.INDEPENDENT, 0.0));
    }

    @Test
    void sharedPredicatesAreSupportiveWithJaccardStrength() {
        InvariantInteraction interaction = analyzer.classify(
                invariant("a", Conjunction.of(Atomic.of("P"), Atomic.of("Q"))),
                invariant("b", Conjunction.of(Atomic.of("P"), Atomic.of("R"))));

        assertThat(interaction.type()).isEqualTo(InteractionType.SUPPORTIVE);
        assertThat(interaction.strength()).isCloseTo(1.0 / 3.0, within(1e-9));
    }

    @Test
    void fewerThanTwoInvariantsHaveNoInteractions() {
        assertThat(analyzer.analyze(List.of(invariant("only", Atomic.of("P"))))).isEmpty();
    }
}
