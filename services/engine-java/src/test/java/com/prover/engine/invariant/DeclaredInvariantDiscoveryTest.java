package com.prover.engine.invariant;

import com.prover.engine.CollaboratorException;
import com.prover.engine.logic.Atomic;
import com.prover.engine.logic.PropertyFormula;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeclaredInvariantDiscoveryTest {

    private static InvariantDeclaration declare(String id, double confidence) {
        return new InvariantDeclaration(id, null, Atomic.of("P"), confidence, null);
    }

    @Test
    void turnsDeclarationsIntoInvariants() throws Exception {
        SpecDocument document = new SpecDocument("doc", "Doc", List.of(
                new InvariantDeclaration("inv-1", "safety", Atomic.of("Safe"), 0.9, InvariantType.TYPE_STRUCTURAL),
                declare("inv-2", 0.5)));

        List<DiscoveredInvariant> invariants = new DeclaredInvariantDiscovery(0.0).discoverInvariants(document);

        assertThat(invariants).extracting(DiscoveredInvariant::id).containsExactly("inv-1", "inv-2");
        assertThat(invariants.get(0).invariantType()).isEqualTo(InvariantType.TYPE_STRUCTURAL);
        assertThat(invariants.get(0).formula().usesPredicate("Safe")).isTrue();
        assertThat(invariants.get(1).name()).isEqualTo("inv-2");
        assertThat(invariants.get(1).invariantType()).isEqualTo(InvariantType.LOGICAL_INVARIANT);
    }

    @Test
    void dropsDeclarationsBelowMinimumConfidence() throws Exception {
        SpecDocument document = new SpecDocument("doc", "Doc", List.of(declare("low", 0.2), declare("high", 0.7)));

        assertThat(new DeclaredInvariantDiscovery(0.5).discoverInvariants(document))
                .extracting(DiscoveredInvariant::id).containsExactly("high");
    }

    @Test
    void rejectsMalformedDocuments() {
        DeclaredInvariantDiscovery discovery = new DeclaredInvariantDiscovery(0.0);

        assertThatThrownBy(() -> discovery.discoverInvariants(new SpecDocument("doc", "Doc",
                List.of(declare("a", 0.5), declare("a", 0.6)))))
                .isInstanceOf(CollaboratorException.class)
                .hasMessage("discovery: duplicate invariant id a");
        assertThatThrownBy(() -> discovery.discoverInvariants(new SpecDocument("doc", "Doc",
                List.of(declare("a", 1.5)))))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("outside [0,1]");
        assertThatThrownBy(() -> discovery.discoverInvariants(new SpecDocument("doc", "Doc",
                List.of(new InvariantDeclaration("a", null, null, 0.5, null)))))
                .isInstanceOf(CollaboratorException.class)
                .hasMessage("discovery: invariant a has no formula");
    }

    @Test
    void invariantConfidenceIsBounded() {
        assertThatThrownBy(() -> new DiscoveredInvariant("x", "x",
                PropertyFormula.of(Atomic.of("P")), -0.1, InvariantType.LOGICAL_INVARIANT))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
