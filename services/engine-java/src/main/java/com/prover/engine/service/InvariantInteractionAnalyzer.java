package com.prover.engine.service;

import com.prover.engine.invariant.DiscoveredInvariant;
import com.prover.engine.logic.Formula;
import com.prover.engine.logic.Implication;
import com.prover.engine.logic.Negation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Classifies every unordered pair of invariants by syntactic shape only; no solver calls.
 */
public class InvariantInteractionAnalyzer {

    public List<InvariantInteraction> analyze(List<DiscoveredInvariant> invariants) {
        List<InvariantInteraction> interactions = new ArrayList<>();
        for (int i = 0; i < invariants.size(); i++) {
            for (int j = i + 1; j < invariants.size(); j++) {
                interactions.add(classify(invariants.get(i), invariants.get(j)));
            }
        }
        return interactions;
    }

    InvariantInteraction classify(DiscoveredInvariant first, DiscoveredInvariant second) {
        Formula a = first.formula().structure();
        Formula b = second.formula().structure();
        if (negates(a, b) || negates(b, a)) {
            return new InvariantInteraction(first.id(), second.id(), InteractionType.CONFLICTING, 1.0);
        }
        if (implies(a, b) || implies(b, a)) {
            return new InvariantInteraction(first.id(), second.id(), InteractionType.IMPLICATION, 1.0);
        }
        double overlap = jaccard(first.formula().predicates(), second.formula().predicates());
        if (overlap > 0.0) {
            return new InvariantInteraction(first.id(), second.id(), InteractionType.SUPPORTIVE, overlap);
        }
        return new InvariantInteraction(first.id(), second.id(), InteractionType.INDEPENDENT, 0.0);
    }

    private static boolean negates(Formula a, Formula b) {
        return a instanceof Negation negation && negation.formula().equals(b);
    }

    private static boolean implies(Formula a, Formula b) {
        return a instanceof Implication implication && implication.consequent().equals(b);
    }

    private static double jaccard(Set<String> a, Set<String> b) {
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        return (double) intersection.size() / union.size();
    }
}
