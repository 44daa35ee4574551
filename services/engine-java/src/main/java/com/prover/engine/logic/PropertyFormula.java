package com.prover.engine.logic;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A formula tree together with the symbol sets used for fast membership queries.
 *
 * <p>Build instances with {@link #of(Formula)} so the auxiliary sets always agree with the structure.
 */
public record PropertyFormula(
        Formula structure,
        List<Quantifier> quantifiers,
        Set<String> freeVariables,
        Set<String> predicates,
        Set<String> functions,
        Set<String> constants) {

    public PropertyFormula {
        Objects.requireNonNull(structure, "structure");
        quantifiers = List.copyOf(quantifiers);
        freeVariables = Set.copyOf(freeVariables);
        predicates = Set.copyOf(predicates);
        functions = Set.copyOf(functions);
        constants = Set.copyOf(constants);
    }

    public static PropertyFormula of(Formula structure) {
        Symbols symbols = new Symbols();
        symbols.visit(structure, new HashSet<>());
        return new PropertyFormula(structure, symbols.quantifiers, symbols.freeVariables, symbols.predicates,
                symbols.functions, symbols.constants);
    }

    public boolean usesPredicate(String name) {
        return predicates.contains(name);
    }

    public String render() {
        return structure.render();
    }

    @Override
    public String toString() {
        return render();
    }

    private static final class Symbols {
        final List<Quantifier> quantifiers = new ArrayList<>();
        final Set<String> freeVariables = new HashSet<>();
        final Set<String> predicates = new HashSet<>();
        final Set<String> functions = new HashSet<>();
        final Set<String> constants = new HashSet<>();

        void visit(Formula formula, Set<String> bound) {
            if (formula instanceof Universal universal) {
                visitQuantified(universal.quantifier(), universal.body(), bound);
            } else if (formula instanceof Existential existential) {
                visitQuantified(existential.quantifier(), existential.body(), bound);
            } else if (formula instanceof Atomic atomic) {
                predicates.add(atomic.predicate());
                for (Term term : atomic.terms()) visitTerm(term, bound);
            } else {
                for (Formula child : formula.children()) visit(child, bound);
            }
        }

        private void visitQuantified(Quantifier quantifier, Formula body, Set<String> bound) {
            quantifiers.add(quantifier);
            Set<String> inner = new HashSet<>(bound);
            inner.add(quantifier.variable());
            visit(body, inner);
        }

        private void visitTerm(Term term, Set<String> bound) {
            if (term instanceof Variable variable) {
                if (!bound.contains(variable.name())) freeVariables.add(variable.name());
            } else if (term instanceof Constant constant) {
                constants.add(constant.value());
            } else if (term instanceof Function function) {
                functions.add(function.name());
                for (Term arg : function.args()) visitTerm(arg, bound);
            }
        }
    }
}
