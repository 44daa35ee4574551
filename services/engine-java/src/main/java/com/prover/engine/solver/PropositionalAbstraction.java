package com.prover.engine.solver;

import com.prover.engine.logic.Atomic;
import com.prover.engine.logic.Conjunction;
import com.prover.engine.logic.Disjunction;
import com.prover.engine.logic.Existential;
import com.prover.engine.logic.Formula;
import com.prover.engine.logic.FormulaFingerprint;
import com.prover.engine.logic.Implication;
import com.prover.engine.logic.Negation;
import com.prover.engine.logic.Quantifier;
import com.prover.engine.logic.Universal;
import com.prover.engine.logic.Variable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Propositional skeleton of a set of formulas.
 *
 * <p>Bound variables are renamed apart, quantifiers are dropped and every distinct atom becomes a boolean
 * variable. A tautological skeleton means the original formula is valid, and an unsatisfiable skeleton means
 * the original set is unsatisfiable. A model of a quantified skeleton proves nothing about the original.
 */
final class PropositionalAbstraction {

    private final List<Formula> formulas;
    private final Map<String, Integer> atomIndex = new LinkedHashMap<>();
    private final List<String> atomNames = new ArrayList<>();
    private boolean quantified;
    private int fresh;

    private PropositionalAbstraction(List<Formula> originals) {
        this.formulas = new ArrayList<>();
        for (Formula formula : originals) {
            Formula renamed = renameApart(formula);
            index(renamed);
            formulas.add(renamed);
        }
    }

    static PropositionalAbstraction of(List<Formula> formulas) {
        return new PropositionalAbstraction(formulas);
    }

    int atomCount() {
        return atomNames.size();
    }

    boolean quantified() {
        return quantified;
    }

    int formulaCount() {
        return formulas.size();
    }

    /**
     * First assignment (as a bit mask over atoms) satisfying every formula whose bit is set in {@code include}.
     */
    OptionalLong findModel(boolean[] include) {
        long limit = 1L << atomNames.size();
        for (long assignment = 0; assignment < limit; assignment++) {
            if (satisfiesAll(assignment, include)) return OptionalLong.of(assignment);
        }
        return OptionalLong.empty();
    }

    OptionalLong findModel() {
        boolean[] all = new boolean[formulas.size()];
        Arrays.fill(all, true);
        return findModel(all);
    }

    ConstraintModel toModel(long assignment) {
        Map<String, Boolean> values = new HashMap<>();
        for (int i = 0; i < atomNames.size(); i++) {
            values.put(atomNames.get(i), (assignment & (1L << i)) != 0);
        }
        return new ConstraintModel(values);
    }

    private boolean satisfiesAll(long assignment, boolean[] include) {
        for (int i = 0; i < formulas.size(); i++) {
            if (include[i] && !evaluate(formulas.get(i), assignment)) return false;
        }
        return true;
    }

    private boolean evaluate(Formula formula, long assignment) {
        if (formula instanceof Atomic atomic) {
            int bit = atomIndex.get(FormulaFingerprint.canonical(atomic));
            return (assignment & (1L << bit)) != 0;
        } else if (formula instanceof Negation negation) {
            return !evaluate(negation.formula(), assignment);
        } else if (formula instanceof Conjunction conjunction) {
            for (Formula part : conjunction.parts()) {
                if (!evaluate(part, assignment)) return false;
            }
            return true;
        } else if (formula instanceof Disjunction disjunction) {
            for (Formula part : disjunction.parts()) {
                if (evaluate(part, assignment)) return true;
            }
            return false;
        } else if (formula instanceof Implication implication) {
            return !evaluate(implication.antecedent(), assignment) || evaluate(implication.consequent(), assignment);
        } else {
            // quantifiers are transparent once bound variables are renamed apart
            return evaluate(formula.children().get(0), assignment);
        }
    }

    private void index(Formula formula) {
        if (formula instanceof Atomic atomic) {
            String key = FormulaFingerprint.canonical(atomic);
            if (!atomIndex.containsKey(key)) {
                atomIndex.put(key, atomNames.size());
                atomNames.add(atomic.render());
            }
            return;
        }
        for (Formula child : formula.children()) index(child);
    }

    private Formula renameApart(Formula formula) {
        if (formula instanceof Universal universal) {
            quantified = true;
            Quantifier q = universal.quantifier();
            Variable renamed = new Variable(q.variable() + "#" + (++fresh), q.type());
            return new Universal(new Quantifier(renamed.name(), q.type()),
                    renameApart(universal.body().substitute(q.variable(), renamed)));
        } else if (formula instanceof Existential existential) {
            quantified = true;
            Quantifier q = existential.quantifier();
            Variable renamed = new Variable(q.variable() + "#" + (++fresh), q.type());
            return new Existential(new Quantifier(renamed.name(), q.type()),
                    renameApart(existential.body().substitute(q.variable(), renamed)));
        } else if (formula instanceof Implication implication) {
            return new Implication(renameApart(implication.antecedent()), renameApart(implication.consequent()));
        } else if (formula instanceof Conjunction conjunction) {
            return new Conjunction(conjunction.parts().stream().map(this::renameApart).toList());
        } else if (formula instanceof Disjunction disjunction) {
            return new Disjunction(disjunction.parts().stream().map(this::renameApart).toList());
        } else if (formula instanceof Negation negation) {
            return new Negation(renameApart(negation.formula()));
        }
        return formula;
    }
}
