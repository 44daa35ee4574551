package com.prover.engine.logic;

import java.util.List;

public record Implication(Formula antecedent, Formula consequent) implements Formula {

    @Override
    public Formula substitute(String variable, Term replacement) {
        return new Implication(antecedent.substitute(variable, replacement),
                consequent.substitute(variable, replacement));
    }

    @Override
    public List<Formula> children() {
        return List.of(antecedent, consequent);
    }

    @Override
    public String render() {
        return "(" + antecedent.render() + " → " + consequent.render() + ")";
    }

    @Override
    public String toString() {
        return render();
    }
}
