package com.prover.engine.logic;

import java.util.List;

public record Negation(Formula formula) implements Formula {

    @Override
    public Formula substitute(String variable, Term replacement) {
        return new Negation(formula.substitute(variable, replacement));
    }

    @Override
    public List<Formula> children() {
        return List.of(formula);
    }

    @Override
    public String render() {
        return "¬" + formula.render();
    }

    @Override
    public String toString() {
        return render();
    }
}
