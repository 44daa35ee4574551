package com.prover.engine.logic;

import java.util.List;

public record Existential(Quantifier quantifier, Formula body) implements Formula {

    @Override
    public Formula substitute(String variable, Term replacement) {
        if (quantifier.variable().equals(variable)) return this;
        return new Existential(quantifier, body.substitute(variable, replacement));
    }

    @Override
    public List<Formula> children() {
        return List.of(body);
    }

    @Override
    public String render() {
        return "∃" + quantifier.render() + ". " + body.render();
    }

    @Override
    public String toString() {
        return render();
    }
}
