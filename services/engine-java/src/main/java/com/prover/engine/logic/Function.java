package com.prover.engine.logic;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An applied function symbol, e.g. {@code size(d)}.
 */
public record Function(String name, List<Term> args) implements Term {

    public Function {
        Objects.requireNonNull(name, "name");
        args = List.copyOf(args);
    }

    @Override
    public Term substitute(String variable, Term replacement) {
        return new Function(name, args.stream().map(t -> t.substitute(variable, replacement)).toList());
    }

    @Override
    public Set<String> variables() {
        Set<String> out = new HashSet<>();
        for (Term arg : args) out.addAll(arg.variables());
        return out;
    }

    @Override
    public String render() {
        return name + "(" + args.stream().map(Term::render).collect(Collectors.joining(", ")) + ")";
    }

    @Override
    public String toString() {
        return render();
    }
}
