package com.prover.engine.logic;

import java.util.Set;

/**
 * A term of the property language: a variable, a typed constant or a function application.
 */
public sealed interface Term permits Variable, Constant, Function {

    /**
     * Replaces every occurrence of the named variable with {@code replacement}.
     */
    Term substitute(String variable, Term replacement);

    /**
     * Names of the variables occurring in this term.
     */
    Set<String> variables();

    String render();
}
