package com.prover.engine.logic;

import java.util.List;

public record TypeSignature(List<String> inputs, String output) {

    public TypeSignature {
        inputs = List.copyOf(inputs);
    }
}
