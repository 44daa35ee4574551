package com.prover.engine.service;

public enum InteractionType {
    CONFLICTING,
    IMPLICATION,
    SUPPORTIVE,
    INDEPENDENT
}
