package com.prover.engine.service;

import com.prover.engine.invariant.DiscoveredInvariant;

import java.util.List;
import java.util.Locale;

public record VerificationFailure(String invariantId, String reason, List<String> diagnostics,
                                  List<String> suggestions) {

    public VerificationFailure {
        diagnostics = List.copyOf(diagnostics);
        suggestions = List.copyOf(suggestions);
    }

    static VerificationFailure of(DiscoveredInvariant invariant, String reason) {
        return new VerificationFailure(invariant.id(), reason,
                List.of("Invariant type: " + invariant.invariantType(),
                        String.format(Locale.ROOT, "Confidence: %.2f", invariant.confidence())),
                List.of("Consider adjusting confidence threshold", "Try alternative verification methods"));
    }
}
