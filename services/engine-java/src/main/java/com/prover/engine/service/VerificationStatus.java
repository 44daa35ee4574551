package com.prover.engine.service;

import java.util.List;

/**
 * Overall verdict of a batch run.
 */
public sealed interface VerificationStatus {

    record Verified() implements VerificationStatus {
    }

    record PartiallyVerified(int verifiedCount, int totalCount, List<VerificationFailure> failures)
            implements VerificationStatus {

        public PartiallyVerified {
            failures = List.copyOf(failures);
        }
    }

    record Failed(List<VerificationFailure> failures) implements VerificationStatus {

        public Failed {
            failures = List.copyOf(failures);
        }
    }

    /**
     * Verified with no failures (an empty batch included), Failed when nothing verified, otherwise partial.
     */
    static VerificationStatus of(int verifiedCount, List<VerificationFailure> failures) {
        if (failures.isEmpty()) {
            return new Verified();
        }
        if (verifiedCount == 0) {
            return new Failed(failures);
        }
        return new PartiallyVerified(verifiedCount, verifiedCount + failures.size(), failures);
    }
}
