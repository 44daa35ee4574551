package com.prover.engine.config;

import com.prover.engine.proof.VerificationMethod;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Validated, immutable engine configuration.
 *
 * @param enabledMethods strategies tried in order, first success wins
 * @param maxMemoryUsage heap budget in bytes, sampled between invariants
 */
public record VerificationSettings(
        Duration totalTimeout,
        Duration proofTimeout,
        int maxProofComplexity,
        List<VerificationMethod> enabledMethods,
        double proofConfidenceThreshold,
        long maxMemoryUsage,
        boolean parallelVerification,
        int workerThreads,
        boolean enableProofCache,
        int proofCacheSize,
        int maxVerificationDepth,
        boolean degradeOnConsistencyError) {

    public VerificationSettings {
        requirePositive(totalTimeout, "totalTimeout");
        requirePositive(proofTimeout, "proofTimeout");
        enabledMethods = List.copyOf(enabledMethods);
        if (enabledMethods.isEmpty()) {
            throw new IllegalArgumentException("at least one verification method must be enabled");
        }
        if (!(proofConfidenceThreshold >= 0.0 && proofConfidenceThreshold <= 1.0)) {
            throw new IllegalArgumentException("proofConfidenceThreshold must be in [0,1], was "
                    + proofConfidenceThreshold);
        }
        if (maxProofComplexity < 1) {
            throw new IllegalArgumentException("maxProofComplexity must be positive");
        }
        if (maxMemoryUsage < 1) {
            throw new IllegalArgumentException("maxMemoryUsage must be positive");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1, was " + workerThreads);
        }
        if (proofCacheSize < 1) {
            throw new IllegalArgumentException("proofCacheSize must be positive");
        }
        if (maxVerificationDepth < 1) {
            throw new IllegalArgumentException("maxVerificationDepth must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .totalTimeout(totalTimeout)
                .proofTimeout(proofTimeout)
                .maxProofComplexity(maxProofComplexity)
                .enabledMethods(enabledMethods)
                .proofConfidenceThreshold(proofConfidenceThreshold)
                .maxMemoryUsage(maxMemoryUsage)
                .parallelVerification(parallelVerification)
                .workerThreads(workerThreads)
                .enableProofCache(enableProofCache)
                .proofCacheSize(proofCacheSize)
                .maxVerificationDepth(maxVerificationDepth)
                .degradeOnConsistencyError(degradeOnConsistencyError);
    }

    private static void requirePositive(Duration duration, String name) {
        Objects.requireNonNull(duration, name);
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, was " + duration);
        }
    }

    public static final class Builder {
        private Duration totalTimeout = Duration.ofSeconds(300);
        private Duration proofTimeout = Duration.ofSeconds(30);
        private int maxProofComplexity = 1000;
        private List<VerificationMethod> enabledMethods = List.of(
                VerificationMethod.DIRECT_PROOF,
                VerificationMethod.SMT_SOLVER_VERIFICATION,
                VerificationMethod.AUTOMATED_PROOF);
        private double proofConfidenceThreshold = 0.8;
        private long maxMemoryUsage = 1024L * 1024 * 1024;
        private boolean parallelVerification = true;
        private int workerThreads = 4;
        private boolean enableProofCache = true;
        private int proofCacheSize = 1024;
        private int maxVerificationDepth = 20;
        private boolean degradeOnConsistencyError;

        private Builder() {
        }

        public Builder totalTimeout(Duration totalTimeout) {
            this.totalTimeout = totalTimeout;
            return this;
        }

        public Builder proofTimeout(Duration proofTimeout) {
            this.proofTimeout = proofTimeout;
            return this;
        }

        public Builder maxProofComplexity(int maxProofComplexity) {
            this.maxProofComplexity = maxProofComplexity;
            return this;
        }

        public Builder enabledMethods(List<VerificationMethod> enabledMethods) {
            this.enabledMethods = enabledMethods;
            return this;
        }

        public Builder enabledMethods(VerificationMethod... enabledMethods) {
            return enabledMethods(List.of(enabledMethods));
        }

        public Builder proofConfidenceThreshold(double proofConfidenceThreshold) {
            this.proofConfidenceThreshold = proofConfidenceThreshold;
            return this;
        }

        public Builder maxMemoryUsage(long maxMemoryUsage) {
            this.maxMemoryUsage = maxMemoryUsage;
            return this;
        }

        public Builder parallelVerification(boolean parallelVerification) {
            this.parallelVerification = parallelVerification;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder enableProofCache(boolean enableProofCache) {
            this.enableProofCache = enableProofCache;
            return this;
        }

        public Builder proofCacheSize(int proofCacheSize) {
            this.proofCacheSize = proofCacheSize;
            return this;
        }

        public Builder maxVerificationDepth(int maxVerificationDepth) {
            this.maxVerificationDepth = maxVerificationDepth;
            return this;
        }

        public Builder degradeOnConsistencyError(boolean degradeOnConsistencyError) {
            this.degradeOnConsistencyError = degradeOnConsistencyError;
            return this;
        }

        public VerificationSettings build() {
            return new VerificationSettings(totalTimeout, proofTimeout, maxProofComplexity, enabledMethods,
                    proofConfidenceThreshold, maxMemoryUsage, parallelVerification, workerThreads, enableProofCache,
                    proofCacheSize, maxVerificationDepth, degradeOnConsistencyError);
        }
    }
}
