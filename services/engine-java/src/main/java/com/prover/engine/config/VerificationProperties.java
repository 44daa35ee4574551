package com.prover.engine.config;

import com.prover.engine.proof.VerificationMethod;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externally supplied engine configuration, bound from the {@code verifier.*} properties.
 */
@ConfigurationProperties(prefix = "verifier")
public class VerificationProperties {

    private Duration totalTimeout = Duration.ofSeconds(300);
    private Duration proofTimeout = Duration.ofSeconds(30);
    private int maxProofComplexity = 1000;
    private List<String> enabledMethods = new ArrayList<>(List.of(
            "DIRECT_PROOF", "SMT_SOLVER_VERIFICATION", "AUTOMATED_PROOF"));
    private double proofConfidenceThreshold = 0.8;
    private DataSize maxMemoryUsage = DataSize.ofGigabytes(1);
    private boolean parallelVerification = true;
    private int workerThreads = 4;
    private boolean enableProofCache = true;
    private int proofCacheSize = 1024;
    private int maxVerificationDepth = 20;
    private boolean degradeOnConsistencyError;
    private final Solver solver = new Solver();
    private final Discovery discovery = new Discovery();

    public VerificationSettings toSettings() {
        return VerificationSettings.builder()
                .totalTimeout(totalTimeout)
                .proofTimeout(proofTimeout)
                .maxProofComplexity(maxProofComplexity)
                .enabledMethods(enabledMethods.stream().map(VerificationMethod::parse).toList())
                .proofConfidenceThreshold(proofConfidenceThreshold)
                .maxMemoryUsage(maxMemoryUsage.toBytes())
                .parallelVerification(parallelVerification)
                .workerThreads(workerThreads)
                .enableProofCache(enableProofCache)
                .proofCacheSize(proofCacheSize)
                .maxVerificationDepth(maxVerificationDepth)
                .degradeOnConsistencyError(degradeOnConsistencyError)
                .build();
    }

    public Duration getTotalTimeout() {
        return totalTimeout;
    }

    public void setTotalTimeout(Duration totalTimeout) {
        this.totalTimeout = totalTimeout;
    }

    public Duration getProofTimeout() {
        return proofTimeout;
    }

    public void setProofTimeout(Duration proofTimeout) {
        this.proofTimeout = proofTimeout;
    }

    public int getMaxProofComplexity() {
        return maxProofComplexity;
    }

    public void setMaxProofComplexity(int maxProofComplexity) {
        this.maxProofComplexity = maxProofComplexity;
    }

    public List<String> getEnabledMethods() {
        return enabledMethods;
    }

    public void setEnabledMethods(List<String> enabledMethods) {
        this.enabledMethods = enabledMethods;
    }

    public double getProofConfidenceThreshold() {
        return proofConfidenceThreshold;
    }

    public void setProofConfidenceThreshold(double proofConfidenceThreshold) {
        this.proofConfidenceThreshold = proofConfidenceThreshold;
    }

    public DataSize getMaxMemoryUsage() {
        return maxMemoryUsage;
    }

    public void setMaxMemoryUsage(DataSize maxMemoryUsage) {
        this.maxMemoryUsage = maxMemoryUsage;
    }

    public boolean isParallelVerification() {
        return parallelVerification;
    }

    public void setParallelVerification(boolean parallelVerification) {
        this.parallelVerification = parallelVerification;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public boolean isEnableProofCache() {
        return enableProofCache;
    }

    public void setEnableProofCache(boolean enableProofCache) {
        this.enableProofCache = enableProofCache;
    }

    public int getProofCacheSize() {
        return proofCacheSize;
    }

    public void setProofCacheSize(int proofCacheSize) {
        this.proofCacheSize = proofCacheSize;
    }

    public int getMaxVerificationDepth() {
        return maxVerificationDepth;
    }

    public void setMaxVerificationDepth(int maxVerificationDepth) {
        this.maxVerificationDepth = maxVerificationDepth;
    }

    public boolean isDegradeOnConsistencyError() {
        return degradeOnConsistencyError;
    }

    public void setDegradeOnConsistencyError(boolean degradeOnConsistencyError) {
        this.degradeOnConsistencyError = degradeOnConsistencyError;
    }

    public Solver getSolver() {
        return solver;
    }

    public Discovery getDiscovery() {
        return discovery;
    }

    public static class Solver {
        private int maxAtoms = 20;

        public int getMaxAtoms() {
            return maxAtoms;
        }

        public void setMaxAtoms(int maxAtoms) {
            this.maxAtoms = maxAtoms;
        }
    }

    public static class Discovery {
        private double minConfidence;

        public double getMinConfidence() {
            return minConfidence;
        }

        public void setMinConfidence(double minConfidence) {
            this.minConfidence = minConfidence;
        }
    }
}
