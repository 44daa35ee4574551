package com.prover.engine.config;

import com.prover.engine.grpc.EmbeddedGrpcServer;
import com.prover.engine.invariant.DeclaredInvariantDiscovery;
import com.prover.engine.invariant.InvariantDiscovery;
import com.prover.engine.proof.ContradictionProofConstructor;
import com.prover.engine.proof.DirectProofConstructor;
import com.prover.engine.proof.LruProofCache;
import com.prover.engine.proof.ProofCache;
import com.prover.engine.proof.ProofStepValidator;
import com.prover.engine.service.DocumentVerifier;
import com.prover.engine.service.MemorySampler;
import com.prover.engine.service.PropertyVerifier;
import com.prover.engine.service.StrategyDispatcher;
import com.prover.engine.solver.AutomatedProver;
import com.prover.engine.solver.InstrumentedSatisfiabilityBackend;
import com.prover.engine.solver.SatisfiabilityBackend;
import com.prover.engine.solver.SolverStatistics;
import com.prover.engine.solver.TautologyProver;
import com.prover.engine.solver.TruthTableSatisfiabilityBackend;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Engine wiring. The discovery, satisfiability and prover collaborators have in-process defaults that any
 * other bean of the same type replaces.
 */
@Configuration
@EnableConfigurationProperties(VerificationProperties.class)
public class EngineConfiguration {

    @Bean
    public VerificationSettings verificationSettings(VerificationProperties properties) {
        return properties.toSettings();
    }

    @Bean
    @ConditionalOnMissingBean
    public InvariantDiscovery invariantDiscovery(VerificationProperties properties) {
        return new DeclaredInvariantDiscovery(properties.getDiscovery().getMinConfidence());
    }

    @Bean
    @ConditionalOnMissingBean
    public SatisfiabilityBackend satisfiabilityBackend(VerificationProperties properties) {
        return new TruthTableSatisfiabilityBackend(properties.getSolver().getMaxAtoms());
    }

    @Bean
    @ConditionalOnMissingBean
    public AutomatedProver automatedProver(VerificationProperties properties) {
        return new TautologyProver(properties.getSolver().getMaxAtoms());
    }

    @Bean
    public SolverStatistics solverStatistics() {
        return new SolverStatistics();
    }

    @Bean
    public DirectProofConstructor directProofConstructor(VerificationSettings settings) {
        return new DirectProofConstructor(new ProofStepValidator(), settings.maxVerificationDepth());
    }

    @Bean
    public ContradictionProofConstructor contradictionProofConstructor(DirectProofConstructor direct) {
        return new ContradictionProofConstructor(direct);
    }

    @Bean
    public ProofCache proofCache(VerificationSettings settings) {
        return new LruProofCache(settings.proofCacheSize());
    }

    @Bean
    public StrategyDispatcher strategyDispatcher(DirectProofConstructor direct,
                                                 ContradictionProofConstructor contradiction,
                                                 SatisfiabilityBackend backend,
                                                 AutomatedProver prover,
                                                 SolverStatistics statistics,
                                                 VerificationSettings settings) {
        return StrategyDispatcher.standard(direct, contradiction,
                new InstrumentedSatisfiabilityBackend(backend, statistics), prover, settings.maxProofComplexity());
    }

    @Bean
    public PropertyVerifier propertyVerifier(StrategyDispatcher dispatcher, ProofCache cache,
                                             VerificationSettings settings) {
        return new PropertyVerifier(dispatcher, cache, settings);
    }

    @Bean(destroyMethod = "close")
    public DocumentVerifier documentVerifier(InvariantDiscovery discovery,
                                             SatisfiabilityBackend backend,
                                             PropertyVerifier propertyVerifier,
                                             SolverStatistics statistics,
                                             VerificationSettings settings) {
        return new DocumentVerifier(discovery, new InstrumentedSatisfiabilityBackend(backend, statistics),
                propertyVerifier, statistics, MemorySampler.heap(), settings);
    }

    @Bean(destroyMethod = "stop")
    public EmbeddedGrpcServer embeddedGrpcServer(PropertyVerifier propertyVerifier,
                                                 DocumentVerifier documentVerifier) {
        return new EmbeddedGrpcServer(propertyVerifier, documentVerifier);
    }
}
