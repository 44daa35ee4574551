package com.prover.engine.config;

import com.prover.engine.grpc.EmbeddedGrpcServer;
import com.prover.engine.invariant.InvariantDiscovery;
import com.prover.engine.logic.Atomic;
import com.prover.engine.logic.PropertyFormula;
import com.prover.engine.logic.Quantifier;
import com.prover.engine.logic.Universal;
import com.prover.engine.logic.Variable;
import com.prover.engine.proof.FormalProof;
import com.prover.engine.proof.LruProofCache;
import com.prover.engine.proof.ProofCache;
import com.prover.engine.proof.VerificationMethod;
import com.prover.engine.service.PropertyVerifier;
import com.prover.engine.solver.SatisfiabilityBackend;
import com.prover.engine.solver.TruthTableSatisfiabilityBackend;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "verifier.proof-timeout=5s",
        "verifier.enabled-methods[0]=HYBRID(DIRECT_PROOF,PROOF_BY_CONTRADICTION)",
        "verifier.enabled-methods[1]=AUTOMATED_PROOF",
        "verifier.parallel-verification=false",
        "verifier.proof-cache-size=8"
})
class EngineConfigurationTest {

    @Autowired
    private VerificationSettings settings;

    @Autowired
    private PropertyVerifier propertyVerifier;

    @Autowired
    private ProofCache proofCache;

    @Autowired
    private SatisfiabilityBackend backend;

    @Autowired
    private InvariantDiscovery discovery;

    @Autowired
    private EmbeddedGrpcServer grpcServer;

    @Test
    void bindsVerifierProperties() {
        assertThat(settings.proofTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(settings.enabledMethods()).containsExactly(
                VerificationMethod.hybrid(VerificationMethod.DIRECT_PROOF, VerificationMethod.PROOF_BY_CONTRADICTION),
                VerificationMethod.AUTOMATED_PROOF);
        assertThat(settings.parallelVerification()).isFalse();
        assertThat(((LruProofCache) proofCache).capacity()).isEqualTo(8);
    }

    @Test
    void wiresInProcessDefaults() {
        assertThat(backend).isInstanceOf(TruthTableSatisfiabilityBackend.class);
        assertThat(discovery).isNotNull();
        assertThat(grpcServer.getPort()).isEqualTo(-1);
    }

    @Test
    void verifiesThroughTheWiredEngine() throws Exception {
        FormalProof proof = propertyVerifier.verifyProperty(PropertyFormula.of(
                new Universal(Quantifier.of("x"), Atomic.of("TypeSafe", Variable.of("x")))));

        assertThat(proof.steps()).hasSize(3);
        assertThat(proof.method().isHybrid()).isTrue();
    }
}
