package com.prover.engine.proof;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VerificationMethodTest {

    @Test
    void parsesPlainMethods() {
        assertThat(VerificationMethod.parse("DIRECT_PROOF")).isEqualTo(VerificationMethod.DIRECT_PROOF);
        assertThat(VerificationMethod.parse(" smt_solver_verification ")).isEqualTo(VerificationMethod.SMT_SOLVER_VERIFICATION);
    }

    @Test
    void parsesNestedHybrids() {
        VerificationMethod method = VerificationMethod.parse(
                "HYBRID(PROOF_BY_CONTRADICTION, HYBRID_VERIFICATION(AUTOMATED_PROOF, DIRECT_PROOF))");

        assertThat(method).isEqualTo(VerificationMethod.hybrid(
                VerificationMethod.PROOF_BY_CONTRADICTION,
                VerificationMethod.hybrid(VerificationMethod.AUTOMATED_PROOF, VerificationMethod.DIRECT_PROOF)));
        assertThat(method.toString()).isEqualTo("HYBRID(PROOF_BY_CONTRADICTION,HYBRID(AUTOMATED_PROOF,DIRECT_PROOF))");
        assertThat(VerificationMethod.parse(method.toString())).isEqualTo(method);
    }

    @Test
    void rejectsMalformedExpressions() {
        assertThatThrownBy(() -> VerificationMethod.parse("MODEL_CHECKING"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unknown verification method");
        assertThatThrownBy(() -> VerificationMethod.parse("HYBRID(DIRECT_PROOF"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> VerificationMethod.parse("HYBRID()"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> VerificationMethod.parse("DIRECT_PROOF AUTOMATED_PROOF"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void onlyHybridCarriesMembers() {
        assertThatThrownBy(() -> new VerificationMethod(VerificationMethod.Kind.DIRECT_PROOF,
                List.of(VerificationMethod.AUTOMATED_PROOF)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(VerificationMethod.hybrid(VerificationMethod.DIRECT_PROOF).isHybrid()).isTrue();
    }
}
