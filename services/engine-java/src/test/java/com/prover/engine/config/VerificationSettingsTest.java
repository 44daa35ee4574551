package com.prover.engine.config;

import com.prover.engine.proof.VerificationMethod;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VerificationSettingsTest {

    @Test
    void builderDefaultsMatchPropertyDefaults() {
        VerificationSettings defaults = VerificationSettings.builder().build();

        assertThat(new VerificationProperties().toSettings()).isEqualTo(defaults);
        assertThat(defaults.totalTimeout()).isEqualTo(Duration.ofSeconds(300));
        assertThat(defaults.proofTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(defaults.enabledMethods()).containsExactly(VerificationMethod.DIRECT_PROOF,
                VerificationMethod.SMT_SOLVER_VERIFICATION, VerificationMethod.AUTOMATED_PROOF);
        assertThat(defaults.maxMemoryUsage()).isEqualTo(DataSize.ofGigabytes(1).toBytes());
        assertThat(defaults.maxVerificationDepth()).isEqualTo(20);
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> VerificationSettings.builder().enabledMethods(List.of()).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> VerificationSettings.builder().proofConfidenceThreshold(1.5).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> VerificationSettings.builder().workerThreads(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("workerThreads must be at least 1, was 0");
        assertThatThrownBy(() -> VerificationSettings.builder().totalTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> VerificationSettings.builder().maxVerificationDepth(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void propertiesParseMethodExpressions() {
        VerificationProperties properties = new VerificationProperties();
        properties.setEnabledMethods(List.of("HYBRID(PROOF_BY_CONTRADICTION, AUTOMATED_PROOF)", "DIRECT_PROOF"));
        properties.setMaxMemoryUsage(DataSize.ofMegabytes(256));

        VerificationSettings settings = properties.toSettings();

        assertThat(settings.enabledMethods()).containsExactly(
                VerificationMethod.hybrid(VerificationMethod.PROOF_BY_CONTRADICTION, VerificationMethod.AUTOMATED_PROOF),
                VerificationMethod.DIRECT_PROOF);
        assertThat(settings.maxMemoryUsage()).isEqualTo(256L * 1024 * 1024);
    }

    @Test
    void toBuilderCopiesEveryField() {
        VerificationSettings settings = VerificationSettings.builder()
                .parallelVerification(false)
                .degradeOnConsistencyError(true)
                .proofCacheSize(7)
                .build();

        assertThat(settings.toBuilder().build()).isEqualTo(settings);
    }
}
