package com.prover.engine.proof;

import com.prover.engine.VerificationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProofStepValidatorTest {

    private final ProofStepValidator validator = new ProofStepValidator();

    private static ProofStep step(int n, String rule, int premises, Integer... dependencies) {
        List<String> premiseList = IntStream.range(0, premises).mapToObj(i -> "p" + i).toList();
        return new ProofStep(n, rule, premiseList, "c" + n, "j", Set.of(dependencies));
    }

    @Test
    void forwardDependencyIsRejected() {
        List<ProofStep> steps = List.of(
                step(1, ProofRules.AXIOM_APPLICATION, 0, 2),
                step(2, ProofRules.AXIOM_APPLICATION, 0));

        assertThatThrownBy(() -> validator.validate(steps))
                .isInstanceOf(VerificationException.class)
                .hasMessage("Invalid dependency 2 in step 1");
    }

    @Test
    void selfAndZeroDependenciesAreRejected() {
        assertThatThrownBy(() -> validator.validate(List.of(step(1, "CUSTOM", 0, 1))))
                .hasMessage("Invalid dependency 1 in step 1");
        assertThatThrownBy(() -> validator.validate(List.of(step(1, "CUSTOM", 0, 0))))
                .hasMessage("Invalid dependency 0 in step 1");
    }

    @Test
    void gapsInNumberingAreRejected() {
        List<ProofStep> steps = List.of(step(1, ProofRules.ASSUMPTION, 0), step(3, ProofRules.ASSUMPTION, 0));

        assertThatThrownBy(() -> validator.validate(steps))
                .hasMessage("Step numbers must be dense: expected 2, found 3");
    }

    @Test
    void introductionRulesNeedTheirPremises() {
        List<ProofStep> steps = List.of(
                step(1, ProofRules.ASSUMPTION, 0),
                step(2, ProofRules.IMPLICATION_INTRODUCTION, 1, 1));

        assertThatThrownBy(() -> validator.validate(steps))
                .hasMessage("IMPLICATION_INTRODUCTION in step 2 requires 2 premises, found 1");
    }

    @Test
    void leavesAndUnknownRulesAreAccepted() {
        List<ProofStep> steps = List.of(
                step(1, ProofRules.ARBITRARY_VARIABLE_INTRODUCTION, 0),
                step(2, ProofRules.AXIOM_APPLICATION, 0),
                step(3, "INDUCTION_STEP", 0, 1, 2),
                step(4, ProofRules.UNIVERSAL_INTRODUCTION, 1, 1, 2, 3));

        assertThatCode(() -> validator.validate(steps)).doesNotThrowAnyException();
    }

    @Test
    void emptyProofIsAccepted() {
        assertThatCode(() -> validator.validate(List.of())).doesNotThrowAnyException();
    }
}
