package com.prover.engine.service;

import com.prover.engine.CollaboratorException;
import com.prover.engine.VerificationException;
import com.prover.engine.logic.Atomic;
import com.prover.engine.logic.Disjunction;
import com.prover.engine.logic.Negation;
import com.prover.engine.logic.PropertyFormula;
import com.prover.engine.logic.Quantifier;
import com.prover.engine.logic.Universal;
import com.prover.engine.logic.Variable;
import com.prover.engine.proof.ContradictionProofConstructor;
import com.prover.engine.proof.Deadline;
import com.prover.engine.proof.DirectProofConstructor;
import com.prover.engine.proof.ProofRules;
import com.prover.engine.proof.ProofStep;
import com.prover.engine.proof.ProofStepValidator;
import com.prover.engine.proof.VerificationMethod;
import com.prover.engine.solver.SatisfiabilityBackend;
import com.prover.engine.solver.TautologyProver;
import com.prover.engine.solver.TruthTableSatisfiabilityBackend;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StrategyDispatcherTest {

    private static final PropertyFormula GOAL = PropertyFormula.of(Atomic.of("Goal"));

    private final List<VerificationMethod.Kind> attempted = new ArrayList<>();

    private ProofStrategy failing(VerificationMethod.Kind kind) {
        return (formula, deadline) -> {
            attempted.add(kind);
            throw new VerificationException(kind + " cannot prove " + formula);
        };
    }

    private ProofStrategy succeeding(VerificationMethod.Kind kind, int steps) {
        return (formula, deadline) -> {
            attempted.add(kind);
            List<ProofStep> out = new ArrayList<>();
            for (int i = 1; i <= steps; i++) {
                out.add(ProofStep.leaf(i, "TEST_" + kind, formula.render(), "test"));
            }
            return out;
        };
    }

    private StrategyDispatcher dispatcher(int maxComplexity) {
        Map<VerificationMethod.Kind, ProofStrategy> strategies = new EnumMap<>(VerificationMethod.Kind.class);
        strategies.put(VerificationMethod.Kind.DIRECT_PROOF, failing(VerificationMethod.Kind.DIRECT_PROOF));
        strategies.put(VerificationMethod.Kind.PROOF_BY_CONTRADICTION,
                succeeding(VerificationMethod.Kind.PROOF_BY_CONTRADICTION, 3));
        strategies.put(VerificationMethod.Kind.SMT_SOLVER_VERIFICATION,
                succeeding(VerificationMethod.Kind.SMT_SOLVER_VERIFICATION, 1));
        strategies.put(VerificationMethod.Kind.AUTOMATED_PROOF, (formula, deadline) -> {
            attempted.add(VerificationMethod.Kind.AUTOMATED_PROOF);
            throw new CollaboratorException("prover", "unreachable");
        });
        return new StrategyDispatcher(strategies, maxComplexity);
    }

    @Test
    void firstSuccessWinsInConfiguredOrder() throws Exception {
        StrategyDispatcher.Attempt attempt = dispatcher(1000).tryInOrder(GOAL, List.of(
                VerificationMethod.DIRECT_PROOF,
                VerificationMethod.AUTOMATED_PROOF,
                VerificationMethod.SMT_SOLVER_VERIFICATION,
                VerificationMethod.PROOF_BY_CONTRADICTION), Deadline.none());

        assertThat(attempt.method()).isEqualTo(VerificationMethod.SMT_SOLVER_VERIFICATION);
        assertThat(attempt.steps()).hasSize(1);
        assertThat(attempted).containsExactly(
                VerificationMethod.Kind.DIRECT_PROOF,
                VerificationMethod.Kind.AUTOMATED_PROOF,
                VerificationMethod.Kind.SMT_SOLVER_VERIFICATION);
    }

    @Test
    void hybridBehavesLikeItsMemberList() throws Exception {
        List<VerificationMethod> members = List.of(VerificationMethod.DIRECT_PROOF,
                VerificationMethod.PROOF_BY_CONTRADICTION, VerificationMethod.SMT_SOLVER_VERIFICATION);
        StrategyDispatcher dispatcher = dispatcher(1000);

        List<ProofStep> sequential = dispatcher.tryInOrder(GOAL, members, Deadline.none()).steps();
        List<VerificationMethod.Kind> sequentialOrder = new ArrayList<>(attempted);
        attempted.clear();
        List<ProofStep> hybrid = dispatcher.tryVerificationMethod(GOAL, VerificationMethod.hybrid(members),
                Deadline.none());

        assertThat(hybrid).isEqualTo(sequential);
        assertThat(attempted).isEqualTo(sequentialOrder);
    }

    @Test
    void topLevelHybridIsReportedAsTheWinningMethod() throws Exception {
        VerificationMethod hybrid = VerificationMethod.hybrid(VerificationMethod.DIRECT_PROOF,
                VerificationMethod.hybrid(VerificationMethod.AUTOMATED_PROOF, VerificationMethod.SMT_SOLVER_VERIFICATION));

        StrategyDispatcher.Attempt attempt = dispatcher(1000).tryInOrder(GOAL, List.of(hybrid), Deadline.none());

        assertThat(attempt.method()).isEqualTo(hybrid);
    }

    @Test
    void oversizedProofIsRejectedAndNextMethodTried() throws Exception {
        StrategyDispatcher.Attempt attempt = dispatcher(100).tryInOrder(GOAL, List.of(
                VerificationMethod.PROOF_BY_CONTRADICTION, VerificationMethod.SMT_SOLVER_VERIFICATION), Deadline.none());

        assertThat(attempt.method()).isEqualTo(VerificationMethod.SMT_SOLVER_VERIFICATION);
    }

    @Test
    void exhaustionCollectsEveryReason() {
        assertThatThrownBy(() -> dispatcher(1000).tryInOrder(GOAL, List.of(
                VerificationMethod.DIRECT_PROOF, VerificationMethod.AUTOMATED_PROOF), Deadline.none()))
                .isInstanceOf(VerificationException.class)
                .hasMessageStartingWith("All verification methods failed")
                .hasMessageContaining("DIRECT_PROOF: DIRECT_PROOF cannot prove Goal")
                .hasMessageContaining("AUTOMATED_PROOF: prover: unreachable");
    }

    @Test
    void expiredDeadlineStopsEveryAttempt() {
        assertThatThrownBy(() -> dispatcher(1000).tryInOrder(GOAL, List.of(VerificationMethod.SMT_SOLVER_VERIFICATION),
                Deadline.after(Duration.ZERO)))
                .isInstanceOf(VerificationException.class)
                .hasMessageContaining("proof timeout");
        assertThat(attempted).isEmpty();
    }

    @Test
    void unregisteredMethodFails() {
        StrategyDispatcher empty = new StrategyDispatcher(Map.of(), 1000);

        assertThatThrownBy(() -> empty.tryVerificationMethod(GOAL, VerificationMethod.DIRECT_PROOF, Deadline.none()))
                .isInstanceOf(VerificationException.class)
                .hasMessage("No strategy registered for DIRECT_PROOF");
    }

    @Test
    void standardDispatcherCoversEveryStrategy() throws Exception {
        DirectProofConstructor direct = new DirectProofConstructor(new ProofStepValidator(), 20);
        StrategyDispatcher dispatcher = StrategyDispatcher.standard(direct, new ContradictionProofConstructor(direct),
                new TruthTableSatisfiabilityBackend(20), new TautologyProver(20), 1000);
        PropertyFormula universal = PropertyFormula.of(
                new Universal(Quantifier.of("x"), Atomic.of("TypeSafe", Variable.of("x"))));
        PropertyFormula excludedMiddle = PropertyFormula.of(
                Disjunction.of(Atomic.of("P"), new Negation(Atomic.of("P"))));

        assertThat(dispatcher.tryVerificationMethod(universal, VerificationMethod.DIRECT_PROOF, Deadline.none()))
                .hasSize(3);
        assertThat(dispatcher.tryVerificationMethod(excludedMiddle, VerificationMethod.PROOF_BY_CONTRADICTION,
                Deadline.none())).hasSize(8);
        assertThat(dispatcher.tryVerificationMethod(excludedMiddle, VerificationMethod.SMT_SOLVER_VERIFICATION,
                Deadline.none())).singleElement().extracting(ProofStep::ruleName)
                .isEqualTo(ProofRules.SMT_VERIFICATION);
        assertThat(dispatcher.tryVerificationMethod(excludedMiddle, VerificationMethod.AUTOMATED_PROOF,
                Deadline.none())).singleElement().extracting(ProofStep::ruleName)
                .isEqualTo(ProofRules.AUTOMATED_PROOF);
        assertThatThrownBy(() -> dispatcher.tryVerificationMethod(PropertyFormula.of(Atomic.of("Q")),
                VerificationMethod.SMT_SOLVER_VERIFICATION, Deadline.none()))
                .hasMessage("SMT verification failed: negation of Q is satisfiable");
    }

    @Test
    void crashingBackendFallsThroughToNextMethod() throws Exception {
        SatisfiabilityBackend crashing = mock(SatisfiabilityBackend.class);
        when(crashing.checkFormula(any())).thenThrow(new IllegalStateException("solver crashed"));
        DirectProofConstructor direct = new DirectProofConstructor(new ProofStepValidator(), 20);
        StrategyDispatcher dispatcher = StrategyDispatcher.standard(direct, new ContradictionProofConstructor(direct),
                crashing, new TautologyProver(20), 1000);
        PropertyFormula typeSafe = PropertyFormula.of(
                new Universal(Quantifier.of("x"), Atomic.of("TypeSafe", Variable.of("x"))));

        StrategyDispatcher.Attempt attempt = dispatcher.tryInOrder(typeSafe,
                List.of(VerificationMethod.SMT_SOLVER_VERIFICATION, VerificationMethod.DIRECT_PROOF), Deadline.none());

        assertThat(attempt.method()).isEqualTo(VerificationMethod.DIRECT_PROOF);
        assertThatThrownBy(() -> dispatcher.tryVerificationMethod(typeSafe,
                VerificationMethod.SMT_SOLVER_VERIFICATION, Deadline.none()))
                .isInstanceOf(VerificationException.class)
                .hasMessageContaining("solver crashed")
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
