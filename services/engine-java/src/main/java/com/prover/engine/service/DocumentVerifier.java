package com.prover.engine.service;

import com.prover.engine.CollaboratorException;
import com.prover.engine.EngineException;
import com.prover.engine.VerificationException;
import com.prover.engine.config.VerificationSettings;
import com.prover.engine.invariant.DiscoveredInvariant;
import com.prover.engine.invariant.InvariantDiscovery;
import com.prover.engine.invariant.SpecDocument;
import com.prover.engine.logic.Conjunction;
import com.prover.engine.logic.Formula;
import com.prover.engine.logic.Negation;
import com.prover.engine.logic.PropertyFormula;
import com.prover.engine.proof.Deadline;
import com.prover.engine.proof.FormalProof;
import com.prover.engine.proof.ProofRules;
import com.prover.engine.proof.ProofStep;
import com.prover.engine.proof.VerificationMethod;
import com.prover.engine.solver.ConstraintModel;
import com.prover.engine.solver.SatisfiabilityBackend;
import com.prover.engine.solver.SatisfiabilityResult;
import com.prover.engine.solver.SmtSolverStats;
import com.prover.engine.solver.SolverStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Batch entry point: discovery, a global consistency check, then one proof attempt per invariant.
 *
 * <p>Per-invariant failures become {@link VerificationFailure} records and never abort the batch. Discovery
 * errors always abort; consistency-check errors abort unless the settings allow degrading them to a warning.
 * Timeouts and the memory budget are cooperative and only checked between invariants.
 */
public class DocumentVerifier implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DocumentVerifier.class);

    private final InvariantDiscovery discovery;
    private final SatisfiabilityBackend backend;
    private final PropertyVerifier propertyVerifier;
    private final SolverStatistics solverStatistics;
    private final MemorySampler memorySampler;
    private final VerificationSettings settings;
    private final InvariantInteractionAnalyzer interactionAnalyzer = new InvariantInteractionAnalyzer();
    private final ExecutorService workers;

    public DocumentVerifier(InvariantDiscovery discovery,
                            SatisfiabilityBackend backend,
                            PropertyVerifier propertyVerifier,
                            SolverStatistics solverStatistics,
                            MemorySampler memorySampler,
                            VerificationSettings settings) {
        this.discovery = discovery;
        this.backend = backend;
        this.propertyVerifier = propertyVerifier;
        this.solverStatistics = solverStatistics;
        this.memorySampler = memorySampler;
        this.settings = settings;
        this.workers = settings.parallelVerification() ? newWorkerPool(settings.workerThreads()) : null;
    }

    private static ExecutorService newWorkerPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "proof-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public VerificationResult verifyDocument(SpecDocument document) throws EngineException {
        long start = System.nanoTime();
        SmtSolverStats solverBefore = solverStatistics.snapshot();
        MemorySampler.Session memory = memorySampler.start();

        List<DiscoveredInvariant> invariants = discovery.discoverInvariants(document);
        log.info("Verifying document {} with {} invariants", document.docId(), invariants.size());

        List<String> warnings = new ArrayList<>();
        ConstraintModel model = checkGlobalConsistency(invariants, warnings);

        List<Outcome> outcomes = settings.parallelVerification()
                ? verifyParallel(invariants, warnings, memory)
                : verifySequential(invariants, warnings, memory);

        VerificationResult result = compile(outcomes, model, warnings, Duration.ofNanos(System.nanoTime() - start),
                solverStatistics.snapshot().minus(solverBefore), memory.stats(settings.maxMemoryUsage()));
        log.info("Document {} finished: {} ({} of {} invariants verified)", document.docId(),
                result.status().getClass().getSimpleName(), result.statistics().invariantsVerified(),
                invariants.size());
        return result;
    }

    private ConstraintModel checkGlobalConsistency(List<DiscoveredInvariant> invariants, List<String> warnings)
            throws CollaboratorException {
        SatisfiabilityResult consistency;
        try {
            consistency = backend.checkInvariants(invariants);
        } catch (CollaboratorException e) {
            if (!settings.degradeOnConsistencyError()) {
                throw e;
            }
            log.warn("Global consistency check failed, continuing without it: {}", e.getMessage());
            warnings.add("Global consistency check failed: " + e.getMessage());
            return null;
        }
        if (consistency instanceof SatisfiabilityResult.Satisfiable satisfiable) {
            return satisfiable.model();
        }
        if (consistency instanceof SatisfiabilityResult.Unsatisfiable unsatisfiable) {
            warnings.add("Invariants are mutually inconsistent: "
                    + String.join(", ", unsatisfiable.proof().conflictingConstraints()));
        } else if (consistency instanceof SatisfiabilityResult.Unknown unknown) {
            warnings.add("Global consistency check inconclusive: " + unknown.reason());
        }
        return null;
    }

    private List<Outcome> verifySequential(List<DiscoveredInvariant> invariants, List<String> warnings,
                                           MemorySampler.Session memory) {
        List<Outcome> outcomes = new ArrayList<>();
        Duration elapsed = Duration.ZERO;
        for (int i = 0; i < invariants.size(); i++) {
            Outcome outcome = verifyInvariant(invariants.get(i));
            outcomes.add(outcome);
            elapsed = elapsed.plus(outcome.elapsed());

            int remaining = invariants.size() - i - 1;
            if (remaining == 0) {
                break;
            }
            if (elapsed.compareTo(settings.totalTimeout()) > 0) {
                skipped(warnings, remaining, "total timeout of " + settings.totalTimeout().toMillis() + "ms exceeded");
                break;
            }
            if (memoryExceeded(memory)) {
                skipped(warnings, remaining, "memory budget of " + settings.maxMemoryUsage() + " bytes exceeded");
                break;
            }
        }
        return outcomes;
    }

    private List<Outcome> verifyParallel(List<DiscoveredInvariant> invariants, List<String> warnings,
                                         MemorySampler.Session memory) throws VerificationException {
        Deadline batchDeadline = Deadline.after(settings.totalTimeout());
        List<Future<Outcome>> futures = new ArrayList<>();
        for (DiscoveredInvariant invariant : invariants) {
            futures.add(workers.submit(() -> {
                if (batchDeadline.expired() || memoryExceeded(memory)) {
                    return null;
                }
                return verifyInvariant(invariant);
            }));
        }

        List<Outcome> outcomes = new ArrayList<>();
        int skipped = 0;
        for (int i = 0; i < futures.size(); i++) {
            try {
                Outcome outcome = futures.get(i).get();
                if (outcome == null) {
                    skipped++;
                } else {
                    outcomes.add(outcome);
                }
            } catch (ExecutionException e) {
                DiscoveredInvariant invariant = invariants.get(i);
                log.warn("Worker failed on invariant {}", invariant.id(), e.getCause());
                outcomes.add(Outcome.failed(invariant,
                        VerificationFailure.of(invariant, "Unexpected error: " + e.getCause()), Duration.ZERO));
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new VerificationException("Document verification interrupted", e);
            }
        }
        if (skipped > 0) {
            skipped(warnings, skipped, batchDeadline.expired()
                    ? "total timeout of " + settings.totalTimeout().toMillis() + "ms exceeded"
                    : "memory budget of " + settings.maxMemoryUsage() + " bytes exceeded");
        }
        return outcomes;
    }

    private Outcome verifyInvariant(DiscoveredInvariant invariant) {
        long start = System.nanoTime();
        try {
            FormalProof proof = propertyVerifier.verifyProperty(invariant.formula());
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            if (invariant.confidence() < settings.proofConfidenceThreshold()) {
                String reason = String.format(Locale.ROOT, "Confidence %.2f is below the acceptance threshold %.2f",
                        invariant.confidence(), settings.proofConfidenceThreshold());
                log.warn("Rejected proof of {}: {}", invariant.id(), reason);
                return new Outcome(invariant, null, VerificationFailure.of(invariant, reason), proof, elapsed);
            }
            VerifiedInvariant verified = new VerifiedInvariant(invariant, proof, invariant.confidence(),
                    proof.method(), elapsed);
            return new Outcome(invariant, verified, null, proof, elapsed);
        } catch (VerificationException e) {
            log.debug("Invariant {} not verified: {}", invariant.id(), e.getMessage());
            return Outcome.failed(invariant, VerificationFailure.of(invariant, e.getMessage()),
                    Duration.ofNanos(System.nanoTime() - start));
        } catch (RuntimeException e) {
            log.warn("Unexpected error verifying invariant {}", invariant.id(), e);
            return Outcome.failed(invariant, VerificationFailure.of(invariant, "Unexpected error: " + e),
                    Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private boolean memoryExceeded(MemorySampler.Session memory) {
        return memory.sample() > settings.maxMemoryUsage();
    }

    private static void skipped(List<String> warnings, int count, String reason) {
        log.warn("Skipping {} remaining invariants: {}", count, reason);
        warnings.add("Skipped " + count + " invariants: " + reason);
    }

    private VerificationResult compile(List<Outcome> outcomes, ConstraintModel model, List<String> warnings,
                                       Duration totalTime, SmtSolverStats solverStats, MemoryUsageStats memoryUsage) {
        List<VerifiedInvariant> verified = new ArrayList<>();
        List<VerificationFailure> failures = new ArrayList<>();
        List<FormalProof> proofs = new ArrayList<>();
        Map<String, Integer> distribution = new TreeMap<>();
        Duration verifiedTime = Duration.ZERO;
        for (Outcome outcome : outcomes) {
            if (outcome.proof() != null) {
                proofs.add(outcome.proof());
            }
            if (outcome.verified() != null) {
                verified.add(outcome.verified());
                distribution.merge(outcome.verified().verificationMethod().toString(), 1, Integer::sum);
                verifiedTime = verifiedTime.plus(outcome.elapsed());
            } else {
                failures.add(outcome.failure());
            }
        }
        Duration average = verified.isEmpty() ? Duration.ZERO : verifiedTime.dividedBy(verified.size());
        VerificationStatistics statistics = new VerificationStatistics(totalTime, outcomes.size(), verified.size(),
                proofs.size(), average, memoryUsage, solverStats, distribution);
        return new VerificationResult(VerificationStatus.of(verified.size(), failures), verified, proofs, model,
                statistics, warnings);
    }

    /**
     * Checks a set of invariants for joint satisfiability, independent of any per-invariant proof.
     */
    public ConsistencyVerificationResult verifyConsistency(List<DiscoveredInvariant> invariants)
            throws CollaboratorException {
        SatisfiabilityResult result = backend.checkInvariants(invariants);
        if (result instanceof SatisfiabilityResult.Satisfiable satisfiable) {
            return new ConsistencyVerificationResult(new ConsistencyStatus.Consistent(),
                    interactionAnalyzer.analyze(invariants), satisfiable.model(), null);
        }
        if (result instanceof SatisfiabilityResult.Unsatisfiable unsatisfiable) {
            List<String> conflicting = unsatisfiable.proof().conflictingConstraints();
            return new ConsistencyVerificationResult(new ConsistencyStatus.Inconsistent(conflicting),
                    interactionAnalyzer.analyze(invariants), null, inconsistencyProof(invariants, conflicting));
        }
        SatisfiabilityResult.Unknown unknown = (SatisfiabilityResult.Unknown) result;
        return new ConsistencyVerificationResult(new ConsistencyStatus.Unknown(unknown.reason()), List.of(), null,
                null);
    }

    private FormalProof inconsistencyProof(List<DiscoveredInvariant> invariants, List<String> conflicting) {
        long start = System.nanoTime();
        List<ProofStep> steps = new ArrayList<>();
        for (String constraint : conflicting) {
            steps.add(ProofStep.leaf(steps.size() + 1, ProofRules.PREMISE, constraint, "Invariant under check"));
        }
        Set<Integer> all = new LinkedHashSet<>();
        for (ProofStep step : steps) {
            all.add(step.stepNumber());
        }
        steps.add(new ProofStep(steps.size() + 1, ProofRules.INCONSISTENCY_DETECTION, conflicting, "⊥",
                "Satisfiability backend found no model of the premises", all));

        List<Formula> parts = new ArrayList<>();
        for (DiscoveredInvariant invariant : invariants) {
            if (conflicting.stream().anyMatch(c -> c.startsWith(invariant.id() + ": "))) {
                parts.add(invariant.formula().structure());
            }
        }
        if (parts.isEmpty()) {
            invariants.forEach(inv -> parts.add(inv.formula().structure()));
        }
        Formula statement = new Negation(parts.size() == 1 ? parts.get(0) : new Conjunction(parts));
        return propertyVerifier.finalizeProof(PropertyFormula.of(statement), steps,
                Duration.ofNanos(System.nanoTime() - start), VerificationMethod.PROOF_BY_CONTRADICTION);
    }

    @Override
    public void close() {
        if (workers == null) {
            return;
        }
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Proof workers did not terminate");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record Outcome(DiscoveredInvariant invariant, VerifiedInvariant verified, VerificationFailure failure,
                           FormalProof proof, Duration elapsed) {

        static Outcome failed(DiscoveredInvariant invariant, VerificationFailure failure, Duration elapsed) {
            return new Outcome(invariant, null, failure, null, elapsed);
        }
    }
}
