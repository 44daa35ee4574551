package com.prover.engine.grpc;

import com.prover.engine.invariant.DiscoveredInvariant;
import com.prover.engine.invariant.InvariantDeclaration;
import com.prover.engine.invariant.InvariantType;
import com.prover.engine.invariant.SpecDocument;
import com.prover.engine.logic.Atomic;
import com.prover.engine.logic.Conjunction;
import com.prover.engine.logic.Constant;
import com.prover.engine.logic.Disjunction;
import com.prover.engine.logic.Existential;
import com.prover.engine.logic.Formula;
import com.prover.engine.logic.Function;
import com.prover.engine.logic.Implication;
import com.prover.engine.logic.Negation;
import com.prover.engine.logic.PropertyFormula;
import com.prover.engine.logic.Quantifier;
import com.prover.engine.logic.Term;
import com.prover.engine.logic.Universal;
import com.prover.engine.logic.Variable;
import com.prover.engine.proof.FormalProof;
import com.prover.engine.proof.ProofStep;
import com.prover.engine.service.ConsistencyStatus;
import com.prover.engine.service.ConsistencyVerificationResult;
import com.prover.engine.service.InvariantInteraction;
import com.prover.engine.service.VerificationFailure;
import com.prover.engine.service.VerificationResult;
import com.prover.engine.service.VerificationStatistics;
import com.prover.engine.service.VerificationStatus;
import com.prover.engine.service.VerifiedInvariant;
import com.prover.grpc.AtomicFormula;
import com.prover.grpc.ConsistencyReply;
import com.prover.grpc.ConsistencyVerdict;
import com.prover.grpc.Document;
import com.prover.grpc.FailureEntry;
import com.prover.grpc.FormulaNode;
import com.prover.grpc.Interaction;
import com.prover.grpc.InvariantSpec;
import com.prover.grpc.Proof;
import com.prover.grpc.QuantifiedFormula;
import com.prover.grpc.Statistics;
import com.prover.grpc.Status;
import com.prover.grpc.Step;
import com.prover.grpc.TermNode;
import com.prover.grpc.VerificationReport;
import com.prover.grpc.VerifiedEntry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts between wire messages and the engine model. Malformed input raises {@link IllegalArgumentException}.
 */
public final class ProtoMapper {

    private ProtoMapper() {
    }

    public static Term toTerm(TermNode node) {
        switch (node.getKindCase()) {
            case VARIABLE:
                return new Variable(node.getVariable().getName(), emptyToNull(node.getVariable().getType()));
            case CONSTANT:
                return new Constant(node.getConstant().getValue(), node.getConstant().getType());
            case FUNCTION:
                List<Term> args = new ArrayList<>();
                node.getFunction().getArgsList().forEach(arg -> args.add(toTerm(arg)));
                return new Function(node.getFunction().getName(), args);
            default:
                throw new IllegalArgumentException("term without a kind");
        }
    }

    public static Formula toFormula(FormulaNode node) {
        switch (node.getShapeCase()) {
            case UNIVERSAL:
                return new Universal(quantifier(node.getUniversal()), toFormula(node.getUniversal().getBody()));
            case EXISTENTIAL:
                return new Existential(quantifier(node.getExistential()), toFormula(node.getExistential().getBody()));
            case IMPLICATION:
                return new Implication(toFormula(node.getImplication().getAntecedent()),
                        toFormula(node.getImplication().getConsequent()));
            case CONJUNCTION:
                return new Conjunction(toFormulas(node.getConjunction().getPartsList()));
            case DISJUNCTION:
                return new Disjunction(toFormulas(node.getDisjunction().getPartsList()));
            case NEGATION:
                return new Negation(toFormula(node.getNegation()));
            case ATOMIC:
                return toAtomic(node.getAtomic());
            default:
                throw new IllegalArgumentException("formula without a shape");
        }
    }

    private static Quantifier quantifier(QuantifiedFormula quantified) {
        if (quantified.getVariable().isEmpty()) {
            throw new IllegalArgumentException("quantifier without a variable");
        }
        return new Quantifier(quantified.getVariable(), emptyToNull(quantified.getType()));
    }

    private static List<Formula> toFormulas(List<FormulaNode> nodes) {
        List<Formula> formulas = new ArrayList<>(nodes.size());
        nodes.forEach(n -> formulas.add(toFormula(n)));
        return formulas;
    }

    private static Atomic toAtomic(AtomicFormula atomic) {
        if (atomic.getPredicate().isEmpty()) {
            throw new IllegalArgumentException("atomic formula without a predicate");
        }
        List<Term> terms = new ArrayList<>();
        atomic.getTermsList().forEach(t -> terms.add(toTerm(t)));
        return new Atomic(atomic.getPredicate(), terms, null);
    }

    public static SpecDocument toDocument(Document document) {
        List<InvariantDeclaration> declarations = new ArrayList<>();
        for (InvariantSpec spec : document.getInvariantsList()) {
            declarations.add(new InvariantDeclaration(spec.getId(), emptyToNull(spec.getName()),
                    spec.hasFormula() ? toFormula(spec.getFormula()) : null, spec.getConfidence(),
                    invariantType(spec.getType())));
        }
        return new SpecDocument(document.getDocId(), document.getTitle(), declarations);
    }

    public static DiscoveredInvariant toInvariant(InvariantSpec spec) {
        if (!spec.hasFormula()) {
            throw new IllegalArgumentException("invariant " + spec.getId() + " has no formula");
        }
        InvariantType type = invariantType(spec.getType());
        return new DiscoveredInvariant(spec.getId(), emptyToNull(spec.getName()),
                PropertyFormula.of(toFormula(spec.getFormula())), spec.getConfidence(),
                type == null ? InvariantType.LOGICAL_INVARIANT : type);
    }

    private static InvariantType invariantType(String name) {
        return name.isEmpty() ? null : InvariantType.valueOf(name);
    }

    public static Proof toProof(FormalProof proof) {
        Proof.Builder builder = Proof.newBuilder()
                .setId(proof.id())
                .setStatement(proof.statement().render())
                .setMethod(proof.method().toString())
                .setGenerationTimeMicros(micros(proof.generationTime()))
                .setSizeEstimate(proof.complexity().sizeEstimate())
                .setComplexityRating(proof.complexity().complexityRating());
        for (ProofStep step : proof.steps()) {
            builder.addSteps(Step.newBuilder()
                    .setStepNumber(step.stepNumber())
                    .setRuleName(step.ruleName())
                    .addAllPremises(step.premises())
                    .setConclusion(step.conclusion())
                    .setJustification(step.justification())
                    .addAllDependencies(step.dependencies()));
        }
        return builder.build();
    }

    public static VerificationReport toReport(VerificationResult result) {
        VerificationReport.Builder builder = VerificationReport.newBuilder();
        List<VerificationFailure> failures = List.of();
        VerificationStatus status = result.status();
        if (status instanceof VerificationStatus.Verified) {
            builder.setStatus(Status.VERIFIED)
                    .setVerifiedCount(result.verifiedInvariants().size())
                    .setTotalCount(result.verifiedInvariants().size());
        } else if (status instanceof VerificationStatus.PartiallyVerified partial) {
            builder.setStatus(Status.PARTIALLY_VERIFIED)
                    .setVerifiedCount(partial.verifiedCount())
                    .setTotalCount(partial.totalCount());
            failures = partial.failures();
        } else if (status instanceof VerificationStatus.Failed failed) {
            builder.setStatus(Status.FAILED).setTotalCount(failed.failures().size());
            failures = failed.failures();
        }

        for (VerifiedInvariant verified : result.verifiedInvariants()) {
            builder.addVerifiedInvariants(VerifiedEntry.newBuilder()
                    .setInvariantId(verified.invariant().id())
                    .setProofId(verified.proof().id())
                    .setConfidence(verified.verificationConfidence())
                    .setMethod(verified.verificationMethod().toString())
                    .setVerificationTimeMicros(micros(verified.verificationTime())));
        }
        for (VerificationFailure failure : failures) {
            builder.addFailures(FailureEntry.newBuilder()
                    .setInvariantId(failure.invariantId())
                    .setReason(failure.reason())
                    .addAllDiagnostics(failure.diagnostics())
                    .addAllSuggestions(failure.suggestions()));
        }
        result.proofs().forEach(p -> builder.addProofs(toProof(p)));
        result.satisfiabilityModel().ifPresent(m -> builder.putAllModel(m.predicateInterpretations()));

        VerificationStatistics stats = result.statistics();
        builder.setStatistics(Statistics.newBuilder()
                .setTotalTimeMicros(micros(stats.totalTime()))
                .setInvariantsProcessed(stats.invariantsProcessed())
                .setInvariantsVerified(stats.invariantsVerified())
                .setProofsGenerated(stats.proofsGenerated())
                .setAverageProofTimeMicros(micros(stats.averageProofTime()))
                .setPeakHeapBytes(stats.memoryUsage().peakHeapBytes())
                .setSolverCalls(stats.solverStats().solverCalls())
                .setSolverTimeMicros(micros(stats.solverStats().solverTime()))
                .setSolverUnknownResults(stats.solverStats().unknownResults())
                .putAllMethodDistribution(stats.methodDistribution()));
        return builder.addAllWarnings(result.warnings()).build();
    }

    public static ConsistencyReply toReply(ConsistencyVerificationResult result) {
        ConsistencyReply.Builder builder = ConsistencyReply.newBuilder();
        ConsistencyStatus status = result.status();
        if (status instanceof ConsistencyStatus.Consistent) {
            builder.setVerdict(ConsistencyVerdict.CONSISTENT);
        } else if (status instanceof ConsistencyStatus.Inconsistent inconsistent) {
            builder.setVerdict(ConsistencyVerdict.INCONSISTENT)
                    .addAllConflictingConstraints(inconsistent.conflictingConstraints());
        } else if (status instanceof ConsistencyStatus.Unknown unknown) {
            builder.setVerdict(ConsistencyVerdict.UNDETERMINED).setReason(unknown.reason());
        }
        if (result.model() != null) {
            builder.putAllModel(result.model().predicateInterpretations());
        }
        for (InvariantInteraction interaction : result.interactions()) {
            builder.addInteractions(Interaction.newBuilder()
                    .setFirstId(interaction.firstId())
                    .setSecondId(interaction.secondId())
                    .setType(interaction.type().name())
                    .setStrength(interaction.strength()));
        }
        result.proof().ifPresent(p -> builder.setProof(toProof(p)));
        return builder.build();
    }

    private static long micros(Duration duration) {
        return duration.toNanos() / 1_000;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
