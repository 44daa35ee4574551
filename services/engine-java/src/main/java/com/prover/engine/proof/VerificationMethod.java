package com.prover.engine.proof;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A proof strategy tag. {@link Kind#HYBRID_VERIFICATION} carries an ordered list of member methods, which may
 * themselves be hybrid.
 */
public record VerificationMethod(Kind kind, List<VerificationMethod> members) {

    public enum Kind {
        DIRECT_PROOF,
        PROOF_BY_CONTRADICTION,
        SMT_SOLVER_VERIFICATION,
        AUTOMATED_PROOF,
        HYBRID_VERIFICATION
    }

    public static final VerificationMethod DIRECT_PROOF = new VerificationMethod(Kind.DIRECT_PROOF, List.of());
    public static final VerificationMethod PROOF_BY_CONTRADICTION =
            new VerificationMethod(Kind.PROOF_BY_CONTRADICTION, List.of());
    public static final VerificationMethod SMT_SOLVER_VERIFICATION =
            new VerificationMethod(Kind.SMT_SOLVER_VERIFICATION, List.of());
    public static final VerificationMethod AUTOMATED_PROOF = new VerificationMethod(Kind.AUTOMATED_PROOF, List.of());

    public VerificationMethod {
        Objects.requireNonNull(kind, "kind");
        members = List.copyOf(members);
        if (kind != Kind.HYBRID_VERIFICATION && !members.isEmpty()) {
            throw new IllegalArgumentException(kind + " takes no members");
        }
    }

    public static VerificationMethod hybrid(VerificationMethod... members) {
        return hybrid(List.of(members));
    }

    public static VerificationMethod hybrid(List<VerificationMethod> members) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("hybrid verification needs at least one member");
        }
        return new VerificationMethod(Kind.HYBRID_VERIFICATION, members);
    }

    public boolean isHybrid() {
        return kind == Kind.HYBRID_VERIFICATION;
    }

    /**
     * Parses a method expression such as {@code DIRECT_PROOF} or {@code HYBRID(PROOF_BY_CONTRADICTION, AUTOMATED_PROOF)}.
     * {@code HYBRID_VERIFICATION(...)} is accepted as a synonym of {@code HYBRID(...)}.
     */
    public static VerificationMethod parse(String expression) {
        Parser parser = new Parser(expression);
        VerificationMethod method = parser.method();
        parser.skipSpaces();
        if (!parser.atEnd()) {
            throw new IllegalArgumentException("unexpected input at " + parser.pos + " in '" + expression + "'");
        }
        return method;
    }

    @Override
    public String toString() {
        if (!isHybrid()) return kind.name();
        return "HYBRID(" + members.stream().map(VerificationMethod::toString).collect(Collectors.joining(",")) + ")";
    }

    private static final class Parser {
        private final String text;
        private int pos;

        Parser(String text) {
            this.text = Objects.requireNonNull(text, "expression");
        }

        VerificationMethod method() {
            skipSpaces();
            int start = pos;
            while (!atEnd() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) pos++;
            String name = text.substring(start, pos).toUpperCase();
            if (name.isEmpty()) {
                throw new IllegalArgumentException("expected a method name at " + start + " in '" + text + "'");
            }
            if (name.equals("HYBRID") || name.equals("HYBRID_VERIFICATION")) {
                expect('(');
                List<VerificationMethod> members = new ArrayList<>();
                members.add(method());
                skipSpaces();
                while (!atEnd() && text.charAt(pos) == ',') {
                    pos++;
                    members.add(method());
                    skipSpaces();
                }
                expect(')');
                return hybrid(members);
            }
            try {
                Kind kind = Kind.valueOf(name);
                return new VerificationMethod(kind, List.of());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unknown verification method '" + name + "'", e);
            }
        }

        void expect(char c) {
            skipSpaces();
            if (atEnd() || text.charAt(pos) != c) {
                throw new IllegalArgumentException("expected '" + c + "' at " + pos + " in '" + text + "'");
            }
            pos++;
        }

        void skipSpaces() {
            while (!atEnd() && Character.isWhitespace(text.charAt(pos))) pos++;
        }

        boolean atEnd() {
            return pos >= text.length();
        }
    }
}
