package com.prover.engine.invariant;

import com.prover.engine.CollaboratorException;
import com.prover.engine.logic.PropertyFormula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Discovery over the invariants a document declares explicitly.
 *
 * <p>Declarations below {@code minConfidence} are dropped. A malformed declaration fails the whole document.
 */
public class DeclaredInvariantDiscovery implements InvariantDiscovery {

    private static final Logger log = LoggerFactory.getLogger(DeclaredInvariantDiscovery.class);
    private static final String NAME = "discovery";

    private final double minConfidence;

    public DeclaredInvariantDiscovery(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    @Override
    public List<DiscoveredInvariant> discoverInvariants(SpecDocument document) throws CollaboratorException {
        List<DiscoveredInvariant> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (InvariantDeclaration declaration : document.declarations()) {
            String id = declaration.id();
            if (id == null || id.isBlank()) {
                throw new CollaboratorException(NAME, "invariant without id in document " + document.docId());
            }
            if (!seen.add(id)) {
                throw new CollaboratorException(NAME, "duplicate invariant id " + id);
            }
            if (declaration.formula() == null) {
                throw new CollaboratorException(NAME, "invariant " + id + " has no formula");
            }
            double confidence = declaration.confidence();
            if (!(confidence >= 0.0 && confidence <= 1.0)) {
                throw new CollaboratorException(NAME, "invariant " + id + " has confidence " + confidence
                        + " outside [0,1]");
            }
            if (confidence < minConfidence) {
                log.debug("Dropping invariant {} with confidence {} below {}", id, confidence, minConfidence);
                continue;
            }
            InvariantType type = declaration.type() == null ? InvariantType.LOGICAL_INVARIANT : declaration.type();
            out.add(new DiscoveredInvariant(id, declaration.name(), PropertyFormula.of(declaration.formula()),
                    confidence, type));
        }
        log.debug("Discovered {} invariants in document {}", out.size(), document.docId());
        return out;
    }
}
