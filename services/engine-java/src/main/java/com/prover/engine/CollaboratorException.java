package com.prover.engine;

/**
 * Raised by an external collaborator: invariant discovery, the satisfiability backend or the prover.
 */
public class CollaboratorException extends EngineException {

    private final String collaborator;

    public CollaboratorException(String collaborator, String message) {
        super(collaborator + ": " + message);
        this.collaborator = collaborator;
    }

    public CollaboratorException(String collaborator, String message, Throwable cause) {
        super(collaborator + ": " + message, cause);
        this.collaborator = collaborator;
    }

    public String collaborator() {
        return collaborator;
    }
}
