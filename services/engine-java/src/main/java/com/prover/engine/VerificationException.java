package com.prover.engine;

/**
 * A proof could not be built or was rejected. The message carries the reason.
 */
public class VerificationException extends EngineException {

    public VerificationException(String reason) {
        super(reason);
    }

    public VerificationException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
