package io.github.drompincen.aigov.runtime.error;

/**
 * Root of the engine's domain failures. Recoverable failures never surface as exceptions; they are
 * returned to the model as tool results instead.
 */
public class GovernanceException extends RuntimeException {

    public GovernanceException(String message) {
        super(message);
    }

    public GovernanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
