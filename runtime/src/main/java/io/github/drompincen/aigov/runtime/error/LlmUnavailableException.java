package io.github.drompincen.aigov.runtime.error;

public class LlmUnavailableException extends GovernanceException {

    public LlmUnavailableException(String message) {
        super(message);
    }

    public LlmUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
