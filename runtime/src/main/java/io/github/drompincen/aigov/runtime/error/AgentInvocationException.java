package io.github.drompincen.aigov.runtime.error;

/**
 * Fatal failure of an agent invocation. The session has already been force-completed as failed
 * when this is thrown.
 */
public class AgentInvocationException extends GovernanceException {

    private final String sessionId;

    public AgentInvocationException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() { return sessionId; }
}
