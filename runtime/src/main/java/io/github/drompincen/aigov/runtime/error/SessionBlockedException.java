package io.github.drompincen.aigov.runtime.error;

import java.util.List;

public class SessionBlockedException extends GovernanceException {

    private final String sessionId;
    private final List<String> missingDecisions;

    public SessionBlockedException(String sessionId, List<String> missingDecisions) {
        super("Session " + sessionId + " cannot complete: no decision logged for " + String.join(", ", missingDecisions));
        this.sessionId = sessionId;
        this.missingDecisions = List.copyOf(missingDecisions);
    }

    public String getSessionId() { return sessionId; }
    public List<String> getMissingDecisions() { return missingDecisions; }
}
