package io.github.drompincen.aigov.runtime.audit;

public enum AuditEventType {
    TOOL_USE_ATTEMPT,
    TOOL_USE_BLOCKED,
    TOOL_USE_COMPLETED,
    DECISION_LOGGED,
    SESSION_STARTED,
    SESSION_COMPLETED,
    SESSION_COMPLETION_BLOCKED,
    SESSION_FORCE_COMPLETED,
    CONVERSATION_DEPTH_EXCEEDED;

    public String wireName() {
        return name().toLowerCase();
    }
}
