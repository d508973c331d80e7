package io.github.drompincen.aigov.protocol.api;

public enum ConversationStatus {
    ACTIVE,
    RESOLVED,
    STALE
}
