package io.github.drompincen.aigov.protocol.api;

public enum SessionStatus {
    ACTIVE,
    COMPLETED,
    FAILED,
    BLOCKED
}
