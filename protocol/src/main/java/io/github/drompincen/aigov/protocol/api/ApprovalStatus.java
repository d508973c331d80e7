package io.github.drompincen.aigov.protocol.api;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    DENIED,
    CONSUMED
}
