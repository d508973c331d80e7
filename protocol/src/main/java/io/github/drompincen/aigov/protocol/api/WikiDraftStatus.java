package io.github.drompincen.aigov.protocol.api;

public enum WikiDraftStatus {
    PENDING,
    APPROVED,
    REJECTED
}
