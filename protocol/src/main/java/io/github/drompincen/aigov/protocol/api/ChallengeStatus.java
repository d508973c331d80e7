package io.github.drompincen.aigov.protocol.api;

public enum ChallengeStatus {
    PENDING,
    ACCEPTED,
    REJECTED,
    WITHDRAWN
}
