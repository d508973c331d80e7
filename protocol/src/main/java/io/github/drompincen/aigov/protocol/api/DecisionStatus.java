package io.github.drompincen.aigov.protocol.api;

public enum DecisionStatus {
    ADOPTED,
    SUPERSEDED,
    REVERSED
}
