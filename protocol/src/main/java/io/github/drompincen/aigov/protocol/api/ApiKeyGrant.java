package io.github.drompincen.aigov.protocol.api;

public record ApiKeyGrant(String name, TrustLevel trust) {}
