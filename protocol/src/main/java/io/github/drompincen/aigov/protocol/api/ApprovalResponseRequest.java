package io.github.drompincen.aigov.protocol.api;

public record ApprovalResponseRequest(boolean granted, String respondedBy) {}
