package io.github.drompincen.aigov.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record GovernanceResponse(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("session_id") String sessionId,
        String role,
        @JsonProperty("trust_level") TrustLevel trustLevel,
        IntentCategory category,
        String response,
        List<String> warnings
) {}
