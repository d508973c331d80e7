package io.github.drompincen.aigov.runtime.agent;

import io.github.drompincen.aigov.protocol.api.SessionStatus;

import java.util.List;

public record AgentResponse(
        String sessionId,
        String text,
        SessionStatus status,
        List<String> warnings
) {
    public AgentResponse {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
