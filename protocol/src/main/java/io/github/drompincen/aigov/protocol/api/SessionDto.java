package io.github.drompincen.aigov.protocol.api;

import java.time.Instant;
import java.util.List;

public record SessionDto(
        String sessionId,
        String projectId,
        String role,
        String requestId,
        TrustLevel trust,
        String intent,
        SessionStatus status,
        Instant startedAt,
        Instant endedAt,
        int toolUseCount,
        List<String> decisionsLogged,
        List<String> escalations,
        int depth,
        String parentSessionId
) {}
