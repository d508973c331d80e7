package io.github.drompincen.aigov.protocol.api;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * An inbound request for governance work. Immutable; {@link #withTrust(TrustLevel)} returns the
 * refined copy produced by trust classification.
 */
public record GovernanceRequest(
        String id,
        Instant timestamp,
        TrustLevel trust,
        RequestSource source,
        String project,
        String intent,
        Map<String, Object> payload
) {
    public GovernanceRequest {
        payload = payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
                : Map.of();
    }

    public static GovernanceRequest create(RequestSource source, String project, String intent,
                                           Map<String, Object> payload) {
        return new GovernanceRequest(UUID.randomUUID().toString(), Instant.now(),
                TrustLevel.ANONYMOUS, source, project, intent, payload);
    }

    public GovernanceRequest withTrust(TrustLevel trust) {
        return new GovernanceRequest(id, timestamp, trust, source, project, intent, payload);
    }
}
