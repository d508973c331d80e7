package io.github.drompincen.aigov.protocol.api;

import java.util.Map;

public record RequestSource(
        Channel channel,
        String identity,
        Map<String, Object> metadata
) {
    public RequestSource {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static RequestSource of(Channel channel, String identity) {
        return new RequestSource(channel, identity, Map.of());
    }

    public boolean hasIdentity() {
        return identity != null && !identity.isBlank();
    }

    /** Actor name used in audit entries. */
    public String actor() {
        return hasIdentity() ? identity : "anonymous";
    }
}
