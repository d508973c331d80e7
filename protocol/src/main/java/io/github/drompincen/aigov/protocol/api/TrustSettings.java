package io.github.drompincen.aigov.protocol.api;

import java.util.List;
import java.util.Map;

/**
 * Per-project trust overrides: host-repository permission tiers mapped to trust levels, and
 * named API keys with their granted trust.
 */
public record TrustSettings(
        Map<String, TrustLevel> githubRoles,
        List<ApiKeyGrant> apiKeys
) {
    public TrustSettings {
        githubRoles = githubRoles != null ? Map.copyOf(githubRoles) : Map.of();
        apiKeys = apiKeys != null ? List.copyOf(apiKeys) : List.of();
    }

    public static TrustSettings defaults() {
        return new TrustSettings(Map.of(), List.of());
    }
}
