package io.github.drompincen.aigov.runtime.trust;

import io.github.drompincen.aigov.protocol.api.TrustLevel;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Trust levels resolved from live permission lookups, keyed by (project, identity) and kept for a
 * fixed TTL. Racing writers are harmless: the worst case is a stale read inside the TTL.
 */
public class PermissionCache {

    private final Clock clock;
    private final Duration ttl;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public PermissionCache(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    public Optional<TrustLevel> get(String projectId, String identity) {
        String key = key(projectId, identity);
        Entry entry = entries.get(key);
        if (entry == null) return Optional.empty();
        if (!entry.expiresAt().isAfter(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.trust());
    }

    public void put(String projectId, String identity, TrustLevel trust) {
        entries.put(key(projectId, identity), new Entry(trust, clock.instant().plus(ttl)));
    }

    public void clear() {
        entries.clear();
    }

    private static String key(String projectId, String identity) {
        return projectId + ":" + identity;
    }

    private record Entry(TrustLevel trust, Instant expiresAt) {}
}
