package io.github.drompincen.aigov.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Ordered trust tiers. Declaration order is the access order:
 * {@code ANONYMOUS < CONTRIBUTOR < AUTHORIZED < ELEVATED}.
 */
public enum TrustLevel {
    @JsonProperty("anonymous") ANONYMOUS,
    @JsonProperty("contributor") CONTRIBUTOR,
    @JsonProperty("authorized") AUTHORIZED,
    @JsonProperty("elevated") ELEVATED;

    public boolean isAtLeast(TrustLevel other) {
        return compareTo(other) >= 0;
    }

    public boolean isBelow(TrustLevel other) {
        return compareTo(other) < 0;
    }

    public static TrustLevel lower(TrustLevel a, TrustLevel b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public String wireName() {
        return name().toLowerCase();
    }

    public static TrustLevel fromString(String value) {
        for (TrustLevel level : values()) {
            if (level.name().equalsIgnoreCase(value)) return level;
        }
        throw new IllegalArgumentException("Unknown trust level: " + value);
    }
}
