package io.github.drompincen.aigov.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Channel {
    @JsonProperty("github_webhook") GITHUB_WEBHOOK,
    @JsonProperty("public_api") PUBLIC_API,
    @JsonProperty("contributor_api") CONTRIBUTOR_API,
    @JsonProperty("admin_cli") ADMIN_CLI;

    public String wireName() {
        return name().toLowerCase();
    }

    public static Channel fromString(String value) {
        for (Channel channel : values()) {
            if (channel.name().equalsIgnoreCase(value)) return channel;
        }
        throw new IllegalArgumentException("Unknown channel: " + value);
    }
}
