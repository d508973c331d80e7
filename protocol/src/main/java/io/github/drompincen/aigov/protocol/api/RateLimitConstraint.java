package io.github.drompincen.aigov.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.List;

public record RateLimitConstraint(
        String description,
        Enforcement enforcement,
        Parameters parameters,
        @JsonProperty("on_actions") List<String> onActions
) implements Constraint {

    public static final String TYPE = "rate_limit";

    public RateLimitConstraint {
        onActions = onActions != null ? List.copyOf(onActions) : List.of();
    }

    public record Parameters(int limit, long windowMs) {}

    @Override
    public String type() { return TYPE; }

    public int limit() {
        return parameters != null ? parameters.limit() : 0;
    }

    public Duration window() {
        return Duration.ofMillis(parameters != null ? parameters.windowMs() : 0);
    }
}
