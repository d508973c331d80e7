package io.github.drompincen.aigov.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TrustLevelConstraint(
        String description,
        Enforcement enforcement,
        Parameters parameters,
        @JsonProperty("on_actions") List<String> onActions
) implements Constraint {

    public static final String TYPE = "trust_level";

    public TrustLevelConstraint {
        onActions = onActions != null ? List.copyOf(onActions) : List.of();
    }

    public record Parameters(TrustLevel minTrust) {}

    @Override
    public String type() { return TYPE; }

    public TrustLevel minTrust() {
        return parameters != null && parameters.minTrust() != null ? parameters.minTrust() : TrustLevel.ANONYMOUS;
    }
}
