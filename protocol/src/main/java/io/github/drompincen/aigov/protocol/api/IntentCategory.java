package io.github.drompincen.aigov.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum IntentCategory {
    @JsonProperty("triage") TRIAGE,
    @JsonProperty("governance") GOVERNANCE,
    @JsonProperty("review") REVIEW,
    @JsonProperty("development") DEVELOPMENT,
    @JsonProperty("maintenance") MAINTENANCE,
    @JsonProperty("unknown") UNKNOWN
}
