package io.github.drompincen.aigov.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ParticipantType {
    @JsonProperty("role") ROLE,
    @JsonProperty("human") HUMAN,
    @JsonProperty("external") EXTERNAL
}
