package io.github.drompincen.aigov.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Enforcement {
    /** Violations block the tool call. */
    @JsonProperty("hard") HARD,
    /** Advisory only; surfaced to the agent, never evaluated for blocking. */
    @JsonProperty("soft") SOFT
}
