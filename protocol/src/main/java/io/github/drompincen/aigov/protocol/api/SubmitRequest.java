package io.github.drompincen.aigov.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record SubmitRequest(
        @JsonProperty("project_id") String projectId,
        String intent,
        Channel channel,
        String identity,
        Map<String, Object> payload
) {}
