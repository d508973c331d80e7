package io.github.drompincen.aigov.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A tool as advertised to the LLM.
 */
public record ToolSpec(
        String name,
        String description,
        JsonNode inputSchema
) {}
