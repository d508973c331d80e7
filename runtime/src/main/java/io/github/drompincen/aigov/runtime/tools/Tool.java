package io.github.drompincen.aigov.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An in-process governance tool handler. Implementations are discovered through
 * {@link java.util.ServiceLoader} and receive Spring beans through single-argument setters.
 */
public interface Tool {

    String name();

    String description();

    JsonNode inputSchema();

    ToolResult execute(ToolContext ctx, JsonNode input);
}
