package io.github.drompincen.aigov.runtime.agent.llm;

import io.github.drompincen.aigov.protocol.api.ToolSpec;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * Advertises a tool to the model without executing it. Tool calls are returned to the agent loop,
 * which runs them through the policy hooks itself.
 */
class DefinitionOnlyToolCallback implements ToolCallback {

    private static final String EMPTY_SCHEMA = "{\"type\":\"object\",\"properties\":{}}";

    private final ToolDefinition definition;

    DefinitionOnlyToolCallback(ToolSpec spec) {
        this.definition = ToolDefinition.builder()
                .name(spec.name())
                .description(spec.description() != null ? spec.description() : spec.name())
                .inputSchema(spec.inputSchema() != null ? spec.inputSchema().toString() : EMPTY_SCHEMA)
                .build();
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return definition;
    }

    @Override
    public String call(String toolInput) {
        throw new IllegalStateException("Tool " + definition.name() + " is executed by the agent loop, not the model client");
    }
}
