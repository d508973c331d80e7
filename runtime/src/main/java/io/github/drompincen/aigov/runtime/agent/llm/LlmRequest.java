package io.github.drompincen.aigov.runtime.agent.llm;

import io.github.drompincen.aigov.protocol.api.ToolSpec;

import java.util.List;

/**
 * @param model model override, or null for the configured default
 */
public record LlmRequest(
        String model,
        int maxTokens,
        String system,
        List<LlmMessage> messages,
        List<ToolSpec> tools
) {
    public LlmRequest {
        messages = messages != null ? List.copyOf(messages) : List.of();
        tools = tools != null ? List.copyOf(tools) : List.of();
    }
}
