package io.github.drompincen.aigov.runtime.agent.llm;

import java.util.List;
import java.util.stream.Collectors;

public record LlmResponse(
        List<ContentBlock> content,
        StopReason stopReason,
        Usage usage,
        String model
) {
    public LlmResponse {
        content = content != null ? List.copyOf(content) : List.of();
        usage = usage != null ? usage : Usage.NONE;
    }

    public String text() {
        return content.stream()
                .filter(b -> b instanceof TextBlock)
                .map(b -> ((TextBlock) b).text())
                .collect(Collectors.joining("\n"));
    }

    public List<ToolUseBlock> toolUses() {
        return content.stream()
                .filter(b -> b instanceof ToolUseBlock)
                .map(b -> (ToolUseBlock) b)
                .collect(Collectors.toList());
    }
}
