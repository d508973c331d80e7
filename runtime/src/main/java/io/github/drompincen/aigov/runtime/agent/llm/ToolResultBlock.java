package io.github.drompincen.aigov.runtime.agent.llm;

public record ToolResultBlock(String toolUseId, String toolName, String content, boolean isError) implements ContentBlock {}
