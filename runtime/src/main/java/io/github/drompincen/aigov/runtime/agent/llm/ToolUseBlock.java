package io.github.drompincen.aigov.runtime.agent.llm;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolUseBlock(String id, String name, JsonNode input) implements ContentBlock {}
