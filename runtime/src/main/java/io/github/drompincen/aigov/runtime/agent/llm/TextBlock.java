package io.github.drompincen.aigov.runtime.agent.llm;

public record TextBlock(String text) implements ContentBlock {}
