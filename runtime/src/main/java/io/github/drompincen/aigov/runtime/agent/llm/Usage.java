package io.github.drompincen.aigov.runtime.agent.llm;

public record Usage(int inputTokens, int outputTokens) {

    public static final Usage NONE = new Usage(0, 0);
}
