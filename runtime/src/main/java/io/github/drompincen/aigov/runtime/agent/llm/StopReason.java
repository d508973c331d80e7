package io.github.drompincen.aigov.runtime.agent.llm;

public enum StopReason {
    END_TURN,
    TOOL_USE,
    MAX_TOKENS,
    STOP_SEQUENCE
}
