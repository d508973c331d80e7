package io.github.drompincen.aigov.runtime.agent.llm;

/**
 * One block of a model turn: text, a tool invocation, or the result of one.
 */
public interface ContentBlock {
}
