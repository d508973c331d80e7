package io.github.drompincen.aigov.runtime.agent.llm;

/**
 * Provider-neutral completion capability: system context, message history and tool catalog in,
 * content blocks out.
 */
public interface LlmClient {

    String provider();

    /**
     * @throws io.github.drompincen.aigov.runtime.error.LlmUnavailableException when no model is configured or the call fails
     * @throws io.github.drompincen.aigov.runtime.error.LlmTimeoutException when the call exceeds the configured timeout
     */
    LlmResponse complete(LlmRequest request);
}
