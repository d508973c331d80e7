package io.github.drompincen.aigov.runtime.error;

import java.time.Duration;

public class LlmTimeoutException extends GovernanceException {

    public LlmTimeoutException(Duration timeout, Throwable cause) {
        super("LLM call did not complete within " + timeout, cause);
    }
}
