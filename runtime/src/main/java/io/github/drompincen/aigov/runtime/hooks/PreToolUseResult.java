package io.github.drompincen.aigov.runtime.hooks;

public record PreToolUseResult(boolean allowed, String reason, boolean requiresDecisionLogging) {

    public static PreToolUseResult allow(boolean requiresDecisionLogging) {
        return new PreToolUseResult(true, null, requiresDecisionLogging);
    }

    public static PreToolUseResult reject(String reason) {
        return new PreToolUseResult(false, reason, false);
    }
}
