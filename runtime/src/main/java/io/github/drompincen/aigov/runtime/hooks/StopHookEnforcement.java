package io.github.drompincen.aigov.runtime.hooks;

/**
 * What an invocation does when stop validation fails.
 */
public enum StopHookEnforcement {
    /** Log a warning and still return the agent's response. */
    WARN,
    /** Fail the invocation with {@link io.github.drompincen.aigov.runtime.error.SessionBlockedException}. */
    BLOCK;

    public static StopHookEnforcement fromString(String value) {
        if (value == null || value.isBlank()) return WARN;
        for (StopHookEnforcement e : values()) {
            if (e.name().equalsIgnoreCase(value.trim())) return e;
        }
        throw new IllegalArgumentException("Unknown stop-hook enforcement: " + value);
    }
}
