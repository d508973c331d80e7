package io.github.drompincen.aigov.runtime.hooks;

import java.util.List;

public record StopHookResult(boolean canComplete, String reason, List<String> missingDecisions) {

    public StopHookResult {
        missingDecisions = missingDecisions != null ? List.copyOf(missingDecisions) : List.of();
    }

    public static StopHookResult complete() {
        return new StopHookResult(true, null, List.of());
    }
}
