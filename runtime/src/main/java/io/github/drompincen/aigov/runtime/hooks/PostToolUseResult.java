package io.github.drompincen.aigov.runtime.hooks;

import java.util.List;

public record PostToolUseResult(boolean decisionLogged, String decisionId, List<String> warnings) {

    public PostToolUseResult {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
