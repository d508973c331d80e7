package io.github.drompincen.aigov.protocol.api;

import java.util.List;

/**
 * Tool allow/deny lists of a role. Deny always wins; an empty allow list admits every tool that
 * is not denied.
 */
public record ToolPermissions(
        List<String> allowed,
        List<String> denied
) {
    public ToolPermissions {
        allowed = allowed != null ? List.copyOf(allowed) : List.of();
        denied = denied != null ? List.copyOf(denied) : List.of();
    }

    public static ToolPermissions allowAll() {
        return new ToolPermissions(List.of(), List.of());
    }

    public boolean isDenied(String toolName) {
        return denied.contains(toolName);
    }

    public boolean isAllowed(String toolName) {
        if (isDenied(toolName)) return false;
        return allowed.isEmpty() || allowed.contains(toolName);
    }
}
