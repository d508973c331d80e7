package io.github.drompincen.aigov.runtime.agent;

import io.github.drompincen.aigov.protocol.api.GovernanceRequest;
import io.github.drompincen.aigov.protocol.api.ProjectConfig;
import io.github.drompincen.aigov.protocol.api.RoleDefinition;

/**
 * One agent run: the classified request, the role it was routed to, and its position in a chain of
 * conversations. A top-level run has depth 0 and no parent.
 */
public record InvocationContext(
        GovernanceRequest request,
        ProjectConfig project,
        RoleDefinition role,
        int depth,
        String parentSessionId,
        String conversationContext
) {
    public static InvocationContext topLevel(GovernanceRequest request, ProjectConfig project, RoleDefinition role) {
        return new InvocationContext(request, project, role, 0, null, null);
    }

    /** A nested run of {@code target}, answering a conversation started from {@code sessionId}. */
    public InvocationContext nested(RoleDefinition target, String sessionId, String context) {
        return new InvocationContext(request, project, target, depth + 1, sessionId, context);
    }
}
