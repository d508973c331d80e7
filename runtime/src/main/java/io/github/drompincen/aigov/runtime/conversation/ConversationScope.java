package io.github.drompincen.aigov.runtime.conversation;

import io.github.drompincen.aigov.protocol.api.GovernanceRequest;
import io.github.drompincen.aigov.protocol.api.ProjectConfig;
import io.github.drompincen.aigov.protocol.api.RoleDefinition;

/**
 * The calling agent of a conversation tool.
 */
public record ConversationScope(
        String sessionId,
        GovernanceRequest request,
        ProjectConfig project,
        RoleDefinition role,
        int depth
) {}
