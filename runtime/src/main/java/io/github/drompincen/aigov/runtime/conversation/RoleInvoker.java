package io.github.drompincen.aigov.runtime.conversation;

import io.github.drompincen.aigov.protocol.api.RoleDefinition;

/**
 * Runs another role's agent synchronously, one level deeper, and returns its final text.
 */
@FunctionalInterface
public interface RoleInvoker {

    String invoke(RoleDefinition targetRole, String conversationContext, String conversationId);
}
