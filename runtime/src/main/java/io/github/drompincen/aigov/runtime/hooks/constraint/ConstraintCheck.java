package io.github.drompincen.aigov.runtime.hooks.constraint;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.aigov.protocol.api.GovernanceRequest;
import io.github.drompincen.aigov.protocol.api.RoleDefinition;

/**
 * The tool call a constraint is evaluated against.
 */
public record ConstraintCheck(
        String sessionId,
        GovernanceRequest request,
        RoleDefinition role,
        String toolName,
        JsonNode toolInput
) {}
