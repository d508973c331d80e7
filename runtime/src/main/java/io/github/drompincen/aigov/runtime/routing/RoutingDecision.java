package io.github.drompincen.aigov.runtime.routing;

import io.github.drompincen.aigov.protocol.api.IntentCategory;
import io.github.drompincen.aigov.protocol.api.RoleDefinition;

/**
 * @param fallback true when no category candidate qualified and the trust-based fallback chose the role
 */
public record RoutingDecision(IntentCategory category, RoleDefinition role, boolean fallback) {}
