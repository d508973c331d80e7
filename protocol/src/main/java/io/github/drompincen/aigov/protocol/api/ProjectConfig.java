package io.github.drompincen.aigov.protocol.api;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Already-validated project configuration, resolved once per request.
 */
public record ProjectConfig(
        String id,
        String name,
        String repository,
        String constitution,
        List<RoleDefinition> roles,
        Map<String, List<String>> routing,
        List<ToolServerConfig> toolServers,
        TrustSettings trust
) {
    public ProjectConfig {
        roles = roles != null ? List.copyOf(roles) : List.of();
        routing = routing != null ? Map.copyOf(routing) : Map.of();
        toolServers = toolServers != null ? List.copyOf(toolServers) : List.of();
        trust = trust != null ? trust : TrustSettings.defaults();
        constitution = constitution != null ? constitution : "";
    }

    /** Role-name override for a category, keyed by the category's lower-case name. */
    public Optional<List<String>> routingFor(IntentCategory category) {
        return Optional.ofNullable(routing.get(category.name().toLowerCase()));
    }

    public Optional<RoleDefinition> findRole(String roleName) {
        return roles.stream().filter(r -> r.name().equalsIgnoreCase(roleName)).findFirst();
    }
}
