package io.github.drompincen.aigov.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.stream.Collectors;

public record RoleDefinition(
        String name,
        String purpose,
        List<TrustLevel> acceptsTrust,
        ToolPermissions tools,
        List<String> significantActions,
        String escalatesTo,
        String instructions,
        List<Constraint> constraints,
        String model,
        Integer maxTokens
) {
    public RoleDefinition {
        acceptsTrust = acceptsTrust != null ? List.copyOf(acceptsTrust) : List.of();
        tools = tools != null ? tools : ToolPermissions.allowAll();
        significantActions = significantActions != null ? List.copyOf(significantActions) : List.of();
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
        instructions = instructions != null ? instructions : "";
    }

    public boolean accepts(TrustLevel trust) {
        return acceptsTrust.contains(trust);
    }

    public boolean isSignificant(String toolName) {
        return significantActions.contains(toolName);
    }

    @JsonIgnore
    public List<Constraint> getHardConstraints() {
        return constraints.stream().filter(Constraint::isHard).collect(Collectors.toList());
    }
}
