package io.github.drompincen.aigov.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ApprovalRequiredConstraint(
        String description,
        Enforcement enforcement,
        Parameters parameters,
        @JsonProperty("on_actions") List<String> onActions
) implements Constraint {

    public static final String TYPE = "approval_required";

    public ApprovalRequiredConstraint {
        onActions = onActions != null ? List.copyOf(onActions) : List.of();
    }

    public record Parameters(String approver) {}

    @Override
    public String type() { return TYPE; }

    public String approver() {
        return parameters != null ? parameters.approver() : null;
    }
}
