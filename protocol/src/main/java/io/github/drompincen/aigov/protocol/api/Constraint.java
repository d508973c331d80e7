package io.github.drompincen.aigov.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * A declarative rule attached to a role. The {@code type} property selects the variant; a type
 * with no registered variant fails deserialization, so an unknown constraint can never pass
 * silently.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TrustLevelConstraint.class, name = TrustLevelConstraint.TYPE),
        @JsonSubTypes.Type(value = RateLimitConstraint.class, name = RateLimitConstraint.TYPE),
        @JsonSubTypes.Type(value = ApprovalRequiredConstraint.class, name = ApprovalRequiredConstraint.TYPE)
})
public interface Constraint {

    String type();

    String description();

    Enforcement enforcement();

    /** Tool names the constraint is limited to; empty means every tool. */
    List<String> onActions();

    @JsonIgnore
    default boolean isHard() {
        return enforcement() == Enforcement.HARD;
    }

    default boolean appliesTo(String toolName) {
        return onActions() == null || onActions().isEmpty() || onActions().contains(toolName);
    }
}
