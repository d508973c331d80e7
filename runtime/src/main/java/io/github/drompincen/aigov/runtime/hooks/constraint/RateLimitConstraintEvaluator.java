package io.github.drompincen.aigov.runtime.hooks.constraint;

import io.github.drompincen.aigov.protocol.api.RateLimitConstraint;
import io.github.drompincen.aigov.runtime.audit.AuditService;
import org.springframework.stereotype.Component;

/**
 * Counts this role's completed uses of the tool in the project within the window.
 */
@Component
public class RateLimitConstraintEvaluator implements ConstraintEvaluator<RateLimitConstraint> {

    private final AuditService auditService;

    public RateLimitConstraintEvaluator(AuditService auditService) {
        this.auditService = auditService;
    }

    @Override
    public Class<RateLimitConstraint> constraintType() {
        return RateLimitConstraint.class;
    }

    @Override
    public boolean isViolated(RateLimitConstraint constraint, ConstraintCheck check) {
        if (constraint.limit() <= 0 || constraint.window().isZero()) return false;
        long used = auditService.countCompletedUses(check.request().project(), check.role().name(),
                check.toolName(), constraint.window());
        return used >= constraint.limit();
    }
}
