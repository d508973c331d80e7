package io.github.drompincen.aigov.runtime.hooks.constraint;

import io.github.drompincen.aigov.protocol.api.TrustLevelConstraint;
import org.springframework.stereotype.Component;

@Component
public class TrustLevelConstraintEvaluator implements ConstraintEvaluator<TrustLevelConstraint> {

    @Override
    public Class<TrustLevelConstraint> constraintType() {
        return TrustLevelConstraint.class;
    }

    @Override
    public boolean isViolated(TrustLevelConstraint constraint, ConstraintCheck check) {
        return check.request().trust().isBelow(constraint.minTrust());
    }
}
