package io.github.drompincen.aigov.runtime.hooks.constraint;

import io.github.drompincen.aigov.protocol.api.Constraint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches each constraint to the evaluator registered for its variant. A variant with no
 * evaluator fails closed: the call is reported as violating it.
 */
@Component
public class ConstraintEvaluators {

    private static final Logger log = LoggerFactory.getLogger(ConstraintEvaluators.class);

    private final Map<Class<?>, ConstraintEvaluator<?>> evaluators = new HashMap<>();

    public ConstraintEvaluators(List<ConstraintEvaluator<?>> evaluators) {
        for (ConstraintEvaluator<?> evaluator : evaluators) {
            this.evaluators.put(evaluator.constraintType(), evaluator);
        }
    }

    public boolean isViolated(Constraint constraint, ConstraintCheck check) {
        ConstraintEvaluator<Constraint> evaluator = evaluatorFor(constraint);
        if (evaluator == null) {
            log.warn("No evaluator for constraint type '{}' on role {}, rejecting {}",
                    constraint.type(), check.role().name(), check.toolName());
            return true;
        }
        return evaluator.isViolated(constraint, check);
    }

    public boolean admit(Constraint constraint, ConstraintCheck check) {
        ConstraintEvaluator<Constraint> evaluator = evaluatorFor(constraint);
        return evaluator != null && evaluator.admit(constraint, check);
    }

    @SuppressWarnings("unchecked")
    private ConstraintEvaluator<Constraint> evaluatorFor(Constraint constraint) {
        return (ConstraintEvaluator<Constraint>) evaluators.get(constraint.getClass());
    }
}
