package io.github.drompincen.aigov.runtime.hooks.constraint;

import io.github.drompincen.aigov.protocol.api.Constraint;

public interface ConstraintEvaluator<C extends Constraint> {

    Class<C> constraintType();

    /** True when the call violates the constraint. Must not consume anything. */
    boolean isViolated(C constraint, ConstraintCheck check);

    /**
     * Called once every hard constraint of the call has passed. Returning false rejects the call
     * after all, e.g. when a resource reserved by {@link #isViolated} is gone.
     */
    default boolean admit(C constraint, ConstraintCheck check) {
        return true;
    }
}
