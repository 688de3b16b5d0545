/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.constraints;

import org.tinycsp.engine.core.AbstractConstraint;
import org.tinycsp.engine.core.Assignment;
import org.tinycsp.engine.core.ConstraintType;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Constraint defined by an arbitrary predicate over the assignment of its variables.
 * The predicate is only called when all the variables of the scope are assigned.
 * Any exception it throws propagates to the caller of the evaluation.
 */
public class CustomConstraint extends AbstractConstraint {

    private final Predicate<Assignment> predicate;

    public CustomConstraint(String id, Predicate<Assignment> predicate, String... x) {
        super(id, ConstraintType.CUSTOM, x);
        this.predicate = Objects.requireNonNull(predicate, "predicate");
    }

    @Override
    public boolean isSatisfied(Assignment assignment) {
        return predicate.test(assignment);
    }
}
