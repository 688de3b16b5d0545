/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.constraints;

import org.tinycsp.engine.core.AbstractConstraint;
import org.tinycsp.engine.core.Assignment;
import org.tinycsp.engine.core.ConstraintType;

/**
 * Equality constraint {@code x = y}, values are compared structurally.
 */
public class Equal extends AbstractConstraint {

    private final String x, y;

    public Equal(String id, String x, String y) {
        super(id, ConstraintType.EQUALITY, x, y);
        this.x = x;
        this.y = y;
        setDescription(x + " = " + y);
    }

    @Override
    public boolean isSatisfied(Assignment assignment) {
        return assignment.get(x).equals(assignment.get(y));
    }
}
