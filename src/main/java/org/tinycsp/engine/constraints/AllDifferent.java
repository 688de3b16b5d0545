/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.constraints;

import org.tinycsp.engine.core.AbstractConstraint;
import org.tinycsp.engine.core.Assignment;
import org.tinycsp.engine.core.ConstraintType;
import org.tinycsp.engine.core.Value;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * All the variables take pairwise different values.
 * <p>
 * Like every constraint, it is only checked once all its variables are assigned.
 * With two variables it is binary and takes part in arc consistency.
 */
public class AllDifferent extends AbstractConstraint {

    public AllDifferent(String id, String... x) {
        super(id, ConstraintType.ALL_DIFFERENT, x);
        setDescription("allDifferent" + List.of(x));
    }

    @Override
    public boolean isSatisfied(Assignment assignment) {
        Set<Value> seen = new HashSet<>();
        for (String x : getVariables()) {
            if (!seen.add(assignment.get(x))) {
                return false;
            }
        }
        return true;
    }
}
