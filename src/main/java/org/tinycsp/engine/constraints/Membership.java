/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.constraints;

import org.tinycsp.engine.core.AbstractConstraint;
import org.tinycsp.engine.core.Assignment;
import org.tinycsp.engine.core.ConstraintType;
import org.tinycsp.engine.core.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Unary constraint {@code x in S} or, when negated, {@code x not in S}.
 */
public class Membership extends AbstractConstraint {

    private final String x;
    private final Set<Value> values;
    private final boolean negated;

    public Membership(String id, String x, Collection<Value> values, boolean negated) {
        super(id, negated ? ConstraintType.NOT_IN_SET : ConstraintType.IN_SET, x);
        this.x = x;
        this.values = Collections.unmodifiableSet(new LinkedHashSet<>(values));
        this.negated = negated;
        setDescription(x + (negated ? " not in " : " in ") + this.values);
    }

    public Set<Value> getValues() {
        return values;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public boolean isSatisfied(Assignment assignment) {
        return values.contains(assignment.get(x)) != negated;
    }
}
