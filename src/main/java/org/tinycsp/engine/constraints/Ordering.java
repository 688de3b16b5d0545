/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.constraints;

import org.tinycsp.engine.core.AbstractConstraint;
import org.tinycsp.engine.core.Assignment;
import org.tinycsp.engine.core.ConstraintType;

/**
 * Ordering constraint {@code x (op) y} between two numeric variables,
 * with {@code op} one of {@code <, <=, >, >=}.
 * Evaluating it on a non numeric value raises an {@link IllegalStateException}.
 */
public class Ordering extends AbstractConstraint {

    private final String x, y;
    private final Relation relation;

    public Ordering(String id, String x, Relation relation, String y) {
        super(id, typeOf(relation), x, y);
        this.x = x;
        this.y = y;
        this.relation = relation;
        setDescription(x + " " + relation.symbol() + " " + y);
    }

    private static ConstraintType typeOf(Relation relation) {
        switch (relation) {
            case LT:
                return ConstraintType.LESS_THAN;
            case LE:
                return ConstraintType.LESS_EQUAL;
            case GT:
                return ConstraintType.GREATER_THAN;
            case GE:
                return ConstraintType.GREATER_EQUAL;
            default:
                throw new IllegalArgumentException("not an ordering relation: " + relation);
        }
    }

    public Relation getRelation() {
        return relation;
    }

    @Override
    public boolean isSatisfied(Assignment assignment) {
        return relation.holds(assignment.get(x).asDouble(), assignment.get(y).asDouble());
    }
}
