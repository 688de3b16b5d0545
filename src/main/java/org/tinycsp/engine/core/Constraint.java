/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.core;

import java.util.List;

/**
 * A constraint over an ordered, non-empty list of variables of a {@link CSP}.
 * <p>
 * A constraint of weight 1 is hard: a consistent assignment must satisfy it.
 * A lower weight makes it soft, its violations are reported but never block the search.
 * The priority is only used to present constraints, it has no effect on solving.
 */
public interface Constraint {

    String getId();

    ConstraintType getType();

    /**
     * Returns the identifiers of the variables the constraint ranges over.
     *
     * @return the non-empty, unmodifiable list of variable identifiers
     */
    List<String> getVariables();

    /**
     * Returns the weight of the constraint, in [0,1].
     *
     * @return 1.0 for a hard constraint, a lower value for a soft one
     */
    double getWeight();

    default boolean isHard() {
        return getWeight() == 1.0;
    }

    int getPriority();

    String getDescription();

    /**
     * Number of variables in the scope of the constraint.
     */
    default int arity() {
        return getVariables().size();
    }

    /**
     * Evaluates the predicate of the constraint.
     * Only called with an assignment binding every variable of {@link #getVariables()},
     * see {@link ConstraintEvaluator#satisfiesConstraint(Constraint, Assignment)}.
     *
     * @param assignment an assignment covering the scope of the constraint
     * @return true if the values satisfy the constraint
     */
    boolean isSatisfied(Assignment assignment);
}
