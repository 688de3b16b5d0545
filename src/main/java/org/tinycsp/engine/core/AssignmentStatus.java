/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.core;

import java.util.List;

/**
 * Flags and constraint lists derived from an {@link Assignment} for a given problem.
 * Violated and satisfied constraints use the permissive rule of {@link ConstraintEvaluator}:
 * a constraint with an unassigned variable counts as satisfied.
 *
 * @param isComplete           every variable of the problem is assigned
 * @param isConsistent         no hard constraint is violated
 * @param violatedConstraints  identifiers of the violated constraints, hard and soft
 * @param satisfiedConstraints identifiers of the other constraints
 */
public record AssignmentStatus(boolean isComplete,
                               boolean isConsistent,
                               List<String> violatedConstraints,
                               List<String> satisfiedConstraints) {

    public AssignmentStatus {
        violatedConstraints = List.copyOf(violatedConstraints);
        satisfiedConstraints = List.copyOf(satisfiedConstraints);
    }
}
