/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluation of constraints over possibly partial assignments.
 * <p>
 * A constraint with at least one unassigned variable is considered satisfied.
 * This lets the search check partial assignments, at the price that
 * {@link #getViolatedConstraints(CSP, Assignment)} under-reports violations
 * on partial assignments.
 * <p>
 * Exceptions raised by a predicate are not caught: they abort the calling operation.
 */
public final class ConstraintEvaluator {

    private ConstraintEvaluator() {
    }

    /**
     * Returns true if the constraint holds, or if one of its variables is not assigned yet.
     *
     * @param constraint the constraint to check
     * @param assignment a possibly partial assignment
     * @return the satisfaction of the constraint under the permissive rule
     */
    public static boolean satisfiesConstraint(Constraint constraint, Assignment assignment) {
        for (String x : constraint.getVariables()) {
            if (!assignment.isAssigned(x)) {
                return true;
            }
        }
        return constraint.isSatisfied(assignment);
    }

    /**
     * Returns true if no hard constraint is violated. Soft constraints are ignored.
     */
    public static boolean isConsistent(CSP csp, Assignment assignment) {
        for (Constraint c : csp.getConstraints()) {
            if (c.isHard() && !satisfiesConstraint(c, assignment)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the identifiers of the violated constraints, hard and soft, in problem order.
     */
    public static List<String> getViolatedConstraints(CSP csp, Assignment assignment) {
        List<String> violated = new ArrayList<>();
        for (Constraint c : csp.getConstraints()) {
            if (!satisfiesConstraint(c, assignment)) {
                violated.add(c.getId());
            }
        }
        return violated;
    }

    /**
     * Returns the identifiers of the constraints that are not violated, in problem order.
     */
    public static List<String> getSatisfiedConstraints(CSP csp, Assignment assignment) {
        List<String> satisfied = new ArrayList<>();
        for (Constraint c : csp.getConstraints()) {
            if (satisfiesConstraint(c, assignment)) {
                satisfied.add(c.getId());
            }
        }
        return satisfied;
    }

    /**
     * Sum of the weights of the violated soft constraints.
     */
    public static double softViolationCost(CSP csp, Assignment assignment) {
        double cost = 0;
        for (Constraint c : csp.getConstraints()) {
            if (!c.isHard() && !satisfiesConstraint(c, assignment)) {
                cost += c.getWeight();
            }
        }
        return cost;
    }
}
