/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.search;

import org.tinycsp.engine.core.Assignment;
import org.tinycsp.engine.core.AssignmentStatus;
import org.tinycsp.engine.core.CSP;
import org.tinycsp.engine.core.Constraint;
import org.tinycsp.engine.core.ConstraintEvaluator;
import org.tinycsp.engine.core.Value;
import org.tinycsp.engine.core.Variable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Random;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Depth-first chronological backtracking.
 * <p>
 * At each node, an unassigned variable is selected and its values are tried in order;
 * a value is kept if the extended assignment violates no hard constraint, then the search
 * recurses. The first complete assignment is returned, solutions are not enumerated.
 * No propagation is done during the search: run
 * {@link org.tinycsp.engine.propagation.ArcConsistency} beforehand to reduce the domains.
 * <p>
 * The recursion depth is the number of variables. The search limit is tested once per node.
 * A solver has no mutable state and can be shared, but the problems it solves must not be
 * modified concurrently.
 */
public class BacktrackingSolver {

    private static final Logger LOGGER = Logger.getLogger(BacktrackingSolver.class.getName());

    public static final String METHOD = "backtracking";

    private final VariableSelector variableSelector;
    private final ValueSelector valueSelector;
    private final Predicate<SearchStatistics> limit;

    /**
     * Creates a solver with custom heuristics.
     *
     * @param variableSelector selection of the branching variable
     * @param valueSelector    order of the values to try
     * @param limit            stops the search when it returns true
     */
    public BacktrackingSolver(VariableSelector variableSelector, ValueSelector valueSelector, Predicate<SearchStatistics> limit) {
        this.variableSelector = Objects.requireNonNull(variableSelector);
        this.valueSelector = Objects.requireNonNull(valueSelector);
        this.limit = Objects.requireNonNull(limit);
    }

    public BacktrackingSolver(VariableOrdering variableOrdering, ValueOrdering valueOrdering, Random random, Predicate<SearchStatistics> limit) {
        this(Searches.variableSelector(variableOrdering, random), Searches.valueSelector(valueOrdering, random), limit);
    }

    public BacktrackingSolver(VariableOrdering variableOrdering, ValueOrdering valueOrdering, Random random) {
        this(variableOrdering, valueOrdering, random, SearchLimits.none());
    }

    public BacktrackingSolver(VariableOrdering variableOrdering, ValueOrdering valueOrdering) {
        this(variableOrdering, valueOrdering, new Random(), SearchLimits.none());
    }

    /**
     * Minimum remaining values and least constraining value, without limit.
     */
    public BacktrackingSolver() {
        this(VariableOrdering.MIN_REMAINING_VALUES, ValueOrdering.LEAST_CONSTRAINING);
    }

    /**
     * Searches a complete assignment violating no hard constraint.
     *
     * @param csp the problem, validated first
     * @return the solution, with {@code isSolution() == false} if the problem is unsatisfiable
     * or the limit was reached
     * @throws org.tinycsp.util.exception.InvalidCSPException if the problem is malformed
     */
    public Solution solve(CSP csp) {
        csp.validate();
        SearchContext ctx = new SearchContext(limit);
        Assignment result = backtrack(csp, Assignment.empty(), ctx);
        SearchStatistics stats = ctx.statistics();
        if (!ctx.isStopped())
            stats.setCompleted();
        stats.stop();

        Solution solution;
        if (result != null) {
            stats.incrSolutions();
            OptionalDouble objective = csp.getObjective().isPresent()
                    ? OptionalDouble.of(csp.getObjective().get().evaluate(result))
                    : OptionalDouble.empty();
            solution = new Solution(result, result.evaluate(csp), true, objective, stats, stats.elapsed(), METHOD);
        } else {
            List<String> all = csp.getConstraints().stream().map(Constraint::getId).collect(Collectors.toList());
            AssignmentStatus status = new AssignmentStatus(false, false, all, List.of());
            solution = new Solution(Assignment.empty(), status, false, OptionalDouble.empty(), stats, stats.elapsed(), METHOD);
        }
        if (LOGGER.isLoggable(Level.FINE))
            LOGGER.fine(solution.toString());
        return solution;
    }

    /**
     * Returns a complete consistent extension of {@code assignment}, or null on failure.
     */
    private Assignment backtrack(CSP csp, Assignment assignment, SearchContext ctx) {
        if (!ctx.enterNode())
            return null;

        if (assignment.size() == csp.nVariables())
            return assignment;

        Optional<Variable> selected = variableSelector.select(csp, assignment);
        if (selected.isEmpty())
            return null;
        Variable x = selected.get();

        for (Value v : valueSelector.order(csp, x, assignment)) {
            Assignment extended = assignment.with(x.getId(), v);
            if (ConstraintEvaluator.isConsistent(csp, extended)) {
                Assignment result = backtrack(csp, extended, ctx);
                if (result != null)
                    return result;
                if (ctx.isStopped())
                    return null;
            }
        }
        ctx.statistics().incrFailures();
        return null;
    }
}
