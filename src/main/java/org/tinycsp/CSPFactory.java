/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp;

import org.tinycsp.engine.analysis.Analysis;
import org.tinycsp.engine.analysis.ProblemAnalyzer;
import org.tinycsp.engine.constraints.AllDifferent;
import org.tinycsp.engine.constraints.CustomConstraint;
import org.tinycsp.engine.constraints.Equal;
import org.tinycsp.engine.constraints.LinearSum;
import org.tinycsp.engine.constraints.Membership;
import org.tinycsp.engine.constraints.NotEqual;
import org.tinycsp.engine.constraints.Ordering;
import org.tinycsp.engine.constraints.Relation;
import org.tinycsp.engine.core.Assignment;
import org.tinycsp.engine.core.CSP;
import org.tinycsp.engine.core.Constraint;
import org.tinycsp.engine.core.Value;
import org.tinycsp.engine.core.Variable;
import org.tinycsp.engine.core.VariableType;
import org.tinycsp.engine.propagation.ArcConsistency;
import org.tinycsp.engine.propagation.ConstraintPropagation;
import org.tinycsp.search.BacktrackingSolver;
import org.tinycsp.search.SearchLimits;
import org.tinycsp.search.SearchStatistics;
import org.tinycsp.search.SearchStrategy;
import org.tinycsp.search.Solution;
import org.tinycsp.search.ValueOrdering;
import org.tinycsp.search.VariableOrdering;
import org.tinycsp.util.exception.NotYetImplementedException;

import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.function.Predicate;

/**
 * Factory to create problems, variables and constraints, and entry point of the
 * solving operations (search, arc consistency, analysis).
 */
public final class CSPFactory {

    private CSPFactory() {
        throw new UnsupportedOperationException();
    }

    // ------------------------------ problems ------------------------------

    public static CSP makeCSP() {
        return new CSP();
    }

    public static void addVariable(CSP csp, Variable variable) {
        csp.addVariable(variable);
    }

    /**
     * Adds a constraint and updates the back-references of its variables.
     */
    public static void addConstraint(CSP csp, Constraint constraint) {
        csp.addConstraint(constraint);
    }

    // ------------------------------ variables ------------------------------

    /**
     * Creates an integer variable with domain {@code {min,...,max}} and adds it to the problem.
     */
    public static Variable makeIntVar(CSP csp, String id, int min, int max) {
        return add(csp, new Variable(id, VariableType.INTEGER, Value.range(min, max)));
    }

    /**
     * Creates an integer variable with the given values, in this order, and adds it to the problem.
     */
    public static Variable makeIntVar(CSP csp, String id, int... values) {
        return add(csp, new Variable(id, VariableType.INTEGER, Value.ints(values)));
    }

    public static Variable makeRealVar(CSP csp, String id, double... values) {
        return add(csp, new Variable(id, VariableType.REAL, Arrays.stream(values).mapToObj(Value::of).toArray(Value[]::new)));
    }

    public static Variable makeBoolVar(CSP csp, String id) {
        return add(csp, new Variable(id, VariableType.BOOLEAN, Value.of(false), Value.of(true)));
    }

    public static Variable makeCategoricalVar(CSP csp, String id, String... categories) {
        return add(csp, new Variable(id, VariableType.CATEGORICAL, Value.categories(categories)));
    }

    /**
     * Creates a set-valued variable whose domain is the given sets.
     */
    public static Variable makeSetVar(CSP csp, String id, Value... sets) {
        return add(csp, new Variable(id, VariableType.SET, sets));
    }

    private static Variable add(CSP csp, Variable x) {
        csp.addVariable(x);
        return x;
    }

    // ----------------------------- constraints -----------------------------

    public static Equal eq(String id, String x, String y) {
        return new Equal(id, x, y);
    }

    public static NotEqual neq(String id, String x, String y) {
        return new NotEqual(id, x, y);
    }

    public static Ordering lt(String id, String x, String y) {
        return new Ordering(id, x, Relation.LT, y);
    }

    public static Ordering le(String id, String x, String y) {
        return new Ordering(id, x, Relation.LE, y);
    }

    public static Ordering gt(String id, String x, String y) {
        return new Ordering(id, x, Relation.GT, y);
    }

    public static Ordering ge(String id, String x, String y) {
        return new Ordering(id, x, Relation.GE, y);
    }

    public static Membership inSet(String id, String x, Value... values) {
        return new Membership(id, x, Arrays.asList(values), false);
    }

    public static Membership notInSet(String id, String x, Value... values) {
        return new Membership(id, x, Arrays.asList(values), true);
    }

    public static AllDifferent allDifferent(String id, String... x) {
        return new AllDifferent(id, x);
    }

    public static LinearSum sumEquals(String id, double total, String... x) {
        return new LinearSum(id, x, total);
    }

    public static LinearSum linear(String id, double[] coefficients, String[] x, Relation relation, double rhs) {
        return new LinearSum(id, x, coefficients, relation, rhs);
    }

    public static CustomConstraint custom(String id, Predicate<Assignment> predicate, String... x) {
        return new CustomConstraint(id, predicate, x);
    }

    // ------------------------------- solving -------------------------------

    /**
     * Backtracking with minimum remaining values and least constraining value.
     */
    public static Solution solveBacktracking(CSP csp) {
        return new BacktrackingSolver().solve(csp);
    }

    public static Solution solveBacktracking(CSP csp, VariableOrdering variableOrdering, ValueOrdering valueOrdering) {
        return new BacktrackingSolver(variableOrdering, valueOrdering).solve(csp);
    }

    /**
     * @param random seeds the {@code RANDOM} orderings, for reproducible runs
     */
    public static Solution solveBacktracking(CSP csp, VariableOrdering variableOrdering, ValueOrdering valueOrdering, Random random) {
        return new BacktrackingSolver(variableOrdering, valueOrdering, random).solve(csp);
    }

    /**
     * @param limit stops the search when it returns true, see {@link SearchLimits}
     */
    public static Solution solveBacktracking(CSP csp, VariableOrdering variableOrdering, ValueOrdering valueOrdering,
                                             Random random, Predicate<SearchStatistics> limit) {
        return new BacktrackingSolver(variableOrdering, valueOrdering, random, limit).solve(csp);
    }

    /**
     * Solves with a named strategy.
     *
     * @throws NotYetImplementedException for every strategy but {@link SearchStrategy#BACKTRACKING}
     */
    public static Solution solve(CSP csp, SearchStrategy strategy, VariableOrdering variableOrdering,
                                 ValueOrdering valueOrdering, Random random) {
        if (strategy != SearchStrategy.BACKTRACKING)
            throw new NotYetImplementedException("search strategy " + strategy + " is not available, use " + SearchStrategy.BACKTRACKING);
        return solveBacktracking(csp, variableOrdering, valueOrdering, random);
    }

    /**
     * Runs arc consistency on a copy of the problem, then backtracking on the reduced copy.
     * The given problem is left unchanged.
     */
    public static Solution solveWithArcConsistency(CSP csp, VariableOrdering variableOrdering,
                                                   ValueOrdering valueOrdering, Random random) {
        CSP reduced = csp.copy();
        new ArcConsistency().apply(reduced);
        // an emptied domain makes the search fail as soon as its variable is selected
        Solution s = new BacktrackingSolver(variableOrdering, valueOrdering, random).solve(reduced);
        return new Solution(s.assignment(), s.status(), s.isSolution(), s.objectiveValue(),
                s.statistics(), s.timeElapsed(), "ac3+" + BacktrackingSolver.METHOD);
    }

    // ---------------------------- propagation ------------------------------

    /**
     * Runs AC-3, reducing the domains of the problem in place.
     *
     * @return the domain reductions, check the domains for emptiness to detect unsatisfiability
     */
    public static List<ConstraintPropagation> applyAC3(CSP csp) {
        return new ArcConsistency().apply(csp);
    }

    // ------------------------------ analysis -------------------------------

    public static Analysis analyzeCSP(CSP csp) {
        return ProblemAnalyzer.analyze(csp);
    }
}
