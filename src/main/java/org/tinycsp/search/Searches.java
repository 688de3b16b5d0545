/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.search;

import org.tinycsp.engine.core.Assignment;
import org.tinycsp.engine.core.CSP;
import org.tinycsp.engine.core.Constraint;
import org.tinycsp.engine.core.ConstraintEvaluator;
import org.tinycsp.engine.core.ConstraintGraph;
import org.tinycsp.engine.core.Value;
import org.tinycsp.engine.core.Variable;

import java.text.Collator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Factory for the variable and value selection heuristics.
 * <p>
 * Variable selectors only consider unassigned variables, value selectors only
 * return values of the current domain. Ties are broken by problem order:
 * the first variable (or value) encountered wins.
 */
public final class Searches {

    private Searches() {
    }

    /**
     * Returns the selector implementing a built-in variable ordering.
     *
     * @param ordering the heuristic
     * @param random   the random source, only used by {@link VariableOrdering#RANDOM}
     */
    public static VariableSelector variableSelector(VariableOrdering ordering, Random random) {
        switch (ordering) {
            case LEXICOGRAPHIC:
                return lexicographic();
            case MIN_REMAINING_VALUES:
                return minRemainingValues();
            case DEGREE_HEURISTIC:
                return degree();
            case MAX_DEGREE:
                return maxDegree();
            case RANDOM:
                return randomVariable(random);
            case FIRST_UNASSIGNED:
            default:
                return firstUnassigned();
        }
    }

    /**
     * Returns the selector implementing a built-in value ordering.
     *
     * @param ordering the heuristic
     * @param random   the random source, only used by {@link ValueOrdering#RANDOM}
     */
    public static ValueSelector valueSelector(ValueOrdering ordering, Random random) {
        switch (ordering) {
            case LEAST_CONSTRAINING:
                return leastConstraining();
            case MIN_CONFLICTS:
                return minConflicts();
            case RANDOM:
                return randomValues(random);
            case NATURAL:
            default:
                return natural();
        }
    }

    public static List<Variable> unassigned(CSP csp, Assignment assignment) {
        List<Variable> unassigned = new ArrayList<>();
        for (Variable x : csp.getVariables()) {
            if (!assignment.isAssigned(x.getId()))
                unassigned.add(x);
        }
        return unassigned;
    }

    // ------------------------- variable selection -------------------------

    public static VariableSelector firstUnassigned() {
        return (csp, assignment) -> unassigned(csp, assignment).stream().findFirst();
    }

    /**
     * The variable with the smallest display name, names being compared as words
     * ({@code "alpha"} comes before {@code "Zeta"}).
     */
    public static VariableSelector lexicographic() {
        Collator collator = Collator.getInstance(Locale.ROOT);
        return (csp, assignment) -> selectMin(unassigned(csp, assignment), Comparator.comparing(Variable::getName, collator));
    }

    /**
     * First-fail: the variable with the smallest current domain.
     */
    public static VariableSelector minRemainingValues() {
        return (csp, assignment) -> selectMin(unassigned(csp, assignment), Comparator.comparingInt(Variable::domainSize));
    }

    /**
     * The variable mentioned by the largest number of constraints.
     */
    public static VariableSelector degree() {
        return (csp, assignment) -> selectMin(unassigned(csp, assignment), Comparator.comparingInt(Variable::degree).reversed());
    }

    /**
     * The variable with the largest number of distinct neighbors in the constraint graph.
     */
    public static VariableSelector maxDegree() {
        return (csp, assignment) -> {
            ConstraintGraph graph = ConstraintGraph.of(csp);
            Comparator<Variable> byDegree = Comparator.comparingInt(x -> graph.degree(x.getId()));
            return selectMin(unassigned(csp, assignment), byDegree.reversed());
        };
    }

    public static VariableSelector randomVariable(Random random) {
        return (csp, assignment) -> {
            List<Variable> unassigned = unassigned(csp, assignment);
            if (unassigned.isEmpty())
                return Optional.empty();
            return Optional.of(unassigned.get(random.nextInt(unassigned.size())));
        };
    }

    /**
     * Smallest element for the comparator, the first one in case of ties.
     */
    private static Optional<Variable> selectMin(List<Variable> candidates, Comparator<Variable> comparator) {
        Variable best = null;
        for (Variable x : candidates) {
            if (best == null || comparator.compare(x, best) < 0)
                best = x;
        }
        return Optional.ofNullable(best);
    }

    // --------------------------- value ordering ---------------------------

    public static ValueSelector natural() {
        return (csp, x, assignment) -> new ArrayList<>(x.getDomain());
    }

    /**
     * Values sorted by increasing number of neighbor values they rule out,
     * see {@link #countRuledOut(CSP, Variable, Value, Assignment)}.
     */
    public static ValueSelector leastConstraining() {
        return (csp, x, assignment) -> {
            Map<Value, Integer> ruledOut = new HashMap<>();
            for (Value v : x.getDomain())
                ruledOut.put(v, countRuledOut(csp, x, v, assignment));
            List<Value> values = new ArrayList<>(x.getDomain());
            values.sort(Comparator.comparingInt(ruledOut::get));
            return values;
        };
    }

    /**
     * Values sorted by increasing number of constraints violated once the value is added
     * to the current assignment.
     */
    public static ValueSelector minConflicts() {
        return (csp, x, assignment) -> {
            Map<Value, Integer> conflicts = new HashMap<>();
            for (Value v : x.getDomain())
                conflicts.put(v, ConstraintEvaluator.getViolatedConstraints(csp, assignment.with(x.getId(), v)).size());
            List<Value> values = new ArrayList<>(x.getDomain());
            values.sort(Comparator.comparingInt(conflicts::get));
            return values;
        };
    }

    public static ValueSelector randomValues(Random random) {
        return (csp, x, assignment) -> {
            List<Value> values = new ArrayList<>(x.getDomain());
            Collections.shuffle(values, random);
            return values;
        };
    }

    /**
     * Counts the values of unassigned neighbors that become inconsistent if {@code x}
     * takes value {@code v}. For each constraint on {@code x}, each value of each
     * unassigned neighbor is tried together with {@code v} and counted if the constraint
     * is then violated. A constraint with other unassigned variables is never violated,
     * so only constraints becoming fully assigned contribute.
     */
    public static int countRuledOut(CSP csp, Variable x, Value v, Assignment assignment) {
        int count = 0;
        Assignment tentative = assignment.with(x.getId(), v);
        for (String cid : x.getConstraints()) {
            Constraint c = csp.getConstraint(cid);
            for (String y : c.getVariables()) {
                if (y.equals(x.getId()) || tentative.isAssigned(y))
                    continue;
                for (Value w : csp.getVariable(y).getDomain()) {
                    if (!ConstraintEvaluator.satisfiesConstraint(c, tentative.with(y, w)))
                        count++;
                }
            }
        }
        return count;
    }
}
