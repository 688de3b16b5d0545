/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Neighborhood of the variables of a {@link CSP}: two variables are neighbors
 * if some constraint ranges over both of them.
 * <p>
 * The graph is a snapshot, it does not follow later additions to the problem.
 * Iteration orders follow the order of the constraints.
 */
public class ConstraintGraph {

    private final LinkedHashMap<String, LinkedHashSet<String>> neighbors = new LinkedHashMap<>();
    private final LinkedHashMap<String, List<Constraint>> linking = new LinkedHashMap<>();
    private final Set<String> emptySet = Collections.emptySet();

    private ConstraintGraph() {
    }

    /**
     * Graph of all the constraints of the problem, whatever their arity.
     */
    public static ConstraintGraph of(CSP csp) {
        ConstraintGraph g = new ConstraintGraph();
        for (Constraint c : csp.getConstraints()) {
            for (String x : c.getVariables())
                for (String y : c.getVariables())
                    if (!x.equals(y))
                        g.link(x, y, c);
        }
        return g;
    }

    /**
     * Graph of the binary constraints, those with exactly two distinct variables,
     * accepted by the filter.
     */
    public static ConstraintGraph binary(CSP csp, Predicate<Constraint> filter) {
        ConstraintGraph g = new ConstraintGraph();
        for (Constraint c : csp.getConstraints()) {
            if (isBinary(c) && filter.test(c)) {
                String x = c.getVariables().get(0);
                String y = c.getVariables().get(1);
                g.link(x, y, c);
                g.link(y, x, c);
            }
        }
        return g;
    }

    /**
     * True if the constraint ranges over exactly two distinct variables.
     */
    public static boolean isBinary(Constraint c) {
        return c.arity() == 2 && !c.getVariables().get(0).equals(c.getVariables().get(1));
    }

    private void link(String x, String y, Constraint c) {
        if (!neighbors.containsKey(x))
            neighbors.put(x, new LinkedHashSet<>());
        neighbors.get(x).add(y);
        String key = key(x, y);
        if (!linking.containsKey(key))
            linking.put(key, new ArrayList<>());
        List<Constraint> between = linking.get(key);
        if (!between.contains(c))
            between.add(c);
    }

    private static String key(String x, String y) {
        return x + '\u0000' + y;
    }

    public Set<String> neighbors(String x) {
        if (neighbors.containsKey(x))
            return Collections.unmodifiableSet(neighbors.get(x));
        return emptySet;
    }

    public int degree(String x) {
        return neighbors(x).size();
    }

    /**
     * Returns the constraints ranging over both variables, in problem order.
     */
    public List<Constraint> constraintsBetween(String x, String y) {
        List<Constraint> between = linking.get(key(x, y));
        return between == null ? Collections.emptyList() : Collections.unmodifiableList(between);
    }
}
