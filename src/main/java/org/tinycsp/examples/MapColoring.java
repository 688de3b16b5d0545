/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.examples;

import org.tinycsp.engine.core.CSP;
import org.tinycsp.engine.core.Value;
import org.tinycsp.engine.propagation.ConstraintPropagation;
import org.tinycsp.search.Solution;
import org.tinycsp.search.ValueOrdering;
import org.tinycsp.search.VariableOrdering;

import java.util.List;

import static org.tinycsp.CSPFactory.*;

/**
 * Coloring the states and territories of Australia with three colors,
 * adjacent regions having different colors.
 * Western Australia is fixed to red and a soft constraint prefers Tasmania not to be green.
 */
public class MapColoring {

    public static final String[] REGIONS = {"WA", "NT", "SA", "Q", "NSW", "V", "T"};

    public static final String[][] BORDERS = {
            {"WA", "NT"}, {"WA", "SA"}, {"NT", "SA"}, {"NT", "Q"}, {"SA", "Q"},
            {"SA", "NSW"}, {"SA", "V"}, {"Q", "NSW"}, {"NSW", "V"}
    };

    public static CSP model() {
        CSP csp = makeCSP();
        for (String region : REGIONS) {
            makeCategoricalVar(csp, region, "red", "green", "blue");
        }
        for (String[] border : BORDERS) {
            addConstraint(csp, neq(border[0] + "!=" + border[1], border[0], border[1]));
        }
        addConstraint(csp, inSet("WA_red", "WA", Value.of("red")));
        addConstraint(csp, notInSet("T_not_green", "T", Value.of("green")).setWeight(0.3).setPriority(1));
        return csp;
    }

    public static void main(String[] args) {
        CSP csp = model();
        System.out.println(analyzeCSP(csp));

        List<ConstraintPropagation> propagations = applyAC3(csp);
        for (ConstraintPropagation p : propagations) {
            System.out.println(p.variable() + ": " + p.originalDomain() + " -> " + p.reducedDomain() + " (" + p.reason() + ")");
        }

        Solution solution = solveBacktracking(csp, VariableOrdering.MIN_REMAINING_VALUES, ValueOrdering.LEAST_CONSTRAINING);
        System.out.println(solution);
        System.out.println("violated: " + solution.status().violatedConstraints());
    }
}
