/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.examples;

import org.tinycsp.CSPFactory;
import org.tinycsp.engine.core.CSP;
import org.tinycsp.search.Solution;
import org.tinycsp.search.ValueOrdering;
import org.tinycsp.search.VariableOrdering;

import static org.tinycsp.CSPFactory.*;

/**
 * The N-Queens problem.
 * <a href="http://csplib.org/Problems/prob054/">CSPLib</a>.
 * Variable {@code q<i>} is the row of the queen in column {@code i}.
 */
public class NQueens {

    public static CSP model(int n) {
        CSP csp = makeCSP();
        for (int i = 0; i < n; i++) {
            makeIntVar(csp, "q" + i, 0, n - 1);
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                String qi = "q" + i;
                String qj = "q" + j;
                int dist = j - i;
                addConstraint(csp, custom("noAttack_" + i + "_" + j, a -> {
                    int ri = a.getInt(qi);
                    int rj = a.getInt(qj);
                    return ri != rj && Math.abs(ri - rj) != dist;
                }, qi, qj).setDescription(qi + " and " + qj + " do not attack each other"));
            }
        }
        return csp;
    }

    public static void main(String[] args) {
        int n = args.length > 0 ? Integer.parseInt(args[0]) : 8;
        CSP csp = model(n);
        Solution solution = CSPFactory.solveBacktracking(csp, VariableOrdering.MIN_REMAINING_VALUES, ValueOrdering.NATURAL);
        System.out.println(solution);
        if (solution.isSolution()) {
            for (int r = 0; r < n; r++) {
                StringBuilder line = new StringBuilder();
                for (int c = 0; c < n; c++) {
                    line.append(solution.assignment().getInt("q" + c) == r ? " Q" : " .");
                }
                System.out.println(line);
            }
        }
    }
}
