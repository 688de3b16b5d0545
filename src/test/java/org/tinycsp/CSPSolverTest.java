/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp;

import org.junit.jupiter.params.provider.Arguments;
import org.tinycsp.engine.core.Assignment;
import org.tinycsp.engine.core.CSP;
import org.tinycsp.engine.core.ConstraintEvaluator;
import org.tinycsp.engine.core.Value;
import org.tinycsp.engine.core.Variable;
import org.tinycsp.engine.core.VariableType;
import org.tinycsp.search.ValueOrdering;
import org.tinycsp.search.VariableOrdering;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

import static org.tinycsp.CSPFactory.*;

/**
 * Providers and helpers shared by the tests.
 */
public abstract class CSPSolverTest {

    public static Stream<VariableOrdering> getVariableOrderings() {
        return Arrays.stream(VariableOrdering.values());
    }

    public static Stream<ValueOrdering> getValueOrderings() {
        return Arrays.stream(ValueOrdering.values());
    }

    public static Stream<Arguments> getOrderings() {
        List<Arguments> args = new ArrayList<>();
        for (VariableOrdering vo : VariableOrdering.values())
            for (ValueOrdering vl : ValueOrdering.values())
                args.add(Arguments.of(vo, vl));
        return args.stream();
    }

    /**
     * All the complete assignments violating no hard constraint, by enumeration.
     */
    public static List<Assignment> bruteForce(CSP csp) {
        List<Assignment> solutions = new ArrayList<>();
        enumerate(csp, new ArrayList<>(csp.getVariables()), 0, Assignment.empty(), solutions);
        return solutions;
    }

    private static void enumerate(CSP csp, List<Variable> vars, int i, Assignment a, List<Assignment> out) {
        if (i == vars.size()) {
            if (ConstraintEvaluator.isConsistent(csp, a))
                out.add(a);
            return;
        }
        for (Value v : vars.get(i).getDomain()) {
            enumerate(csp, vars, i + 1, a.with(vars.get(i).getId(), v), out);
        }
    }

    /**
     * A random problem over integer variables {@code x0..x(n-1)} with domains drawn in {@code 0..5}
     * and hard binary constraints.
     */
    public static CSP randomBinaryCSP(Random rnd, int nVars, int maxDomain, int nConstraints) {
        CSP csp = makeCSP();
        for (int i = 0; i < nVars; i++) {
            List<Integer> values = new ArrayList<>(List.of(0, 1, 2, 3, 4, 5));
            Collections.shuffle(values, rnd);
            int size = 1 + rnd.nextInt(maxDomain);
            Value[] domain = Value.ints(values.subList(0, size).stream().mapToInt(Integer::intValue).toArray());
            addVariable(csp, new Variable("x" + i, VariableType.INTEGER, domain));
        }
        for (int k = 0; k < nConstraints && nVars > 1; k++) {
            int i = rnd.nextInt(nVars);
            int j = rnd.nextInt(nVars - 1);
            if (j >= i) j++;
            String x = "x" + i;
            String y = "x" + j;
            String id = "c" + k;
            switch (rnd.nextInt(7)) {
                case 0:
                    addConstraint(csp, eq(id, x, y));
                    break;
                case 1:
                    addConstraint(csp, neq(id, x, y));
                    break;
                case 2:
                    addConstraint(csp, lt(id, x, y));
                    break;
                case 3:
                    addConstraint(csp, le(id, x, y));
                    break;
                case 4:
                    addConstraint(csp, gt(id, x, y));
                    break;
                case 5:
                    addConstraint(csp, ge(id, x, y));
                    break;
                default:
                    addConstraint(csp, custom(id, a -> (a.getInt(x) + a.getInt(y)) % 2 == 0, x, y));
            }
        }
        return csp;
    }
}
