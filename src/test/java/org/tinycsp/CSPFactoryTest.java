/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.tinycsp.engine.core.CSP;
import org.tinycsp.engine.core.Value;
import org.tinycsp.engine.core.VariableType;
import org.tinycsp.search.SearchStrategy;
import org.tinycsp.search.Solution;
import org.tinycsp.search.ValueOrdering;
import org.tinycsp.search.VariableOrdering;
import org.tinycsp.util.exception.InvalidCSPException;
import org.tinycsp.util.exception.NotYetImplementedException;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.tinycsp.CSPFactory.*;

public class CSPFactoryTest extends CSPSolverTest {

    private static CSP lessThan() {
        CSP csp = makeCSP();
        makeIntVar(csp, "X", 1, 3);
        makeIntVar(csp, "Y", 1, 3);
        addConstraint(csp, lt("lt", "X", "Y"));
        return csp;
    }

    @Test
    public void variableBuilders() {
        CSP csp = makeCSP();
        assertEquals(List.of(Value.ints(2, 3, 4)), makeIntVar(csp, "r", 2, 4).getDomain());
        assertEquals(List.of(Value.ints(7, 1, 5)), makeIntVar(csp, "v", 7, 1, 5).getDomain());
        assertEquals(VariableType.REAL, makeRealVar(csp, "f", 0.5, 1.5).getType());
        assertEquals(List.of(Value.of(false), Value.of(true)), makeBoolVar(csp, "b").getDomain());
        assertEquals(VariableType.CATEGORICAL, makeCategoricalVar(csp, "c", "a", "b").getType());
        assertEquals(2, makeSetVar(csp, "s", Value.ofSet(1), Value.ofSet(1, 2)).domainSize());
        assertEquals(6, csp.nVariables());
        assertThrows(InvalidCSPException.class, () -> makeBoolVar(csp, "b"));
    }

    @Test
    public void unknownVariableIsRejected() {
        CSP csp = lessThan();
        assertThrows(InvalidCSPException.class, () -> addConstraint(csp, neq("n", "X", "Z")));
        assertThrows(InvalidCSPException.class, () -> addConstraint(csp, neq("lt", "X", "Y")));
        assertEquals(1, csp.nConstraints());
    }

    @Test
    public void backtrackingStrategy() {
        Solution solution = solve(lessThan(), SearchStrategy.BACKTRACKING,
                VariableOrdering.FIRST_UNASSIGNED, ValueOrdering.NATURAL, new Random(0));
        assertTrue(solution.isSolution());
        assertEquals(1, solution.assignment().getInt("X"));
        assertEquals(2, solution.assignment().getInt("Y"));
    }

    @ParameterizedTest
    @EnumSource(value = SearchStrategy.class, names = "BACKTRACKING", mode = EnumSource.Mode.EXCLUDE)
    public void otherStrategiesAreNotAvailable(SearchStrategy strategy) {
        assertThrows(NotYetImplementedException.class, () -> solve(lessThan(), strategy,
                VariableOrdering.FIRST_UNASSIGNED, ValueOrdering.NATURAL, new Random(0)));
    }

    @Test
    public void arcConsistencyOnACopy() {
        CSP csp = lessThan();
        Solution solution = solveWithArcConsistency(csp, VariableOrdering.FIRST_UNASSIGNED, ValueOrdering.NATURAL, new Random(0));
        assertTrue(solution.isSolution());
        assertEquals("ac3+backtracking", solution.method());
        assertEquals(3, csp.getVariable("X").domainSize());
        assertEquals(3, csp.getVariable("Y").domainSize());
    }

    @Test
    public void arcConsistencyDetectsUnsatisfiability() {
        CSP csp = makeCSP();
        makeIntVar(csp, "x", 1);
        makeIntVar(csp, "y", 1);
        addConstraint(csp, neq("xy", "x", "y"));
        Solution solution = solveWithArcConsistency(csp, VariableOrdering.MIN_REMAINING_VALUES, ValueOrdering.NATURAL, new Random(0));
        assertFalse(solution.isSolution());
        assertTrue(solution.statistics().isCompleted());
        assertEquals(List.of("xy"), solution.status().violatedConstraints());
    }

    @Test
    public void sameAnswerWithAndWithoutArcConsistency() {
        Random rnd = new Random(3);
        for (int iter = 0; iter < 100; iter++) {
            CSP csp = randomBinaryCSP(rnd, 4, 4, 5);
            boolean satisfiable = !bruteForce(csp).isEmpty();
            assertEquals(satisfiable, solveBacktracking(csp).isSolution());
            assertEquals(satisfiable, solveWithArcConsistency(csp, VariableOrdering.MIN_REMAINING_VALUES,
                    ValueOrdering.LEAST_CONSTRAINING, new Random(0)).isSolution());
        }
    }
}
