/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.examples;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.api.Test;
import org.tinycsp.CSPSolverTest;
import org.tinycsp.engine.core.Assignment;
import org.tinycsp.engine.core.CSP;
import org.tinycsp.search.Solution;
import org.tinycsp.search.ValueOrdering;
import org.tinycsp.search.VariableOrdering;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.tinycsp.CSPFactory.*;

public class NQueensTest extends CSPSolverTest {

    private static void assertNoAttack(int n, Assignment a) {
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                int ri = a.getInt("q" + i);
                int rj = a.getInt("q" + j);
                assertNotEquals(ri, rj);
                assertNotEquals(j - i, Math.abs(ri - rj));
            }
        }
    }

    @Test
    public void fourQueensHasTwoSolutions() {
        List<Assignment> solutions = bruteForce(NQueens.model(4));
        assertEquals(2, solutions.size());
        for (Assignment a : solutions)
            assertNoAttack(4, a);
    }

    @Test
    public void threeQueensIsUnsatisfiable() {
        Solution solution = solveBacktracking(NQueens.model(3));
        assertFalse(solution.isSolution());
        assertTrue(solution.statistics().isCompleted());
        assertTrue(solution.assignment().isEmpty());
        assertEquals(3, solution.status().violatedConstraints().size());
    }

    @ParameterizedTest
    @MethodSource("getOrderings")
    public void eightQueens(VariableOrdering vo, ValueOrdering vl) {
        CSP csp = NQueens.model(8);
        assertEquals(28, csp.nConstraints());
        Solution solution = solveBacktracking(csp, vo, vl, new Random(0));
        assertTrue(solution.isSolution());
        assertTrue(solution.assignment().isComplete(csp));
        assertNoAttack(8, solution.assignment());
    }

    @Test
    public void arcConsistencyThenSearch() {
        CSP csp = NQueens.model(6);
        Solution solution = solveWithArcConsistency(csp, VariableOrdering.MIN_REMAINING_VALUES, ValueOrdering.NATURAL, new Random(0));
        assertTrue(solution.isSolution());
        assertNoAttack(6, solution.assignment());
    }
}
