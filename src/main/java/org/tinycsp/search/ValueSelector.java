/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.search;

import org.tinycsp.engine.core.Assignment;
import org.tinycsp.engine.core.CSP;
import org.tinycsp.engine.core.Value;
import org.tinycsp.engine.core.Variable;

import java.util.List;

/**
 * Orders the values to try for the variable selected by a {@link VariableSelector}.
 */
@FunctionalInterface
public interface ValueSelector {

    /**
     * @param csp        the problem
     * @param x          the variable to branch on
     * @param assignment the current partial assignment, not binding {@code x}
     * @return a permutation of the current domain of {@code x}
     */
    List<Value> order(CSP csp, Variable x, Assignment assignment);
}
