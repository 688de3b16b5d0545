/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.search;

import org.tinycsp.engine.core.Assignment;
import org.tinycsp.engine.core.CSP;
import org.tinycsp.engine.core.Variable;

import java.util.Optional;

/**
 * Chooses the next variable to branch on.
 */
@FunctionalInterface
public interface VariableSelector {

    /**
     * @param csp        the problem
     * @param assignment the current partial assignment
     * @return a variable not assigned in {@code assignment}, empty if they all are
     */
    Optional<Variable> select(CSP csp, Assignment assignment);
}
