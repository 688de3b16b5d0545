/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.search;

/**
 * Built-in variable selection heuristics, see {@link Searches}.
 */
public enum VariableOrdering {
    /** Ascending display name. */
    LEXICOGRAPHIC,
    /** Smallest current domain first (MRV). */
    MIN_REMAINING_VALUES,
    /** Most constraints mentioning the variable. */
    DEGREE_HEURISTIC,
    /** Most distinct neighbors in the constraint graph. */
    MAX_DEGREE,
    /** Uniform pick with the solver's random source. */
    RANDOM,
    /** First unassigned variable in problem order. */
    FIRST_UNASSIGNED
}
