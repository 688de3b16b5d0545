/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.search;

/**
 * Built-in value ordering heuristics, see {@link Searches}.
 */
public enum ValueOrdering {
    /** Domain order. */
    NATURAL,
    /** Values ruling out the fewest neighbor values first. */
    LEAST_CONSTRAINING,
    /** Values violating the fewest constraints first. */
    MIN_CONFLICTS,
    /** Domain shuffled with the solver's random source. */
    RANDOM
}
