/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.search;

/**
 * Search strategies that can be requested.
 * Only {@link #BACKTRACKING} is available, the others are reserved names.
 */
public enum SearchStrategy {
    BACKTRACKING,
    FORWARD_CHECKING,
    ARC_CONSISTENCY,
    MIN_CONFLICTS,
    CONSTRAINT_PROPAGATION,
    BRANCH_AND_BOUND
}
