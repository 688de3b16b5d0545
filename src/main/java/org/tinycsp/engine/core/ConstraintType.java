/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.core;

/**
 * Semantic kind of a {@link Constraint}.
 */
public enum ConstraintType {
    EQUALITY,        // x = y
    INEQUALITY,      // x != y
    LESS_THAN,       // x < y
    LESS_EQUAL,      // x <= y
    GREATER_THAN,    // x > y
    GREATER_EQUAL,   // x >= y
    IN_SET,          // x in S
    NOT_IN_SET,      // x not in S
    ALL_DIFFERENT,
    SUM_EQUALS,      // sum x_i = c
    LINEAR,          // sum a_i * x_i (op) b
    CUSTOM
}
