/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.core;

/**
 * Declared kind of a {@link Variable}. Every value of the domain
 * of a variable must be of the kind declared for it.
 */
public enum VariableType {
    INTEGER,
    REAL,
    BOOLEAN,
    CATEGORICAL,
    SET
}
