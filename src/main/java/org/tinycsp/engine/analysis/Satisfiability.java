/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.analysis;

public enum Satisfiability {
    SATISFIABLE,
    UNSATISFIABLE,
    UNKNOWN
}
