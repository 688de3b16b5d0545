/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.util.exception;

/**
 * Raised when a declared feature (for instance a search strategy) has no implementation yet.
 */
public class NotYetImplementedException extends RuntimeException {

    public NotYetImplementedException(String message) {
        super(message);
    }
}
