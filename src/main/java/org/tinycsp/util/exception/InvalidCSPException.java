/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.util.exception;

/**
 * Raised when a problem is malformed: duplicate identifiers,
 * constraints over unknown variables or broken back-references.
 */
public class InvalidCSPException extends RuntimeException {

    public InvalidCSPException(String message) {
        super(message);
    }
}
