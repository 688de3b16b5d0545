/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.core;

public record BoolValue(boolean value) implements Value {

    @Override
    public VariableType type() {
        return VariableType.BOOLEAN;
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
