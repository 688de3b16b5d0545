/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.core;

public record IntValue(int value) implements Value {

    @Override
    public VariableType type() {
        return VariableType.INTEGER;
    }

    @Override
    public boolean isNumeric() {
        return true;
    }

    @Override
    public double asDouble() {
        return value;
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
