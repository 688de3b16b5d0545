/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.core;

import java.util.Objects;

/**
 * A categorical value, identified by its label.
 *
 * @param label the non-null label of the category
 */
public record CategoryValue(String label) implements Value {

    public CategoryValue {
        Objects.requireNonNull(label, "label");
    }

    @Override
    public VariableType type() {
        return VariableType.CATEGORICAL;
    }

    @Override
    public String toString() {
        return label;
    }
}
