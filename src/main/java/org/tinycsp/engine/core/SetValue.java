/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.core;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A set of integers taken as a single value, for set-valued variables.
 * Two set values are equal if they hold the same elements, whatever their order.
 *
 * @param elements the elements, copied and wrapped as unmodifiable
 */
public record SetValue(Set<Integer> elements) implements Value {

    public SetValue {
        elements = Collections.unmodifiableSet(new LinkedHashSet<>(elements));
    }

    public boolean contains(int v) {
        return elements.contains(v);
    }

    public int size() {
        return elements.size();
    }

    @Override
    public VariableType type() {
        return VariableType.SET;
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
