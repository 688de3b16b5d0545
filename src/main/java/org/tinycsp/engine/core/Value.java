/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.core;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;

/**
 * A value that a {@link Variable} can take.
 * <p>
 * The set of implementations is closed: {@link IntValue}, {@link RealValue},
 * {@link BoolValue}, {@link CategoryValue} and {@link SetValue}, one per {@link VariableType}.
 * Values are immutable and compared structurally.
 */
public interface Value {

    /**
     * Returns the kind of this value.
     *
     * @return the variable type this value belongs to
     */
    VariableType type();

    /**
     * Returns true if the value is numeric, that is an integer or a real.
     *
     * @return true for {@link IntValue} and {@link RealValue}
     */
    default boolean isNumeric() {
        return false;
    }

    /**
     * Returns the numeric view of the value.
     *
     * @return the value as a double
     * @throws IllegalStateException if the value is not numeric
     */
    default double asDouble() {
        throw new IllegalStateException("value " + this + " of type " + type() + " is not numeric");
    }

    static Value of(int v) {
        return new IntValue(v);
    }

    static Value of(double v) {
        return new RealValue(v);
    }

    static Value of(boolean v) {
        return new BoolValue(v);
    }

    static Value of(String category) {
        return new CategoryValue(category);
    }

    static Value ofSet(int... elements) {
        LinkedHashSet<Integer> set = new LinkedHashSet<>();
        for (int e : elements) set.add(e);
        return new SetValue(set);
    }

    static Value ofSet(Collection<Integer> elements) {
        return new SetValue(new LinkedHashSet<>(elements));
    }

    /**
     * Builds the integer values {@code from..to} (both included), none if {@code to < from}.
     *
     * @throws IllegalArgumentException if there are more values than an array can hold
     */
    static Value[] range(int from, int to) {
        long size = Math.max(0L, (long) to - from + 1);
        if (size > Integer.MAX_VALUE - 8)
            throw new IllegalArgumentException("range " + from + ".." + to + " is too large");
        Value[] values = new Value[(int) size];
        for (int i = 0; i < values.length; i++) {
            values[i] = new IntValue(from + i);
        }
        return values;
    }

    static Value[] ints(int... values) {
        return Arrays.stream(values).mapToObj(IntValue::new).toArray(Value[]::new);
    }

    static Value[] categories(String... values) {
        return Arrays.stream(values).map(CategoryValue::new).toArray(Value[]::new);
    }
}
