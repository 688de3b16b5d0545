/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A (possibly partial) mapping from variable identifiers to values.
 * <p>
 * Assignments are immutable: {@link #with(String, Value)} returns an extended copy,
 * so that search branches never share one.
 */
public final class Assignment {

    private static final Assignment EMPTY = new Assignment(new LinkedHashMap<>());

    private final LinkedHashMap<String, Value> values;

    private Assignment(LinkedHashMap<String, Value> values) {
        this.values = values;
    }

    public static Assignment empty() {
        return EMPTY;
    }

    public static Assignment of(Map<String, Value> values) {
        LinkedHashMap<String, Value> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> copy.put(Objects.requireNonNull(k), Objects.requireNonNull(v)));
        return new Assignment(copy);
    }

    /**
     * Shorthand for tests and examples: {@code of("x", Value.of(1), "y", Value.of(2))}.
     */
    public static Assignment of(Object... idValuePairs) {
        if (idValuePairs.length % 2 != 0)
            throw new IllegalArgumentException("expected pairs of (id, value)");
        LinkedHashMap<String, Value> map = new LinkedHashMap<>();
        for (int i = 0; i < idValuePairs.length; i += 2) {
            map.put((String) idValuePairs[i], (Value) idValuePairs[i + 1]);
        }
        return of(map);
    }

    /**
     * Returns a copy of this assignment where {@code variable} is bound to {@code value}.
     */
    public Assignment with(String variable, Value value) {
        LinkedHashMap<String, Value> copy = new LinkedHashMap<>(values);
        copy.put(Objects.requireNonNull(variable), Objects.requireNonNull(value));
        return new Assignment(copy);
    }

    public boolean isAssigned(String variable) {
        return values.containsKey(variable);
    }

    /**
     * Returns the value bound to a variable.
     *
     * @param variable the variable identifier
     * @return the value, never null
     * @throws IllegalStateException if the variable is not assigned
     */
    public Value get(String variable) {
        Value v = values.get(variable);
        if (v == null)
            throw new IllegalStateException("variable " + variable + " is not assigned");
        return v;
    }

    public int getInt(String variable) {
        Value v = get(variable);
        if (v instanceof IntValue)
            return ((IntValue) v).value();
        throw new IllegalStateException("variable " + variable + " is bound to the non integer value " + v);
    }

    public double getDouble(String variable) {
        return get(variable).asDouble();
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * True if every variable of the problem is bound.
     */
    public boolean isComplete(CSP csp) {
        return values.size() == csp.nVariables();
    }

    public Map<String, Value> values() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Evaluates the assignment against the constraints of a problem.
     *
     * @param csp the problem
     * @return the completeness, consistency and the violated and satisfied constraints
     */
    public AssignmentStatus evaluate(CSP csp) {
        return new AssignmentStatus(
                isComplete(csp),
                ConstraintEvaluator.isConsistent(csp, this),
                ConstraintEvaluator.getViolatedConstraints(csp, this),
                ConstraintEvaluator.getSatisfiedConstraints(csp, this));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Assignment && ((Assignment) o).values.equals(values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
