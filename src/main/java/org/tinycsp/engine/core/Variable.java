/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A variable of a {@link CSP}.
 * <p>
 * The domain is an ordered list of distinct values, all of the declared {@link VariableType}.
 * Real values must be finite.
 * It is the only part of a problem that is updated destructively, by
 * {@link #setDomain(List)} (used by arc consistency).
 * The variable also keeps the identifiers of the constraints that mention it,
 * these back-references are maintained by {@link CSP#addConstraint(Constraint)}.
 */
public class Variable {

    private final String id;
    private final String name;
    private final VariableType type;
    private List<Value> domain;
    private Value currentValue;
    private final List<String> constraints = new ArrayList<>();

    /**
     * Creates a variable.
     *
     * @param id     the identifier, unique in a problem
     * @param name   the display name used by lexicographic ordering
     * @param type   the declared type, every value of the domain must have it
     * @param domain the initial domain
     * @throws IllegalArgumentException if a value has a type different from {@code type}
     *                                  or appears twice
     */
    public Variable(String id, String name, VariableType type, List<Value> domain) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name == null ? id : name;
        this.type = Objects.requireNonNull(type, "type");
        this.domain = checkDomain(domain);
    }

    public Variable(String id, VariableType type, Value... domain) {
        this(id, id, type, Arrays.asList(domain));
    }

    private List<Value> checkDomain(List<Value> values) {
        List<Value> checked = new ArrayList<>(values.size());
        for (Value v : values) {
            Objects.requireNonNull(v, "domain value");
            if (v.type() != type)
                throw new IllegalArgumentException("value " + v + " of type " + v.type() + " in the domain of " + id + " of type " + type);
            if (v instanceof RealValue && !Double.isFinite(((RealValue) v).value()))
                throw new IllegalArgumentException("non-finite value " + v + " in the domain of " + id);
            if (checked.contains(v))
                throw new IllegalArgumentException("value " + v + " appears twice in the domain of " + id);
            checked.add(v);
        }
        return checked;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public VariableType getType() {
        return type;
    }

    /**
     * Returns the current domain, in its order.
     *
     * @return an unmodifiable view of the domain
     */
    public List<Value> getDomain() {
        return Collections.unmodifiableList(domain);
    }

    public int domainSize() {
        return domain.size();
    }

    public boolean contains(Value v) {
        return domain.contains(v);
    }

    /**
     * Replaces the domain of the variable.
     *
     * @param newDomain the new domain, checked like the initial one
     */
    public void setDomain(List<Value> newDomain) {
        this.domain = checkDomain(newDomain);
    }

    public Optional<Value> getCurrentValue() {
        return Optional.ofNullable(currentValue);
    }

    public void setCurrentValue(Value value) {
        if (value != null && value.type() != type)
            throw new IllegalArgumentException("value " + value + " is not of type " + type);
        this.currentValue = value;
    }

    /**
     * Returns the identifiers of the constraints that mention this variable,
     * in the order they were added to the problem.
     *
     * @return an unmodifiable view of the back-references
     */
    public List<String> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    /**
     * Number of constraints mentioning the variable.
     */
    public int degree() {
        return constraints.size();
    }

    void addConstraintReference(String constraintId) {
        constraints.add(constraintId);
    }

    /**
     * Deep copy: the domain and the back-references are copied, values are shared (immutable).
     */
    public Variable copy() {
        Variable v = new Variable(id, name, type, domain);
        v.currentValue = currentValue;
        v.constraints.addAll(constraints);
        return v;
    }

    @Override
    public String toString() {
        return name + " " + domain;
    }
}
