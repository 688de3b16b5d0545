/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class holding the identity, scope, weight and priority of a constraint.
 * Subclasses only provide {@link #isSatisfied(Assignment)}.
 */
public abstract class AbstractConstraint implements Constraint {

    private final String id;
    private final ConstraintType type;
    private final List<String> variables;
    private double weight = 1.0;
    private int priority = 0;
    private String description;

    protected AbstractConstraint(String id, ConstraintType type, String... variables) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
        if (variables.length == 0)
            throw new IllegalArgumentException("constraint " + id + " must range over at least one variable");
        for (String x : variables)
            Objects.requireNonNull(x, "variable id");
        this.variables = Collections.unmodifiableList(Arrays.asList(variables.clone()));
        this.description = type.name().toLowerCase() + " " + this.variables;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public ConstraintType getType() {
        return type;
    }

    @Override
    public List<String> getVariables() {
        return variables;
    }

    @Override
    public double getWeight() {
        return weight;
    }

    /**
     * Sets the weight, 1.0 making the constraint hard.
     *
     * @param weight a weight in [0,1]
     * @return this constraint
     */
    public AbstractConstraint setWeight(double weight) {
        if (!(weight >= 0 && weight <= 1))
            throw new IllegalArgumentException("weight of " + id + " must be in [0,1], got " + weight);
        this.weight = weight;
        return this;
    }

    @Override
    public int getPriority() {
        return priority;
    }

    public AbstractConstraint setPriority(int priority) {
        this.priority = priority;
        return this;
    }

    @Override
    public String getDescription() {
        return description;
    }

    public AbstractConstraint setDescription(String description) {
        this.description = Objects.requireNonNull(description, "description");
        return this;
    }

    @Override
    public String toString() {
        return id + ": " + description + (isHard() ? "" : " (w=" + weight + ")");
    }
}
