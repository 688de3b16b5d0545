/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.core;

import org.tinycsp.util.exception.InvalidCSPException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A constraint satisfaction problem: variables with finite domains and constraints over them.
 * <p>
 * Variables are iterated in insertion order. The order of the constraints is kept,
 * it drives the seeding of arc consistency and the ties of the orderings.
 * <p>
 * A problem is not thread-safe. Arc consistency updates the domains in place, so
 * work on a {@link #copy()} to solve the same problem concurrently or to keep the
 * original domains.
 */
public class CSP {

    private final LinkedHashMap<String, Variable> variables = new LinkedHashMap<>();
    private final List<Constraint> constraints = new ArrayList<>();
    private final LinkedHashMap<String, Constraint> constraintsById = new LinkedHashMap<>();
    private ObjectiveFunction objective;

    /**
     * Adds a variable.
     *
     * @param variable the variable, its identifier must be new in this problem
     * @throws InvalidCSPException if a variable with the same identifier exists
     */
    public void addVariable(Variable variable) {
        if (variables.containsKey(variable.getId()))
            throw new InvalidCSPException("duplicate variable " + variable.getId());
        variables.put(variable.getId(), variable);
    }

    /**
     * Adds a constraint and records its identifier in the back-references
     * of the variables it ranges over.
     *
     * @param constraint the constraint, its variables must already be in the problem
     * @throws InvalidCSPException if the identifier is already used or a variable is unknown
     */
    public void addConstraint(Constraint constraint) {
        if (constraintsById.containsKey(constraint.getId()))
            throw new InvalidCSPException("duplicate constraint " + constraint.getId());
        for (String x : constraint.getVariables()) {
            if (!variables.containsKey(x))
                throw new InvalidCSPException("constraint " + constraint.getId() + " refers to the unknown variable " + x);
        }
        constraints.add(constraint);
        constraintsById.put(constraint.getId(), constraint);
        // a variable listed twice in the scope gets a single back-reference
        for (String x : new LinkedHashSet<>(constraint.getVariables())) {
            variables.get(x).addConstraintReference(constraint.getId());
        }
    }

    public Variable getVariable(String id) {
        Variable v = variables.get(id);
        if (v == null)
            throw new InvalidCSPException("unknown variable " + id);
        return v;
    }

    public boolean hasVariable(String id) {
        return variables.containsKey(id);
    }

    public Collection<Variable> getVariables() {
        return Collections.unmodifiableCollection(variables.values());
    }

    public int nVariables() {
        return variables.size();
    }

    public List<Constraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public Constraint getConstraint(String id) {
        Constraint c = constraintsById.get(id);
        if (c == null)
            throw new InvalidCSPException("unknown constraint " + id);
        return c;
    }

    public int nConstraints() {
        return constraints.size();
    }

    public Optional<ObjectiveFunction> getObjective() {
        return Optional.ofNullable(objective);
    }

    public void setObjective(ObjectiveFunction objective) {
        this.objective = objective;
    }

    /**
     * Checks the invariants of the problem: every constraint ranges over known variables and
     * every back-reference of a variable names a constraint of the problem that mentions it.
     *
     * @throws InvalidCSPException on the first broken invariant
     */
    public void validate() {
        for (Constraint c : constraints) {
            if (c.getVariables().isEmpty())
                throw new InvalidCSPException("constraint " + c.getId() + " has an empty scope");
            for (String x : c.getVariables()) {
                if (!variables.containsKey(x))
                    throw new InvalidCSPException("constraint " + c.getId() + " refers to the unknown variable " + x);
            }
        }
        for (Variable v : variables.values()) {
            Set<String> seen = new HashSet<>();
            for (String cid : v.getConstraints()) {
                Constraint c = constraintsById.get(cid);
                if (c == null)
                    throw new InvalidCSPException("variable " + v.getId() + " refers to the unknown constraint " + cid);
                if (!c.getVariables().contains(v.getId()))
                    throw new InvalidCSPException("constraint " + cid + " does not mention variable " + v.getId());
                if (!seen.add(cid))
                    throw new InvalidCSPException("variable " + v.getId() + " refers twice to constraint " + cid);
            }
        }
    }

    /**
     * Deep copy of the problem: variables and their domains are copied,
     * constraints and the objective are shared (they are not mutated).
     */
    public CSP copy() {
        CSP copy = new CSP();
        for (Variable v : variables.values()) {
            copy.variables.put(v.getId(), v.copy());
        }
        copy.constraints.addAll(constraints);
        copy.constraintsById.putAll(constraintsById);
        copy.objective = objective;
        return copy;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("CSP(").append(variables.size()).append(" variables, ").append(constraints.size()).append(" constraints)\n");
        for (Variable v : variables.values())
            sb.append("  ").append(v).append('\n');
        for (Constraint c : constraints)
            sb.append("  ").append(c).append('\n');
        return sb.toString();
    }
}
