/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.core;

import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * An objective attached to a {@link CSP}.
 * The backtracking search does not optimize it, the value of the objective is
 * only reported on the solution that was found.
 *
 * @param type       minimize or maximize
 * @param expression a textual form of the objective, for presentation
 * @param evaluator  computes the objective on a complete assignment
 */
public record ObjectiveFunction(Type type, String expression, ToDoubleFunction<Assignment> evaluator) {

    public enum Type {
        MINIMIZE,
        MAXIMIZE
    }

    public ObjectiveFunction {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(evaluator, "evaluator");
    }

    public double evaluate(Assignment assignment) {
        return evaluator.applyAsDouble(assignment);
    }
}
