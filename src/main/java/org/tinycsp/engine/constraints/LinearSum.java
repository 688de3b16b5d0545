/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.constraints;

import org.tinycsp.engine.core.AbstractConstraint;
import org.tinycsp.engine.core.Assignment;
import org.tinycsp.engine.core.ConstraintType;

import java.util.Arrays;

/**
 * Linear constraint {@code a_0*x_0 + ... + a_n-1*x_n-1 (op) b} over numeric variables.
 * With unit coefficients and {@code op} being {@code =}, it is a {@link ConstraintType#SUM_EQUALS}.
 */
public class LinearSum extends AbstractConstraint {

    private static final double EPSILON = 1e-9;

    private final String[] x;
    private final double[] coefficients;
    private final Relation relation;
    private final double rhs;

    public LinearSum(String id, String[] x, double[] coefficients, Relation relation, double rhs) {
        super(id, typeOf(coefficients, relation), x);
        if (coefficients.length != x.length)
            throw new IllegalArgumentException("constraint " + id + " has " + x.length + " variables but " + coefficients.length + " coefficients");
        this.x = x.clone();
        this.coefficients = coefficients.clone();
        this.relation = relation;
        this.rhs = rhs;
        setDescription(show());
    }

    /**
     * Sum constraint {@code x_0 + ... + x_n-1 = total}.
     */
    public LinearSum(String id, String[] x, double total) {
        this(id, x, ones(x.length), Relation.EQ, total);
    }

    private static double[] ones(int n) {
        double[] a = new double[n];
        Arrays.fill(a, 1.0);
        return a;
    }

    private static ConstraintType typeOf(double[] coefficients, Relation relation) {
        if (relation != Relation.EQ)
            return ConstraintType.LINEAR;
        for (double a : coefficients) {
            if (a != 1.0) return ConstraintType.LINEAR;
        }
        return ConstraintType.SUM_EQUALS;
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public Relation getRelation() {
        return relation;
    }

    public double getRhs() {
        return rhs;
    }

    @Override
    public boolean isSatisfied(Assignment assignment) {
        double lhs = 0;
        for (int i = 0; i < x.length; i++) {
            lhs += coefficients[i] * assignment.get(x[i]).asDouble();
        }
        // reals are summed, equalities are checked up to rounding errors
        switch (relation) {
            case EQ:
                return Math.abs(lhs - rhs) <= EPSILON;
            case NE:
                return Math.abs(lhs - rhs) > EPSILON;
            default:
                return relation.holds(lhs, rhs);
        }
    }

    private String show() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < x.length; i++) {
            if (i > 0) sb.append(" + ");
            if (coefficients[i] != 1.0) sb.append(coefficients[i]).append('*');
            sb.append(x[i]);
        }
        return sb.append(' ').append(relation.symbol()).append(' ').append(rhs).toString();
    }
}
