/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.analysis;

import org.tinycsp.engine.core.CSP;
import org.tinycsp.engine.core.Constraint;
import org.tinycsp.engine.core.Variable;

import java.util.LinkedHashMap;

/**
 * Read-only, heuristic summary of a problem.
 * <p>
 * The figures are indicative only. In particular the tightness is not measured:
 * it is the constant {@link #DEFAULT_TIGHTNESS} (half of the value pairs assumed incompatible),
 * and the complexity is the size of the naive search space {@code O(d^n)} with {@code d} the
 * largest domain size and {@code n} the number of variables.
 * Satisfiability is {@link Satisfiability#UNSATISFIABLE} when a domain is already empty,
 * {@link Satisfiability#SATISFIABLE} when there is no hard constraint at all and
 * {@link Satisfiability#UNKNOWN} otherwise.
 */
public final class ProblemAnalyzer {

    public static final double DEFAULT_TIGHTNESS = 0.5;

    private ProblemAnalyzer() {
    }

    public static Analysis analyze(CSP csp) {
        csp.validate();
        int nVars = csp.nVariables();
        int nCons = csp.nConstraints();
        double density = nVars > 0 ? (double) nCons / nVars : 0;

        int hard = 0;
        int soft = 0;
        for (Constraint c : csp.getConstraints()) {
            if (c.isHard()) hard++;
            else soft++;
        }

        LinkedHashMap<String, Integer> domainSizes = new LinkedHashMap<>();
        int maxDomainSize = 0;
        boolean emptyDomain = false;
        for (Variable x : csp.getVariables()) {
            domainSizes.put(x.getId(), x.domainSize());
            maxDomainSize = Math.max(maxDomainSize, x.domainSize());
            emptyDomain |= x.domainSize() == 0;
        }

        Satisfiability satisfiability;
        if (emptyDomain) satisfiability = Satisfiability.UNSATISFIABLE;
        else if (hard == 0) satisfiability = Satisfiability.SATISFIABLE;
        else satisfiability = Satisfiability.UNKNOWN;

        return new Analysis(nVars, nCons, density, hard, soft, domainSizes, DEFAULT_TIGHTNESS, satisfiability,
                "O(" + maxDomainSize + "^" + nVars + ")");
    }
}
