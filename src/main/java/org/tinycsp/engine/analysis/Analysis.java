/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structural summary of a problem, computed by {@link ProblemAnalyzer}.
 *
 * @param totalVariables      number of variables
 * @param totalConstraints    number of constraints
 * @param constraintDensity   constraints per variable, 0 without variables
 * @param hardConstraints     constraints of weight 1
 * @param softConstraints     constraints of weight below 1
 * @param domainSizes         current domain size of each variable, in problem order
 * @param tightness           placeholder estimate of the fraction of incompatible value pairs
 * @param satisfiability      what is known without searching
 * @param estimatedComplexity size of the search space, as {@code O(d^n)}
 */
public record Analysis(int totalVariables,
                       int totalConstraints,
                       double constraintDensity,
                       int hardConstraints,
                       int softConstraints,
                       Map<String, Integer> domainSizes,
                       double tightness,
                       Satisfiability satisfiability,
                       String estimatedComplexity) {

    public Analysis {
        domainSizes = Collections.unmodifiableMap(new LinkedHashMap<>(domainSizes));
    }
}
