/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.propagation;

import org.tinycsp.engine.core.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Record of one domain reduction made by {@link ArcConsistency}.
 *
 * @param step           rank of the reduction in the run, starting at 1
 * @param variable       the variable whose domain was reduced
 * @param originalDomain the domain before the reduction
 * @param reducedDomain  the domain after the reduction, empty if the problem is unsatisfiable
 * @param reason         human readable justification
 * @param neighbor       the variable against which the domain was revised
 * @param constraintIds  the constraints linking the variable to the neighbor
 */
public record ConstraintPropagation(int step,
                                    String variable,
                                    List<Value> originalDomain,
                                    List<Value> reducedDomain,
                                    String reason,
                                    String neighbor,
                                    List<String> constraintIds) {

    public ConstraintPropagation {
        originalDomain = List.copyOf(originalDomain);
        reducedDomain = List.copyOf(reducedDomain);
        constraintIds = List.copyOf(constraintIds);
    }

    public List<Value> removedValues() {
        List<Value> removed = new ArrayList<>(originalDomain);
        removed.removeAll(reducedDomain);
        return removed;
    }

    public boolean isWipeOut() {
        return reducedDomain.isEmpty();
    }
}
