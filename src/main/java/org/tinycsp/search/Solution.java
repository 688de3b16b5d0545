/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.search;

import org.tinycsp.engine.core.Assignment;
import org.tinycsp.engine.core.AssignmentStatus;

import java.time.Duration;
import java.util.OptionalDouble;

/**
 * Outcome of a search.
 * <p>
 * When {@code isSolution} is false, either the search space was exhausted
 * ({@code statistics.isCompleted()}, the problem is unsatisfiable) or a search limit
 * stopped it (the answer is unknown).
 *
 * @param assignment     the solution, empty when none was found
 * @param status         flags and constraint lists of the assignment
 * @param isSolution     true if a complete consistent assignment was found
 * @param objectiveValue value of the problem's objective on the solution, if any
 * @param statistics     counters of the search
 * @param timeElapsed    wall-clock duration of the search
 * @param method         name of the solving method
 */
public record Solution(Assignment assignment,
                       AssignmentStatus status,
                       boolean isSolution,
                       OptionalDouble objectiveValue,
                       SearchStatistics statistics,
                       Duration timeElapsed,
                       String method) {

    /**
     * Number of visited search nodes.
     */
    public long searchSteps() {
        return statistics.numberOfNodes();
    }

    @Override
    public String toString() {
        return (isSolution ? "solution " + assignment : "no solution")
                + " [" + method + ", " + searchSteps() + " steps, " + timeElapsed.toMillis() + " ms"
                + (statistics.isCompleted() ? "" : ", interrupted") + "]";
    }
}
