/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.search;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Common search limits. A limit is a predicate on the {@link SearchStatistics},
 * tested before each node is visited; the search stops as soon as it returns true.
 */
public final class SearchLimits {

    private SearchLimits() {
    }

    public static Predicate<SearchStatistics> none() {
        return stats -> false;
    }

    /**
     * At most {@code n} nodes are visited.
     */
    public static Predicate<SearchStatistics> maxSteps(long n) {
        if (n < 0)
            throw new IllegalArgumentException("negative step budget " + n);
        return stats -> stats.numberOfNodes() >= n;
    }

    /**
     * The search stops at the first node visited after the deadline.
     */
    public static Predicate<SearchStatistics> timeout(Duration timeout) {
        return stats -> stats.elapsed().compareTo(timeout) >= 0;
    }
}
