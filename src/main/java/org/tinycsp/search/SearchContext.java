/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.search;

import java.util.function.Predicate;

/**
 * State shared by the nodes of one search: statistics and the limit checked at every node.
 * A fresh context is created for each call to {@link BacktrackingSolver#solve(org.tinycsp.engine.core.CSP)}.
 */
final class SearchContext {

    private final SearchStatistics statistics = new SearchStatistics();
    private final Predicate<SearchStatistics> limit;
    private boolean stopped = false;

    SearchContext(Predicate<SearchStatistics> limit) {
        this.limit = limit;
    }

    /**
     * Called on entry of each node. Returns false, and marks the search as stopped,
     * if the limit is reached; otherwise counts the node.
     */
    boolean enterNode() {
        if (stopped || limit.test(statistics)) {
            stopped = true;
            return false;
        }
        statistics.incrNodes();
        return true;
    }

    boolean isStopped() {
        return stopped;
    }

    SearchStatistics statistics() {
        return statistics;
    }
}
