/*
 * TinyCSP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.search;

import org.tinycsp.util.Stopwatch;

import java.time.Duration;

/**
 * Counters of a search: visited nodes (the search steps), failed nodes, solutions,
 * and whether the search ran to its end or was stopped by a limit.
 */
public class SearchStatistics {

    private long nNodes = 0;
    private long nFailures = 0;
    private int nSolutions = 0;
    private boolean completed = false;
    private final Stopwatch stopwatch = Stopwatch.started();

    void incrNodes() {
        nNodes++;
    }

    void incrFailures() {
        nFailures++;
    }

    void incrSolutions() {
        nSolutions++;
    }

    void setCompleted() {
        completed = true;
    }

    void stop() {
        stopwatch.pause();
    }

    /**
     * Number of visited nodes, including the nodes visited again after a backtrack.
     */
    public long numberOfNodes() {
        return nNodes;
    }

    public long numberOfFailures() {
        return nFailures;
    }

    public int numberOfSolutions() {
        return nSolutions;
    }

    /**
     * True if the search ended by itself, either on a solution or after exhausting
     * the search space, false if a limit interrupted it.
     */
    public boolean isCompleted() {
        return completed;
    }

    /**
     * Time spent since the search started, frozen once it is over.
     */
    public Duration elapsed() {
        return stopwatch.elapsed();
    }

    @Override
    public String toString() {
        return "\n\t#choice: " + nNodes +
                "\n\t#fail: " + nFailures +
                "\n\t#sols : " + nSolutions +
                "\n\tcompleted : " + completed +
                "\n\ttime (ms) : " + stopwatch.getElapsedTimeMillis() + "\n";
    }
}
