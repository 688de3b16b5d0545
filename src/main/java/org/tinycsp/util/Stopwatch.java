package org.tinycsp.util;

import java.time.Duration;

/**
 * Measures wall-clock time, excluding the periods where it is paused.
 */
public class Stopwatch {
    private long startTime = 0;
    private long accumulated = 0;
    private boolean running = false;

    public static Stopwatch started() {
        Stopwatch sw = new Stopwatch();
        sw.start();
        return sw;
    }

    public void start() {
        if (!running) {
            startTime = System.nanoTime();
            running = true;
        }
    }

    public void pause() {
        if (running) {
            accumulated += System.nanoTime() - startTime;
            running = false;
        }
    }

    public boolean isRunning() {
        return running;
    }

    public long getElapsedTimeNanos() {
        return running ? accumulated + (System.nanoTime() - startTime) : accumulated;
    }

    public long getElapsedTimeMillis() {
        return getElapsedTimeNanos() / 1_000_000;
    }

    public Duration elapsed() {
        return Duration.ofNanos(getElapsedTimeNanos());
    }
}
