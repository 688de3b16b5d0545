package org.tinycsp.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StopwatchTest {

    @Test
    public void pausedStopwatchDoesNotAdvance() throws InterruptedException {
        Stopwatch sw = Stopwatch.started();
        assertTrue(sw.isRunning());
        Thread.sleep(5);
        sw.pause();
        assertFalse(sw.isRunning());
        long elapsed = sw.getElapsedTimeNanos();
        assertTrue(elapsed >= 5_000_000);
        Thread.sleep(5);
        assertEquals(elapsed, sw.getElapsedTimeNanos());
        assertEquals(elapsed, sw.elapsed().toNanos());
    }

    @Test
    public void resumeAccumulates() throws InterruptedException {
        Stopwatch sw = new Stopwatch();
        assertEquals(0, sw.getElapsedTimeNanos());
        sw.start();
        Thread.sleep(2);
        sw.pause();
        long first = sw.getElapsedTimeNanos();
        sw.start();
        Thread.sleep(2);
        sw.pause();
        assertTrue(sw.getElapsedTimeNanos() > first);
    }
}
