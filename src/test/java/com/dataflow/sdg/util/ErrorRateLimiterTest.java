package com.dataflow.sdg.util;

import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import static org.junit.Assert.*;

public class ErrorRateLimiterTest {

    @Test
    public void testSecondErrorWithinIntervalSuppressed() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 60_000);
        RuntimeException error = new RuntimeException("boom");

        assertTrue(limiter.log("scale", "scale failed", error));
        assertFalse(limiter.log("scale", "scale failed", error));
        assertFalse(limiter.log("scale", "scale failed", error));
        assertEquals(2, limiter.suppressed("scale"));
    }

    @Test
    public void testKeysHaveSeparateWindows() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 60_000);
        RuntimeException error = new RuntimeException("boom");

        assertTrue(limiter.log("scale", "scale failed", error));
        assertTrue(limiter.log("sum", "sum failed", error));
        assertEquals(0, limiter.suppressed("sum"));
        assertEquals(0, limiter.suppressed("never-logged"));
    }

    @Test
    public void testSuppressedCountResetAfterWindow() throws InterruptedException {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 1);
        RuntimeException error = new RuntimeException("boom");

        assertTrue(limiter.log("scale", "scale failed", error));
        limiter.log("scale", "scale failed", error);
        Thread.sleep(5);
        assertTrue(limiter.log("scale", "scale failed", error));
        assertEquals(0, limiter.suppressed("scale"));
    }
}
