package com.dataflow.sdg.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of error logging, separately for each key (typically the
 * name of a failing node).
 *
 * <p>
 * A node that fails for every event of a run would otherwise flood the log;
 * with one window per key a persistently failing node cannot hide the first
 * failure of another one. Suppressed messages are counted and reported with
 * the next message that gets through.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();

    private static final class Window {
        final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE);
        final AtomicLong suppressed = new AtomicLong();
    }

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /** @return true if the message was logged, false if it was suppressed. */
    public boolean log(String key, String message, Throwable t) {
        Window window = windows.computeIfAbsent(key, k -> new Window());
        long now = System.nanoTime();
        long last = window.lastLogTime.get();
        // Only one thread logs per interval and key
        if ((last == Long.MIN_VALUE || now - last > minIntervalNanos)
                && window.lastLogTime.compareAndSet(last, now)) {
            long skipped = window.suppressed.getAndSet(0);
            if (skipped > 0)
                logger.error("{} ({} similar errors suppressed)", message, skipped, t);
            else
                logger.error(message, t);
            return true;
        }
        window.suppressed.incrementAndGet();
        return false;
    }

    /** Total number of suppressed messages not yet reported for a key. */
    public long suppressed(String key) {
        Window window = windows.get(key);
        return window == null ? 0 : window.suppressed.get();
    }
}
