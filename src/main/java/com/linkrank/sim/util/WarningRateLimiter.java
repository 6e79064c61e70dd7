package com.linkrank.sim.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits how often a repeated warning reaches the log. Meant for conditions
 * detected inside an iteration loop, which would otherwise log once per
 * iteration. Suppressed occurrences are counted and reported with the next
 * message that gets through.
 */
public class WarningRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE / 2);
    private final AtomicLong suppressed = new AtomicLong();

    public WarningRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /** @return true if the message was logged, false if it was throttled. */
    public boolean warn(String message) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (now - last > minIntervalNanos && lastLogTime.compareAndSet(last, now)) {
            long skipped = suppressed.getAndSet(0);
            if (skipped > 0)
                logger.warn("{} ({} similar warning(s) suppressed)", message, skipped);
            else
                logger.warn(message);
            return true;
        }
        suppressed.incrementAndGet();
        return false;
    }

    /** Occurrences throttled since the last message that was logged. */
    public long suppressedCount() {
        return suppressed.get();
    }
}
