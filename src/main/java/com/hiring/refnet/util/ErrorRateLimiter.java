package com.hiring.refnet.util;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.Logger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits how often a logger emits a recurring message.
 * Bulk loads that keep hitting the same rejection would otherwise flood the
 * log.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final Level level;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this(logger, Level.ERROR, minIntervalMillis);
    }

    public ErrorRateLimiter(Logger logger, Level level, long minIntervalMillis) {
        this.logger = logger;
        this.level = level;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /**
     * Logs {@code message} unless another message was logged less than the
     * configured interval ago.
     *
     * @return true if the message was written
     */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (last == Long.MIN_VALUE || now - last > minIntervalNanos) {
            // only one thread logs per interval
            if (lastLogTime.compareAndSet(last, now)) {
                long skipped = suppressed.getAndSet(0);
                if (skipped > 0)
                    logger.log(level, "{} (Throttled, {} suppressed)", message, skipped, t);
                else
                    logger.log(level, message, t);
                return true;
            }
        }
        suppressed.incrementAndGet();
        return false;
    }

    /** Messages dropped since the last one written. */
    public long suppressedCount() {
        return suppressed.get();
    }
}
