package com.autopilot.exchange.http;

import java.util.function.LongSupplier;

/**
 * Enforces a minimum delay between consecutive requests.
 */
public class RateLimiter {

    private final long minIntervalMs;
    private final Sleeper sleeper;
    private final LongSupplier clock;
    private long lastRequestAt = Long.MIN_VALUE;

    public RateLimiter(long minIntervalMs, Sleeper sleeper, LongSupplier clock) {
        this.minIntervalMs = minIntervalMs;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public RateLimiter(long minIntervalMs) {
        this(minIntervalMs, Sleeper.SYSTEM, System::currentTimeMillis);
    }

    public synchronized void acquire() throws InterruptedException {
        if (minIntervalMs > 0 && lastRequestAt != Long.MIN_VALUE) {
            long wait = lastRequestAt + minIntervalMs - clock.getAsLong();
            if (wait > 0) {
                sleeper.sleep(wait);
            }
        }
        lastRequestAt = clock.getAsLong();
    }
}
