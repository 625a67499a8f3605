package com.autopilot.exchange.http;

/**
 * Millisecond timestamp used when signing requests.
 */
@FunctionalInterface
public interface TimestampSource {

    long currentTimeMillis();

    static TimestampSource local() {
        return System::currentTimeMillis;
    }
}
