package com.autopilot.exchange.http;

import com.autopilot.exchange.model.TradingConfig;

/**
 * Retry budget for transient failures. Rate-limit responses are budgeted separately.
 *
 * @param maxAttempts         total attempts for timeouts, connection errors and 5xx responses
 * @param backoffBase         sleep between attempts is {@code backoffBase^attempt} seconds (attempt is 0-based)
 * @param maxRateLimitRetries consecutive 429 responses tolerated before giving up
 * @param defaultRetryAfterMs wait used when a 429 carries no Retry-After header
 */
public record RetryPolicy(int maxAttempts, double backoffBase, int maxRateLimitRetries, long defaultRetryAfterMs) {

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1");
        if (backoffBase < 1) throw new IllegalArgumentException("backoffBase must be at least 1");
    }

    public static RetryPolicy fromConfig(TradingConfig.ExchangeConfig config) {
        return new RetryPolicy(config.getRetryAttempts(), config.getRetryBackoff(),
                config.getMaxRateLimitRetries(), config.getDefaultRetryAfterSeconds() * 1000);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 1.5, 5, 60_000);
    }

    public long backoffMillis(int attempt) {
        return Math.round(Math.pow(backoffBase, attempt) * 1000);
    }
}
