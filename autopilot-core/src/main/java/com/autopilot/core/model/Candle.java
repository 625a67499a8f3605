package com.autopilot.core.model;

/**
 * OHLCV candle as returned by the exchange kline endpoint.
 * Timestamp is the candle open time in epoch milliseconds.
 */
public record Candle(
    long timestamp,
    double open,
    double high,
    double low,
    double close,
    double volume
) {
    public boolean isBullish() {
        return close > open;
    }

    public boolean isBearish() {
        return close < open;
    }

    public double range() {
        return high - low;
    }
}
