package com.autopilot.exchange.model;

import java.time.Instant;
import java.util.List;

/**
 * Depth snapshot, best levels first.
 */
public record OrderBook(
    String symbol,
    List<Level> bids,
    List<Level> asks,
    Instant timestamp
) {
    public record Level(double price, double size) {}

    public double bestBid() {
        return bids.isEmpty() ? Double.NaN : bids.get(0).price();
    }

    public double bestAsk() {
        return asks.isEmpty() ? Double.NaN : asks.get(0).price();
    }
}
