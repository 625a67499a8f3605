package com.autopilot.exchange.model;

import java.time.Instant;

public record ExchangePosition(
    String symbol,
    OrderSide side,
    double quantity,
    double entryPrice,
    double markPrice,
    double unrealizedPnl,
    double realizedPnl,
    int leverage,
    MarginMode marginMode,
    double liquidationPrice,
    Instant updatedAt
) {
    public boolean isLong() {
        return side == OrderSide.BUY;
    }

    public double notionalValue() {
        return Math.abs(quantity) * markPrice;
    }

    /**
     * Fractional distance between mark and liquidation price, or +infinity when unknown.
     */
    public double liquidationDistance() {
        if (liquidationPrice <= 0 || markPrice <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.abs(markPrice - liquidationPrice) / markPrice;
    }
}
