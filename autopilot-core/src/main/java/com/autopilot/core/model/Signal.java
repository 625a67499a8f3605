package com.autopilot.core.model;

import java.time.Instant;

/**
 * Result of one strategy evaluation.
 * A signal is actionable only when it is not HOLD and carries a positive quantity and price.
 */
public record Signal(
    String symbol,
    SignalAction action,
    double quantity,
    double price,
    double stopLoss,
    double takeProfit,
    OrderType orderType,
    String strategyName,
    double confidence,
    String reason,
    Instant timestamp
) {
    public static Signal hold(String symbol, String strategyName, String reason) {
        return new Signal(symbol, SignalAction.HOLD, 0, 0, 0, 0, OrderType.MARKET,
                strategyName, 0, reason, Instant.now());
    }

    public boolean isHold() {
        return action == null || action == SignalAction.HOLD;
    }

    public boolean isActionable() {
        return !isHold() && quantity > 0 && price > 0;
    }

    public boolean isLong() {
        return action == SignalAction.BUY;
    }

    public double notionalValue() {
        return quantity * price;
    }

    public Signal withHold(String holdReason) {
        return hold(symbol, strategyName, holdReason);
    }

    public Signal withStrategyName(String name) {
        return new Signal(symbol, action, quantity, price, stopLoss, takeProfit, orderType,
                name, confidence, reason, timestamp);
    }
}
