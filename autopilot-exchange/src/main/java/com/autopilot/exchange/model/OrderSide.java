package com.autopilot.exchange.model;

import com.autopilot.core.model.SignalAction;

public enum OrderSide {
    BUY,
    SELL;

    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    public static OrderSide fromAction(SignalAction action) {
        return switch (action) {
            case BUY -> BUY;
            case SELL -> SELL;
            case HOLD -> throw new IllegalArgumentException("HOLD has no order side");
        };
    }

    public static OrderSide parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("side is required");
        }
        return switch (value.trim().toUpperCase()) {
            case "BUY", "LONG", "B" -> BUY;
            case "SELL", "SHORT", "S" -> SELL;
            default -> throw new IllegalArgumentException("Unknown side: " + value);
        };
    }
}
