package com.autopilot.execution.position;

import com.autopilot.exchange.model.OrderSide;

/**
 * Positions are tracked per symbol and direction, so a long and a short on one pair never merge.
 */
public record PositionKey(String symbol, OrderSide side) {

    public PositionKey {
        if (symbol == null || symbol.isBlank()) throw new IllegalArgumentException("symbol is required");
        if (side == null) throw new IllegalArgumentException("side is required");
    }

    @Override
    public String toString() {
        return symbol + ":" + side;
    }
}
