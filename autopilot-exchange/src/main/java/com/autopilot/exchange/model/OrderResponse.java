package com.autopilot.exchange.model;

import com.autopilot.core.model.OrderType;

import java.time.Instant;

public record OrderResponse(
    String orderId,
    String clientOrderId,
    String symbol,
    OrderSide side,
    OrderType type,
    OrderStatus status,
    double requestedQuantity,
    double filledQuantity,
    Double avgFillPrice,
    Instant createdAt,
    Instant updatedAt
) {
    public boolean isFilled() {
        return status == OrderStatus.FILLED;
    }

    public boolean isOpen() {
        return !status.isTerminal();
    }

    public double remainingQuantity() {
        return requestedQuantity - filledQuantity;
    }
}
