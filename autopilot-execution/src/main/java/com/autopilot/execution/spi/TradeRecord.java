package com.autopilot.execution.spi;

import com.autopilot.core.model.OrderType;
import com.autopilot.exchange.model.OrderSide;
import com.autopilot.exchange.model.OrderStatus;

import java.time.Instant;

/**
 * One order submission or position close, as handed to the persistence store.
 *
 * @param realizedPnl only set for closes
 */
public record TradeRecord(
    String instanceId,
    String strategyName,
    String symbol,
    OrderSide side,
    OrderType orderType,
    double quantity,
    double price,
    String orderId,
    OrderStatus status,
    double confidence,
    String reason,
    Double realizedPnl,
    Instant timestamp
) {
    public double notionalValue() {
        return quantity * price;
    }
}
