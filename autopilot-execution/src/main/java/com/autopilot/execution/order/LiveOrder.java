package com.autopilot.execution.order;

import com.autopilot.core.model.OrderType;
import com.autopilot.exchange.model.OrderRequest;
import com.autopilot.exchange.model.OrderResponse;
import com.autopilot.exchange.model.OrderSide;
import com.autopilot.exchange.model.OrderStatus;

import java.time.Instant;

/**
 * Local state of a submitted entry order, linked to the exchange order id.
 * Once the status is terminal it never changes again.
 */
public class LiveOrder {

    private final String orderId;
    private final String clientOrderId;
    private final String strategyName;
    private final String symbol;
    private final OrderSide side;
    private final OrderType type;
    private final double requestedQuantity;
    private final double price;
    private final double stopLoss;
    private final int leverage;
    private final Instant createdAt;

    private OrderStatus status;
    private double filledQuantity;
    private double avgFillPrice;
    private Instant updatedAt;

    /**
     * @param price    reference price of the signal that produced the order
     * @param stopLoss initial protective stop for the resulting position, 0 when none
     */
    public LiveOrder(String orderId, String strategyName, OrderRequest request,
                     double price, double stopLoss, int leverage) {
        this.orderId = orderId;
        this.clientOrderId = request.clientOrderId();
        this.strategyName = strategyName;
        this.symbol = request.symbol();
        this.side = request.side();
        this.type = request.type();
        this.requestedQuantity = request.quantity();
        this.price = price;
        this.stopLoss = stopLoss;
        this.leverage = leverage;
        this.status = OrderStatus.PENDING;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    /**
     * Applies an exchange snapshot of this order. Returns true if anything changed.
     */
    public boolean applyUpdate(OrderResponse update) {
        if (isTerminal()) {
            return false;
        }
        boolean changed = update.status() != status || update.filledQuantity() != filledQuantity;
        filledQuantity = update.filledQuantity();
        if (update.avgFillPrice() != null && update.avgFillPrice() > 0) {
            avgFillPrice = update.avgFillPrice();
        } else if (filledQuantity > 0 && avgFillPrice <= 0) {
            avgFillPrice = price;
        }
        status = update.status();
        if (changed) {
            updatedAt = Instant.now();
        }
        return changed;
    }

    public void updateStatus(OrderStatus newStatus) {
        if (isTerminal()) {
            return;
        }
        this.status = newStatus;
        this.updatedAt = Instant.now();
    }

    public String getOrderId() { return orderId; }
    public String getClientOrderId() { return clientOrderId; }
    public String getStrategyName() { return strategyName; }
    public String getSymbol() { return symbol; }
    public OrderSide getSide() { return side; }
    public OrderType getType() { return type; }
    public double getRequestedQuantity() { return requestedQuantity; }
    public double getPrice() { return price; }
    public double getStopLoss() { return stopLoss; }
    public int getLeverage() { return leverage; }
    public OrderStatus getStatus() { return status; }
    public double getFilledQuantity() { return filledQuantity; }
    public double getAvgFillPrice() { return avgFillPrice; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public double getRemainingQuantity() {
        return requestedQuantity - filledQuantity;
    }
}
