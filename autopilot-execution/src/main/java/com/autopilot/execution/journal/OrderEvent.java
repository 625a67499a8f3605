package com.autopilot.execution.journal;

import com.autopilot.exchange.model.OrderSide;
import com.autopilot.exchange.model.OrderStatus;
import com.autopilot.execution.order.LiveOrder;

/**
 * Entry order lifecycle: placed, partially filled, filled, cancelled, rejected.
 */
public class OrderEvent extends ExecutionEvent {

    private String action;
    private String orderId;
    private String strategyName;
    private String symbol;
    private OrderSide side;
    private OrderStatus status;
    private double requestedQuantity;
    private double filledQuantity;
    private Double fillPrice;
    private String reason;

    // For Jackson
    public OrderEvent() {}

    private OrderEvent(String action, LiveOrder order) {
        this.action = action;
        this.orderId = order.getOrderId();
        this.strategyName = order.getStrategyName();
        this.symbol = order.getSymbol();
        this.side = order.getSide();
        this.status = order.getStatus();
        this.requestedQuantity = order.getRequestedQuantity();
        this.filledQuantity = order.getFilledQuantity();
        if (order.getFilledQuantity() > 0) {
            this.fillPrice = order.getAvgFillPrice();
        }
    }

    public static OrderEvent placed(LiveOrder order) {
        return new OrderEvent("placed", order);
    }

    public static OrderEvent updated(LiveOrder order) {
        return switch (order.getStatus()) {
            case FILLED -> new OrderEvent("filled", order);
            case CANCELED -> new OrderEvent("cancelled", order);
            case REJECTED -> new OrderEvent("rejected", order);
            case PARTIALLY_FILLED -> new OrderEvent("partially_filled", order);
            case PENDING -> new OrderEvent("pending", order);
        };
    }

    public static OrderEvent failed(LiveOrder order, String reason) {
        OrderEvent event = new OrderEvent("failed", order);
        event.reason = reason;
        return event;
    }

    @Override
    public String getEventType() { return "order"; }

    @Override
    public String getSummary() {
        return String.format("[%s] %s %s %s %.4f %s @ %s",
                action, strategyName, side, symbol, requestedQuantity,
                status, fillPrice != null ? String.format("%.2f", fillPrice) : "pending");
    }

    public String getAction() { return action; }
    public String getOrderId() { return orderId; }
    public String getStrategyName() { return strategyName; }
    public String getSymbol() { return symbol; }
    public OrderSide getSide() { return side; }
    public OrderStatus getStatus() { return status; }
    public double getRequestedQuantity() { return requestedQuantity; }
    public double getFilledQuantity() { return filledQuantity; }
    public Double getFillPrice() { return fillPrice; }
    public String getReason() { return reason; }
}
