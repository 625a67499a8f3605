package com.autopilot.execution.journal;

import com.autopilot.exchange.model.OrderSide;
import com.autopilot.execution.position.ExitReason;
import com.autopilot.execution.position.ManagedPosition;

/**
 * Position lifecycle: opened, stop moved, closed.
 */
public class PositionEvent extends ExecutionEvent {

    private String action;
    private String strategyName;
    private String symbol;
    private OrderSide side;
    private double size;
    private double entryPrice;
    private double stopLossPrice;
    private Double exitPrice;
    private Double realizedPnl;
    private ExitReason exitReason;

    // For Jackson
    public PositionEvent() {}

    private PositionEvent(String action, ManagedPosition position) {
        this.action = action;
        this.strategyName = position.getStrategyName();
        this.symbol = position.getSymbol();
        this.side = position.getSide();
        this.size = position.getSize();
        this.entryPrice = position.getEntryPrice();
        this.stopLossPrice = position.getStopLossPrice();
    }

    public static PositionEvent opened(ManagedPosition position) {
        return new PositionEvent("opened", position);
    }

    public static PositionEvent stopMoved(ManagedPosition position) {
        return new PositionEvent("stop_moved", position);
    }

    public static PositionEvent closed(ManagedPosition position, double exitPrice, double pnl) {
        PositionEvent event = new PositionEvent("closed", position);
        event.exitPrice = exitPrice;
        event.realizedPnl = pnl;
        event.exitReason = position.getExitReason();
        return event;
    }

    @Override
    public String getEventType() { return "position"; }

    @Override
    public String getSummary() {
        if ("closed".equals(action)) {
            return String.format("[%s] %s %s %s %s PnL=%.2f",
                    action, strategyName, symbol, side, exitReason, realizedPnl);
        }
        return String.format("[%s] %s %s %s %.4f @ %.2f stop=%.2f",
                action, strategyName, symbol, side, size, entryPrice, stopLossPrice);
    }

    public String getAction() { return action; }
    public String getStrategyName() { return strategyName; }
    public String getSymbol() { return symbol; }
    public OrderSide getSide() { return side; }
    public double getSize() { return size; }
    public double getEntryPrice() { return entryPrice; }
    public double getStopLossPrice() { return stopLossPrice; }
    public Double getExitPrice() { return exitPrice; }
    public Double getRealizedPnl() { return realizedPnl; }
    public ExitReason getExitReason() { return exitReason; }
}
