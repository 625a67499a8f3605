package com.autopilot.execution.position;

import com.autopilot.exchange.model.OrderSide;

import java.time.Instant;

/**
 * Open position plus the exit ladder state the state machine keeps for it.
 * Mutated only by the owning instance's loop thread.
 */
public class ManagedPosition {

    /** What last placed the stop, which decides how a stop-out is reported. */
    public enum StopSource {
        INITIAL,
        BREAKEVEN,
        TRAILING
    }

    private final String strategyName;
    private final String symbol;
    private final OrderSide side;
    private final int leverage;
    private final Instant openedAt;

    private double size;
    private double entryPrice;
    private double markPrice;
    private double unrealizedPnl;
    private double realizedPnl;
    private double liquidationPrice;

    private double stopLossPrice;
    private StopSource stopSource = StopSource.INITIAL;
    private boolean breakevenMoved;
    private boolean tp1Hit;
    private boolean tp2Hit;
    private boolean trailingEnabled;
    private double trailingStopPrice;
    private double trailingReferencePrice;

    private boolean exitTriggered;
    private ExitReason exitReason;
    private String pendingCloseOrderId;
    private boolean closed;

    public ManagedPosition(String strategyName, String symbol, OrderSide side, double size,
                           double entryPrice, double stopLossPrice, int leverage) {
        if (size <= 0) throw new IllegalArgumentException("size must be positive");
        if (entryPrice <= 0) throw new IllegalArgumentException("entryPrice must be positive");
        this.strategyName = strategyName;
        this.symbol = symbol;
        this.side = side;
        this.size = size;
        this.entryPrice = entryPrice;
        this.markPrice = entryPrice;
        this.stopLossPrice = stopLossPrice;
        this.leverage = Math.max(1, leverage);
        this.openedAt = Instant.now();
    }

    public PositionKey key() {
        return new PositionKey(symbol, side);
    }

    public boolean isLong() {
        return side == OrderSide.BUY;
    }

    /**
     * Price move in percent of entry, positive when in profit.
     */
    public double profitPercent(double price) {
        double move = (price - entryPrice) / entryPrice * 100;
        return isLong() ? move : -move;
    }

    public double pnlAt(double price, double quantity) {
        double diff = price - entryPrice;
        return (isLong() ? diff : -diff) * quantity;
    }

    public void markToMarket(double price) {
        this.markPrice = price;
        this.unrealizedPnl = pnlAt(price, size);
    }

    /**
     * True when {@code candidate} is a tighter stop in the profit direction than the current one.
     */
    public boolean improvesStop(double candidate) {
        if (stopLossPrice <= 0) {
            return candidate > 0;
        }
        return isLong() ? candidate > stopLossPrice : candidate < stopLossPrice;
    }

    /**
     * True when {@code price} has reached the protective stop.
     */
    public boolean stopHit(double price) {
        if (stopLossPrice <= 0) {
            return false;
        }
        return isLong() ? price <= stopLossPrice : price >= stopLossPrice;
    }

    /**
     * Averages an additional fill on the same side into the position.
     */
    public void addFill(double quantity, double price) {
        double cost = entryPrice * size + price * quantity;
        size += quantity;
        entryPrice = cost / size;
    }

    /**
     * Removes a partially closed quantity and books its PnL.
     */
    public void reduce(double quantity, double exitPrice) {
        realizedPnl += pnlAt(exitPrice, quantity);
        size = Math.max(0, size - quantity);
    }

    public double notionalValue() {
        return size * (markPrice > 0 ? markPrice : entryPrice);
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

    public PositionPhase phase() {
        if (closed) return PositionPhase.CLOSED;
        if (tp2Hit) return PositionPhase.TP2_HIT;
        if (tp1Hit) return PositionPhase.TP1_HIT;
        return PositionPhase.OPENED;
    }

    // ========== Ladder mutations ==========

    void moveStop(double price, StopSource source) {
        this.stopLossPrice = price;
        this.stopSource = source;
        if (source == StopSource.TRAILING) {
            this.trailingStopPrice = price;
        }
    }

    void markBreakevenMoved() {
        this.breakevenMoved = true;
    }

    void markTp1(boolean trailing, double referencePrice) {
        this.tp1Hit = true;
        this.trailingEnabled = trailing;
        this.trailingReferencePrice = referencePrice;
    }

    void setTrailingReferencePrice(double price) {
        this.trailingReferencePrice = price;
    }

    void markTp2() {
        if (!tp1Hit) {
            throw new IllegalStateException("TP2 before TP1 on " + key());
        }
        this.tp2Hit = true;
    }

    void triggerExit(ExitReason reason) {
        if (!exitTriggered) {
            this.exitTriggered = true;
            this.exitReason = reason;
        }
    }

    void setPendingCloseOrderId(String orderId) {
        this.pendingCloseOrderId = orderId;
    }

    void markClosed() {
        this.closed = true;
        this.pendingCloseOrderId = null;
    }

    public void setLiquidationPrice(double liquidationPrice) {
        this.liquidationPrice = liquidationPrice;
    }

    // ========== Accessors ==========

    public String getStrategyName() { return strategyName; }
    public String getSymbol() { return symbol; }
    public OrderSide getSide() { return side; }
    public int getLeverage() { return leverage; }
    public Instant getOpenedAt() { return openedAt; }
    public double getSize() { return size; }
    public double getEntryPrice() { return entryPrice; }
    public double getMarkPrice() { return markPrice; }
    public double getUnrealizedPnl() { return unrealizedPnl; }
    public double getRealizedPnl() { return realizedPnl; }
    public double getLiquidationPrice() { return liquidationPrice; }
    public double getStopLossPrice() { return stopLossPrice; }
    public StopSource getStopSource() { return stopSource; }
    public boolean isBreakevenMoved() { return breakevenMoved; }
    public boolean isTp1Hit() { return tp1Hit; }
    public boolean isTp2Hit() { return tp2Hit; }
    public boolean isTrailingEnabled() { return trailingEnabled; }
    public double getTrailingStopPrice() { return trailingStopPrice; }
    public double getTrailingReferencePrice() { return trailingReferencePrice; }
    public boolean isExitTriggered() { return exitTriggered; }
    public ExitReason getExitReason() { return exitReason; }
    public String getPendingCloseOrderId() { return pendingCloseOrderId; }
    public boolean isClosed() { return closed; }
}
