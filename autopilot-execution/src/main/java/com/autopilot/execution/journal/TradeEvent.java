package com.autopilot.execution.journal;

import com.autopilot.execution.spi.TradeRecord;

public class TradeEvent extends ExecutionEvent {

    private TradeRecord trade;

    // For Jackson
    public TradeEvent() {}

    public TradeEvent(TradeRecord trade) {
        super(trade.timestamp());
        this.trade = trade;
    }

    @Override
    public String getEventType() { return "trade"; }

    @Override
    public String getSummary() {
        String pnl = trade.realizedPnl() != null ? String.format(" PnL=%.2f", trade.realizedPnl()) : "";
        return String.format("[%s] %s %s %s %.4f @ %.2f %s%s",
                trade.instanceId(), trade.strategyName(), trade.side(), trade.symbol(),
                trade.quantity(), trade.price(), trade.status(), pnl);
    }

    public TradeRecord getTrade() { return trade; }
}
