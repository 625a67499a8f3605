package com.autopilot.core.strategy;

import com.autopilot.core.model.OrderType;
import com.autopilot.core.model.Signal;
import com.autopilot.core.model.SignalAction;

/**
 * Shared signal construction for the strategy variants.
 */
final class Signals {

    private Signals() {}

    /**
     * Returns a HOLD when the snapshot cannot support an evaluation, null otherwise.
     */
    static Signal precheck(MarketSnapshot snapshot, StrategyType type, int requiredBars) {
        String name = type.name();
        if (snapshot.price() <= 0 || Double.isNaN(snapshot.price())) {
            return Signal.hold(snapshot.symbol(), name, "Unable to get current price");
        }
        if (snapshot.candles().isEmpty()) {
            return Signal.hold(snapshot.symbol(), name, "No market data available");
        }
        if (snapshot.candles().size() < requiredBars) {
            return Signal.hold(snapshot.symbol(), name, String.format(
                    "Insufficient data: %d candles (need %d)", snapshot.candles().size(), requiredBars));
        }
        return null;
    }

    /**
     * Entry sized as a fraction of the quote balance, with percentage stop-loss and take-profit.
     */
    static Signal entry(MarketSnapshot snapshot, StrategyParameters params, StrategyType type,
                        SignalAction action, double confidence, String reason) {
        double quantity = snapshot.balance() * params.positionSize() / snapshot.price();
        return entryWithQuantity(snapshot, params, type, action, quantity, confidence, reason);
    }

    static Signal entryWithQuantity(MarketSnapshot snapshot, StrategyParameters params, StrategyType type,
                                    SignalAction action, double quantity, double confidence, String reason) {
        double price = snapshot.price();
        double sl = params.stopLossPercent() / 100.0;
        double tp = params.takeProfitPercent() / 100.0;
        boolean isLong = action == SignalAction.BUY;
        double stopLoss = isLong ? price * (1 - sl) : price * (1 + sl);
        double takeProfit = isLong ? price * (1 + tp) : price * (1 - tp);
        return new Signal(snapshot.symbol(), action, quantity, price, stopLoss, takeProfit,
                OrderType.MARKET, type.name(), Math.min(1.0, confidence), reason, snapshot.timestamp());
    }
}
