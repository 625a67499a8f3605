package com.autopilot.core.strategy;

import com.autopilot.core.model.Signal;
import com.autopilot.core.model.SignalAction;

/**
 * Dollar-cost averaging: buy a fixed quote amount every cycle.
 */
public class DcaStrategy implements Strategy {

    static final double CONFIDENCE = 0.6;

    @Override
    public StrategyType type() {
        return StrategyType.DCA;
    }

    @Override
    public Signal evaluate(MarketSnapshot snapshot, StrategyParameters params) {
        if (snapshot.price() <= 0) {
            return Signal.hold(snapshot.symbol(), type().name(), "Unable to get current price");
        }
        if (params.dcaAmount() <= 0) {
            return Signal.hold(snapshot.symbol(), type().name(), "DCA amount not configured");
        }
        double quantity = params.dcaAmount() / snapshot.price();
        return Signals.entryWithQuantity(snapshot, params, type(), SignalAction.BUY, quantity, CONFIDENCE,
                String.format("DCA: buy $%.2f", params.dcaAmount()));
    }
}
