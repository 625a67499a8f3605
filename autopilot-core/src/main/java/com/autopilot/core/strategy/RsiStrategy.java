package com.autopilot.core.strategy;

import com.autopilot.core.indicators.RSI;
import com.autopilot.core.model.Signal;
import com.autopilot.core.model.SignalAction;

/**
 * Single-timeframe RSI mean reversion: buy oversold, sell overbought.
 */
public class RsiStrategy implements Strategy {

    static final double CONFIDENCE = 0.7;

    @Override
    public StrategyType type() {
        return StrategyType.RSI;
    }

    @Override
    public Signal evaluate(MarketSnapshot snapshot, StrategyParameters params) {
        Signal invalid = Signals.precheck(snapshot, type(), params.rsiPeriod() + 1);
        if (invalid != null) return invalid;

        double rsi = RSI.latest(snapshot.candles(), params.rsiPeriod());
        if (rsi < params.rsiOversold()) {
            return Signals.entry(snapshot, params, type(), SignalAction.BUY, CONFIDENCE,
                    String.format("RSI oversold (%.2f)", rsi));
        }
        if (rsi > params.rsiOverbought()) {
            return Signals.entry(snapshot, params, type(), SignalAction.SELL, CONFIDENCE,
                    String.format("RSI overbought (%.2f)", rsi));
        }
        return Signal.hold(snapshot.symbol(), type().name(), String.format("RSI neutral (%.2f)", rsi));
    }
}
