package com.autopilot.core.strategy;

import com.autopilot.core.indicators.RSI;
import com.autopilot.core.model.Signal;
import com.autopilot.core.model.SignalAction;

/**
 * RSI that only trades when the primary and the higher timeframe agree.
 */
public class MultiTimeframeRsiStrategy implements Strategy {

    static final double CONFIDENCE = 0.8;

    @Override
    public StrategyType type() {
        return StrategyType.RSI_MULTI_TF;
    }

    @Override
    public Signal evaluate(MarketSnapshot snapshot, StrategyParameters params) {
        int required = params.rsiPeriod() + 1;
        Signal invalid = Signals.precheck(snapshot, type(), required);
        if (invalid != null) return invalid;
        if (snapshot.higherCandles().size() < required) {
            return Signal.hold(snapshot.symbol(), type().name(), String.format(
                    "Insufficient higher timeframe data: %d candles (need %d)",
                    snapshot.higherCandles().size(), required));
        }

        double primary = RSI.latest(snapshot.candles(), params.rsiPeriod());
        double higher = RSI.latest(snapshot.higherCandles(), params.rsiPeriod());

        int buyVotes = 0;
        int sellVotes = 0;
        for (double rsi : new double[]{primary, higher}) {
            if (rsi < params.rsiOversold()) {
                buyVotes++;
            } else if (rsi > params.rsiOverbought()) {
                sellVotes++;
            }
        }

        if (buyVotes == 2) {
            return Signals.entry(snapshot, params, type(), SignalAction.BUY, CONFIDENCE,
                    String.format("Multi-TF RSI: 2/2 buy signals (primary:%.2f, higher:%.2f)", primary, higher));
        }
        if (sellVotes == 2) {
            return Signals.entry(snapshot, params, type(), SignalAction.SELL, CONFIDENCE,
                    String.format("Multi-TF RSI: 2/2 sell signals (primary:%.2f, higher:%.2f)", primary, higher));
        }
        return Signal.hold(snapshot.symbol(), type().name(), String.format(
                "Multi-TF RSI: Mixed signals - %d buy, %d sell", buyVotes, sellVotes));
    }
}
