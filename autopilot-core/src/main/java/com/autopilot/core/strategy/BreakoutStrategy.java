package com.autopilot.core.strategy;

import com.autopilot.core.indicators.PriceLevels;
import com.autopilot.core.model.Signal;
import com.autopilot.core.model.SignalAction;

/**
 * Range breakout over the prior lookback window with a percentage buffer on each side.
 */
public class BreakoutStrategy implements Strategy {

    static final double CONFIDENCE = 0.7;

    @Override
    public StrategyType type() {
        return StrategyType.BREAKOUT;
    }

    @Override
    public Signal evaluate(MarketSnapshot snapshot, StrategyParameters params) {
        Signal invalid = Signals.precheck(snapshot, type(), params.breakoutLookback() + 1);
        if (invalid != null) return invalid;

        PriceLevels.Range range = PriceLevels.priorRange(snapshot.candles(), params.breakoutLookback());
        double buffer = params.breakoutBufferPercent() / 100.0;
        double longLevel = range.high() * (1 + buffer);
        double shortLevel = range.low() * (1 - buffer);
        double price = snapshot.price();

        return switch (BreakoutResolver.resolve(price, longLevel, shortLevel)) {
            case LONG -> Signals.entry(snapshot, params, type(), SignalAction.BUY, CONFIDENCE,
                    String.format("Breakout above %.2f", longLevel));
            case SHORT -> Signals.entry(snapshot, params, type(), SignalAction.SELL, CONFIDENCE,
                    String.format("Breakdown below %.2f", shortLevel));
            case CONFLICT -> Signal.hold(snapshot.symbol(), type().name(),
                    String.format("Breakout conflict: equal distance past %.2f and %.2f", longLevel, shortLevel));
            case NONE -> Signal.hold(snapshot.symbol(), type().name(),
                    String.format("Inside range %.2f - %.2f", shortLevel, longLevel));
        };
    }
}
