package com.autopilot.core.strategy;

import com.autopilot.core.indicators.SMA;
import com.autopilot.core.model.Signal;
import com.autopilot.core.model.SignalAction;

/**
 * Evenly spaced price grid around a moving-average anchor.
 * Buys below the nearest grid line and sells above it.
 */
public class GridStrategy implements Strategy {

    static final double CONFIDENCE = 0.6;
    private static final double LEVEL_TOLERANCE = 0.1;

    @Override
    public StrategyType type() {
        return StrategyType.GRID;
    }

    @Override
    public Signal evaluate(MarketSnapshot snapshot, StrategyParameters params) {
        Signal invalid = Signals.precheck(snapshot, type(), params.gridAnchorPeriod());
        if (invalid != null) return invalid;

        double[] sma = SMA.calculate(snapshot.candles(), params.gridAnchorPeriod());
        double anchor = sma[sma.length - 1];
        double price = snapshot.price();

        double[] levels = levels(anchor, params.gridLevels(), params.gridSpacing());
        double closest = levels[0];
        for (double level : levels) {
            if (Math.abs(level - price) < Math.abs(closest - price)) {
                closest = level;
            }
        }

        if (Math.abs(price - closest) <= closest * params.gridSpacing() * LEVEL_TOLERANCE) {
            return Signal.hold(snapshot.symbol(), type().name(), String.format("At grid level %.2f", closest));
        }
        SignalAction action = price < closest ? SignalAction.BUY : SignalAction.SELL;
        return Signals.entry(snapshot, params, type(), action, CONFIDENCE, String.format(
                "Grid: price %.2f %s level %.2f", price, action == SignalAction.BUY ? "below" : "above", closest));
    }

    static double[] levels(double anchor, int count, double spacing) {
        double[] levels = new double[count];
        for (int i = 0; i < count; i++) {
            levels[i] = anchor * (1 + (i - count / 2) * spacing);
        }
        return levels;
    }
}
