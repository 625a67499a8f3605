package com.autopilot.core.strategy;

import com.autopilot.core.indicators.Volume;
import com.autopilot.core.model.Signal;

/**
 * RSI signals that are only let through on above-average volume.
 */
public class VolumeFilterStrategy implements Strategy {

    private final RsiStrategy rsi = new RsiStrategy();

    @Override
    public StrategyType type() {
        return StrategyType.VOLUME_FILTER;
    }

    @Override
    public Signal evaluate(MarketSnapshot snapshot, StrategyParameters params) {
        int required = Math.max(params.rsiPeriod() + 1, params.volumeEmaPeriod());
        Signal invalid = Signals.precheck(snapshot, type(), required);
        if (invalid != null) return invalid;

        if (!Volume.isSpike(snapshot.candles(), params.volumeEmaPeriod(), params.volumeMultiplier())) {
            return Signal.hold(snapshot.symbol(), type().name(), "Volume below threshold");
        }

        Signal base = rsi.evaluate(snapshot, params);
        if (base.isHold()) {
            return Signal.hold(snapshot.symbol(), type().name(), base.reason());
        }
        return base.withStrategyName(type().name());
    }
}
