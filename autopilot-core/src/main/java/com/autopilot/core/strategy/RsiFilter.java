package com.autopilot.core.strategy;

import com.autopilot.core.indicators.RSI;
import com.autopilot.core.model.Signal;

/**
 * Optional RSI entry gate applied after a strategy has produced a trade.
 * NORMAL requires both timeframes to pass; REDUCED checks the primary timeframe only.
 */
public final class RsiFilter {

    public enum Mode {
        NORMAL,
        REDUCED
    }

    /**
     * Longs need RSI below the long thresholds, shorts need RSI above the short thresholds.
     */
    public record Settings(
        boolean enabled,
        Mode mode,
        double longPrimaryMax,
        double longHigherMax,
        double shortPrimaryMin,
        double shortHigherMin
    ) {
        public static Settings disabled() {
            return new Settings(false, Mode.NORMAL, 30, 50, 70, 50);
        }

        public static Settings of(Mode mode) {
            return new Settings(true, mode, 30, 50, 70, 50);
        }
    }

    private RsiFilter() {}

    public static Signal apply(Signal signal, MarketSnapshot snapshot, StrategyParameters params) {
        Settings settings = params.rsiFilter();
        if (settings == null || !settings.enabled() || signal.isHold()) {
            return signal;
        }
        double primary = RSI.latest(snapshot.candles(), params.rsiPeriod());
        double higher = RSI.latest(snapshot.higherCandles(), params.rsiPeriod());
        if (allows(signal.isLong(), primary, higher, settings)) {
            return signal;
        }
        return signal.withHold(String.format("RSI filter blocked %s (%s mode, primary:%.2f, higher:%.2f)",
                signal.action(), settings.mode(), primary, higher));
    }

    static boolean allows(boolean isLong, double primaryRsi, double higherRsi, Settings settings) {
        if (Double.isNaN(primaryRsi)) {
            return false;
        }
        boolean primaryOk = isLong ? primaryRsi < settings.longPrimaryMax() : primaryRsi > settings.shortPrimaryMin();
        if (settings.mode() == Mode.REDUCED) {
            return primaryOk;
        }
        if (Double.isNaN(higherRsi)) {
            return false;
        }
        boolean higherOk = isLong ? higherRsi < settings.longHigherMax() : higherRsi > settings.shortHigherMin();
        return primaryOk && higherOk;
    }
}
