package com.autopilot.core.indicators;

import com.autopilot.core.model.Candle;

import java.util.List;

/**
 * Highest high and lowest low over the bars preceding the latest one.
 */
public final class PriceLevels {

    private PriceLevels() {}

    public record Range(double high, double low) {}

    /**
     * Range of the {@code lookback} bars before the last bar, or null when there are not enough bars.
     */
    public static Range priorRange(List<Candle> candles, int lookback) {
        int n = candles.size();
        if (lookback <= 0 || n < lookback + 1) {
            return null;
        }
        double high = Double.NEGATIVE_INFINITY;
        double low = Double.POSITIVE_INFINITY;
        for (int i = n - 1 - lookback; i < n - 1; i++) {
            Candle c = candles.get(i);
            high = Math.max(high, c.high());
            low = Math.min(low, c.low());
        }
        return new Range(high, low);
    }
}
