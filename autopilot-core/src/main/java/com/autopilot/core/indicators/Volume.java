package com.autopilot.core.indicators;

import com.autopilot.core.model.Candle;

import java.util.List;

/**
 * Volume helpers used by the volume-confirmed strategies.
 */
public final class Volume {

    private Volume() {}

    public static double[] values(List<Candle> candles) {
        double[] values = new double[candles.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = candles.get(i).volume();
        }
        return values;
    }

    /**
     * True when the last bar's volume exceeds EMA(volume, period) times the multiplier.
     */
    public static boolean isSpike(List<Candle> candles, int period, double multiplier) {
        if (candles.isEmpty()) {
            return false;
        }
        double avg = EMA.latest(values(candles), period);
        if (Double.isNaN(avg)) {
            return false;
        }
        return candles.get(candles.size() - 1).volume() > avg * multiplier;
    }
}
