package com.autopilot.core.indicators;

import com.autopilot.core.model.Candle;

import java.util.Arrays;
import java.util.List;

/**
 * Simple Moving Average.
 */
public final class SMA {

    private SMA() {}

    public static double[] calculate(List<Candle> candles, int period) {
        return calculate(Series.closes(candles), period);
    }

    /**
     * Rolling mean over an arbitrary series. Warmup bars are NaN.
     */
    public static double[] calculate(double[] values, int period) {
        int n = values.length;
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        if (period <= 0 || n < period) {
            return result;
        }

        double sum = 0;
        for (int i = 0; i < n; i++) {
            sum += values[i];
            if (i >= period) {
                sum -= values[i - period];
            }
            if (i >= period - 1) {
                result[i] = sum / period;
            }
        }
        return result;
    }
}
