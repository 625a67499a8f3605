package com.autopilot.core.indicators;

import com.autopilot.core.model.Candle;

import java.util.Arrays;
import java.util.List;

/**
 * Exponential Moving Average, seeded with the SMA of the first {@code period} values.
 */
public final class EMA {

    private EMA() {}

    public static double[] calculate(List<Candle> candles, int period) {
        return calculate(Series.closes(candles), period);
    }

    public static double[] calculate(double[] values, int period) {
        int n = values.length;
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        if (period <= 0 || n < period) {
            return result;
        }

        double sum = 0;
        for (int i = 0; i < period; i++) {
            sum += values[i];
        }
        result[period - 1] = sum / period;

        double multiplier = 2.0 / (period + 1);
        for (int i = period; i < n; i++) {
            result[i] = (values[i] - result[i - 1]) * multiplier + result[i - 1];
        }
        return result;
    }

    public static double latest(double[] values, int period) {
        double[] ema = calculate(values, period);
        return ema.length == 0 ? Double.NaN : ema[ema.length - 1];
    }
}
