package com.autopilot.core.indicators;

import com.autopilot.core.model.Candle;

import java.util.Arrays;
import java.util.List;

/**
 * Relative Strength Index with Wilder smoothing.
 */
public final class RSI {

    private RSI() {}

    /**
     * @return one value per bar; the first {@code period} bars are NaN
     */
    public static double[] calculate(List<Candle> candles, int period) {
        int n = candles.size();
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        if (period <= 0 || n < period + 1) {
            return result;
        }

        double avgGain = 0;
        double avgLoss = 0;
        for (int i = 1; i <= period; i++) {
            double change = candles.get(i).close() - candles.get(i - 1).close();
            if (change > 0) {
                avgGain += change;
            } else {
                avgLoss -= change;
            }
        }
        avgGain /= period;
        avgLoss /= period;
        result[period] = toRsi(avgGain, avgLoss);

        for (int i = period + 1; i < n; i++) {
            double change = candles.get(i).close() - candles.get(i - 1).close();
            double gain = Math.max(change, 0);
            double loss = Math.max(-change, 0);
            avgGain = (avgGain * (period - 1) + gain) / period;
            avgLoss = (avgLoss * (period - 1) + loss) / period;
            result[i] = toRsi(avgGain, avgLoss);
        }
        return result;
    }

    /**
     * RSI of the most recent bar, NaN when the series is too short.
     */
    public static double latest(List<Candle> candles, int period) {
        double[] values = calculate(candles, period);
        return values.length == 0 ? Double.NaN : values[values.length - 1];
    }

    private static double toRsi(double avgGain, double avgLoss) {
        if (avgLoss == 0) {
            return avgGain == 0 ? 50 : 100;
        }
        double rs = avgGain / avgLoss;
        return 100 - (100 / (1 + rs));
    }
}
