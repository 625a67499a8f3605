package com.autopilot.core.indicators;

import com.autopilot.core.model.Candle;

import java.util.Arrays;
import java.util.List;

/**
 * Bollinger Bands over closing prices (population standard deviation).
 */
public final class BollingerBands {

    private BollingerBands() {}

    public record Result(double[] upper, double[] middle, double[] lower, double[] width) {}

    public static Result calculate(List<Candle> candles, int period, double stdDevMultiplier) {
        int n = candles.size();
        double[] upper = new double[n];
        double[] lower = new double[n];
        double[] width = new double[n];
        Arrays.fill(upper, Double.NaN);
        Arrays.fill(lower, Double.NaN);
        Arrays.fill(width, Double.NaN);

        double[] closes = Series.closes(candles);
        double[] middle = SMA.calculate(closes, period);

        for (int i = period - 1; i < n && period > 0; i++) {
            double mean = middle[i];
            double sumSq = 0;
            for (int j = i - period + 1; j <= i; j++) {
                double diff = closes[j] - mean;
                sumSq += diff * diff;
            }
            double stdDev = Math.sqrt(sumSq / period);
            upper[i] = mean + stdDevMultiplier * stdDev;
            lower[i] = mean - stdDevMultiplier * stdDev;
            width[i] = mean != 0 ? (upper[i] - lower[i]) / mean : Double.NaN;
        }
        return new Result(upper, middle, lower, width);
    }
}
