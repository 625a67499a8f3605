package com.autopilot.core.indicators;

import com.autopilot.core.model.Candle;

import java.util.Arrays;
import java.util.List;

/**
 * Moving Average Convergence Divergence.
 * Line = EMA(fast) - EMA(slow); signal = EMA(line, signal), seeded with the SMA of the first valid line values.
 */
public final class MACD {

    private MACD() {}

    public record Result(double[] line, double[] signal, double[] histogram) {
        public int size() {
            return line.length;
        }
    }

    public static Result calculate(List<Candle> candles, int fastPeriod, int slowPeriod, int signalPeriod) {
        int n = candles.size();
        double[] line = new double[n];
        double[] signal = new double[n];
        double[] histogram = new double[n];
        Arrays.fill(line, Double.NaN);
        Arrays.fill(signal, Double.NaN);
        Arrays.fill(histogram, Double.NaN);

        if (fastPeriod <= 0 || slowPeriod <= fastPeriod || signalPeriod <= 0 || n < slowPeriod) {
            return new Result(line, signal, histogram);
        }

        double[] fast = EMA.calculate(candles, fastPeriod);
        double[] slow = EMA.calculate(candles, slowPeriod);
        for (int i = slowPeriod - 1; i < n; i++) {
            line[i] = fast[i] - slow[i];
        }

        int signalStart = slowPeriod - 1 + signalPeriod - 1;
        if (signalStart >= n) {
            return new Result(line, signal, histogram);
        }

        double sum = 0;
        for (int i = slowPeriod - 1; i <= signalStart; i++) {
            sum += line[i];
        }
        signal[signalStart] = sum / signalPeriod;
        histogram[signalStart] = line[signalStart] - signal[signalStart];

        double multiplier = 2.0 / (signalPeriod + 1);
        for (int i = signalStart + 1; i < n; i++) {
            signal[i] = (line[i] - signal[i - 1]) * multiplier + signal[i - 1];
            histogram[i] = line[i] - signal[i];
        }
        return new Result(line, signal, histogram);
    }
}
