package com.autopilot.core.strategy;

import java.util.Map;

/**
 * Tunables shared by all strategy variants. Percent values are expressed in percent (1.5 = 1.5%),
 * fractions (positionSize, gridSpacing) as plain ratios.
 */
public record StrategyParameters(
    int rsiPeriod,
    double rsiOverbought,
    double rsiOversold,
    double positionSize,
    double stopLossPercent,
    double takeProfitPercent,
    int volumeEmaPeriod,
    double volumeMultiplier,
    int emaPeriod,
    int macdFast,
    int macdSlow,
    int macdSignal,
    int bollingerPeriod,
    double bollingerStdDev,
    int gridLevels,
    double gridSpacing,
    int gridAnchorPeriod,
    double dcaAmount,
    int breakoutLookback,
    double breakoutBufferPercent,
    RsiFilter.Settings rsiFilter
) {
    public static StrategyParameters defaults() {
        return builder().build();
    }

    /**
     * Minimum number of primary candles before indicator-based variants produce signals.
     */
    public int warmupBars() {
        return Math.max(rsiPeriod + 1, Math.max(macdSlow + macdSignal - 1, Math.max(emaPeriod, bollingerPeriod)));
    }

    public Builder toBuilder() {
        return new Builder()
                .rsiPeriod(rsiPeriod).rsiOverbought(rsiOverbought).rsiOversold(rsiOversold)
                .positionSize(positionSize).stopLossPercent(stopLossPercent).takeProfitPercent(takeProfitPercent)
                .volumeEmaPeriod(volumeEmaPeriod).volumeMultiplier(volumeMultiplier)
                .emaPeriod(emaPeriod).macd(macdFast, macdSlow, macdSignal)
                .bollinger(bollingerPeriod, bollingerStdDev)
                .gridLevels(gridLevels).gridSpacing(gridSpacing).gridAnchorPeriod(gridAnchorPeriod)
                .dcaAmount(dcaAmount)
                .breakoutLookback(breakoutLookback).breakoutBufferPercent(breakoutBufferPercent)
                .rsiFilter(rsiFilter);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int rsiPeriod = 14;
        private double rsiOverbought = 70;
        private double rsiOversold = 30;
        private double positionSize = 0.1;
        private double stopLossPercent = 1.5;
        private double takeProfitPercent = 2.5;
        private int volumeEmaPeriod = 20;
        private double volumeMultiplier = 1.5;
        private int emaPeriod = 20;
        private int macdFast = 12;
        private int macdSlow = 26;
        private int macdSignal = 9;
        private int bollingerPeriod = 20;
        private double bollingerStdDev = 2.0;
        private int gridLevels = 10;
        private double gridSpacing = 0.01;
        private int gridAnchorPeriod = 20;
        private double dcaAmount = 100;
        private int breakoutLookback = 20;
        private double breakoutBufferPercent = 1.0;
        private RsiFilter.Settings rsiFilter = RsiFilter.Settings.disabled();

        public Builder rsiPeriod(int v) { this.rsiPeriod = v; return this; }
        public Builder rsiOverbought(double v) { this.rsiOverbought = v; return this; }
        public Builder rsiOversold(double v) { this.rsiOversold = v; return this; }
        public Builder positionSize(double v) { this.positionSize = v; return this; }
        public Builder stopLossPercent(double v) { this.stopLossPercent = v; return this; }
        public Builder takeProfitPercent(double v) { this.takeProfitPercent = v; return this; }
        public Builder volumeEmaPeriod(int v) { this.volumeEmaPeriod = v; return this; }
        public Builder volumeMultiplier(double v) { this.volumeMultiplier = v; return this; }
        public Builder emaPeriod(int v) { this.emaPeriod = v; return this; }
        public Builder gridLevels(int v) { this.gridLevels = v; return this; }
        public Builder gridSpacing(double v) { this.gridSpacing = v; return this; }
        public Builder gridAnchorPeriod(int v) { this.gridAnchorPeriod = v; return this; }
        public Builder dcaAmount(double v) { this.dcaAmount = v; return this; }
        public Builder breakoutLookback(int v) { this.breakoutLookback = v; return this; }
        public Builder breakoutBufferPercent(double v) { this.breakoutBufferPercent = v; return this; }
        public Builder rsiFilter(RsiFilter.Settings v) { this.rsiFilter = v; return this; }

        public Builder macd(int fast, int slow, int signal) {
            this.macdFast = fast;
            this.macdSlow = slow;
            this.macdSignal = signal;
            return this;
        }

        public Builder bollinger(int period, double stdDev) {
            this.bollingerPeriod = period;
            this.bollingerStdDev = stdDev;
            return this;
        }

        /**
         * Apply loosely typed overrides, as received from the control surface.
         * Unknown keys are rejected so typos do not silently fall back to defaults.
         */
        public Builder apply(Map<String, ?> overrides) {
            if (overrides == null) return this;
            for (Map.Entry<String, ?> e : overrides.entrySet()) {
                Object v = e.getValue();
                switch (e.getKey()) {
                    case "rsiPeriod" -> rsiPeriod = toInt(e.getKey(), v);
                    case "rsiOverbought" -> rsiOverbought = toDouble(e.getKey(), v);
                    case "rsiOversold" -> rsiOversold = toDouble(e.getKey(), v);
                    case "positionSize" -> positionSize = toDouble(e.getKey(), v);
                    case "stopLossPercent" -> stopLossPercent = toDouble(e.getKey(), v);
                    case "takeProfitPercent" -> takeProfitPercent = toDouble(e.getKey(), v);
                    case "volumeEmaPeriod" -> volumeEmaPeriod = toInt(e.getKey(), v);
                    case "volumeMultiplier" -> volumeMultiplier = toDouble(e.getKey(), v);
                    case "emaPeriod" -> emaPeriod = toInt(e.getKey(), v);
                    case "macdFast" -> macdFast = toInt(e.getKey(), v);
                    case "macdSlow" -> macdSlow = toInt(e.getKey(), v);
                    case "macdSignal" -> macdSignal = toInt(e.getKey(), v);
                    case "bollingerPeriod" -> bollingerPeriod = toInt(e.getKey(), v);
                    case "bollingerStdDev" -> bollingerStdDev = toDouble(e.getKey(), v);
                    case "gridLevels" -> gridLevels = toInt(e.getKey(), v);
                    case "gridSpacing" -> gridSpacing = toDouble(e.getKey(), v);
                    case "gridAnchorPeriod" -> gridAnchorPeriod = toInt(e.getKey(), v);
                    case "dcaAmount" -> dcaAmount = toDouble(e.getKey(), v);
                    case "breakoutLookback" -> breakoutLookback = toInt(e.getKey(), v);
                    case "breakoutBufferPercent" -> breakoutBufferPercent = toDouble(e.getKey(), v);
                    default -> throw new IllegalArgumentException("Unknown strategy parameter: " + e.getKey());
                }
            }
            return this;
        }

        public StrategyParameters build() {
            if (rsiPeriod <= 0) throw new IllegalArgumentException("rsiPeriod must be positive");
            if (rsiOversold >= rsiOverbought) throw new IllegalArgumentException("rsiOversold must be below rsiOverbought");
            if (positionSize <= 0 || positionSize > 1) throw new IllegalArgumentException("positionSize must be in (0, 1]");
            if (macdFast >= macdSlow) throw new IllegalArgumentException("macdFast must be below macdSlow");
            if (gridLevels <= 0 || gridSpacing <= 0) throw new IllegalArgumentException("grid levels and spacing must be positive");
            if (breakoutLookback <= 0) throw new IllegalArgumentException("breakoutLookback must be positive");
            return new StrategyParameters(rsiPeriod, rsiOverbought, rsiOversold, positionSize,
                    stopLossPercent, takeProfitPercent, volumeEmaPeriod, volumeMultiplier, emaPeriod,
                    macdFast, macdSlow, macdSignal, bollingerPeriod, bollingerStdDev,
                    gridLevels, gridSpacing, gridAnchorPeriod, dcaAmount,
                    breakoutLookback, breakoutBufferPercent,
                    rsiFilter != null ? rsiFilter : RsiFilter.Settings.disabled());
        }

        private static int toInt(String key, Object v) {
            if (v instanceof Number n) return n.intValue();
            try {
                return Integer.parseInt(String.valueOf(v).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Parameter " + key + " is not an integer: " + v, e);
            }
        }

        private static double toDouble(String key, Object v) {
            if (v instanceof Number n) return n.doubleValue();
            try {
                return Double.parseDouble(String.valueOf(v).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Parameter " + key + " is not a number: " + v, e);
            }
        }
    }
}
