package com.autopilot.execution.position;

import com.autopilot.exchange.model.TradingConfig;

/**
 * Exit ladder thresholds, all in percent of entry price.
 */
public record ExitSettings(
    double tp1Percent,
    double tp2Percent,
    boolean breakevenEnabled,
    double breakevenPercent,
    boolean trailingEnabled,
    double trailingStepPercent,
    double trailingDistancePercent
) {
    public ExitSettings {
        if (tp2Percent < tp1Percent) {
            throw new IllegalArgumentException("tp2Percent must not be below tp1Percent");
        }
        if (trailingStepPercent < 0 || trailingDistancePercent <= 0) {
            throw new IllegalArgumentException("trailing step must not be negative and distance must be positive");
        }
    }

    public static ExitSettings defaults() {
        return new ExitSettings(2.5, 5.0, true, 1.5, true, 0.5, 1.0);
    }

    public static ExitSettings fromConfig(TradingConfig.ExitConfig config) {
        return new ExitSettings(
                config.getTp1Percent(),
                config.getTp2Percent(),
                config.isBreakevenEnabled(),
                config.getBreakevenPercent(),
                config.isTrailingEnabled(),
                config.getTrailingStepPercent(),
                config.getTrailingDistancePercent());
    }
}
