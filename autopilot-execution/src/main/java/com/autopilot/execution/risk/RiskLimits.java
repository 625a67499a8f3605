package com.autopilot.execution.risk;

import com.autopilot.exchange.model.TradingConfig;

/**
 * Risk limits for pre-trade checks and the post-trade assessment.
 *
 * @param maxDailyLoss           absolute realized loss in quote currency that halts new entries
 * @param marginBuffer           multiplier on required margin, 1.2 means 20% headroom
 * @param maxConcentration       largest position notional as a fraction of total balance
 * @param minLiquidationDistance fractional distance from mark to liquidation price
 */
public record RiskLimits(
    double maxDailyLoss,
    int maxDailyTrades,
    double minConfidence,
    double marginBuffer,
    double maxConcentration,
    double minLiquidationDistance,
    int maxPositionsToReduce,
    boolean autoReduce
) {
    public static RiskLimits defaults() {
        return new RiskLimits(500, 50, 0.6, 1.2, 0.8, 0.1, 2, false);
    }

    public static RiskLimits fromConfig(TradingConfig.RiskConfig config) {
        return new RiskLimits(
                config.getMaxDailyLoss(),
                config.getMaxDailyTrades(),
                config.getMinConfidence(),
                config.getMarginBuffer(),
                config.getMaxConcentration(),
                config.getMinLiquidationDistance(),
                config.getMaxPositionsToReduce(),
                config.isAutoReduce());
    }
}
