package com.autopilot.core.strategy;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Closed set of strategy variants.
 */
public enum StrategyType {
    RSI(RsiStrategy::new),
    RSI_MULTI_TF(MultiTimeframeRsiStrategy::new),
    VOLUME_FILTER(VolumeFilterStrategy::new),
    ADVANCED(AdvancedStrategy::new),
    GRID(GridStrategy::new),
    DCA(DcaStrategy::new),
    BREAKOUT(BreakoutStrategy::new);

    private final Supplier<Strategy> factory;

    StrategyType(Supplier<Strategy> factory) {
        this.factory = factory;
    }

    public Strategy create() {
        return factory.get();
    }

    /**
     * Lenient lookup accepting legacy names such as "rsi_strategy" or "advanced-strategy".
     */
    public static StrategyType parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("strategy name is required");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (normalized.endsWith("_STRATEGY")) {
            normalized = normalized.substring(0, normalized.length() - "_STRATEGY".length());
        }
        return switch (normalized) {
            case "RSI_MULTI_TIMEFRAME", "MULTI_TF", "RSI_MULTI_TF" -> RSI_MULTI_TF;
            case "VOLUME", "VOLUME_FILTER" -> VOLUME_FILTER;
            case "GRID_TRADING", "GRID" -> GRID;
            default -> valueOf(normalized);
        };
    }
}
