package com.autopilot.execution.spi;

import java.util.List;

/**
 * Operator choices that survive restarts of one instance.
 *
 * @param tradingPair overrides the configured pair when set
 */
public record UserSettings(
    boolean autoTradingEnabled,
    String tradingPair,
    List<StrategySettings> strategies
) {
    public UserSettings {
        strategies = strategies != null ? List.copyOf(strategies) : List.of();
    }

    public static UserSettings defaults() {
        return new UserSettings(false, null, List.of());
    }

    public UserSettings withAutoTrading(boolean enabled) {
        return new UserSettings(enabled, tradingPair, strategies);
    }

    public UserSettings withTradingPair(String pair) {
        return new UserSettings(autoTradingEnabled, pair, strategies);
    }

    public UserSettings withStrategies(List<StrategySettings> updated) {
        return new UserSettings(autoTradingEnabled, tradingPair, updated);
    }
}
