package com.autopilot.execution.spi;

/**
 * Durable record of trades, instance log lines and per-instance user settings.
 * Write failures are logged by the implementation rather than thrown into the trading loop.
 */
public interface PersistenceStore {

    void appendTrade(TradeRecord trade);

    void appendLog(String instanceId, String level, String message);

    /**
     * Returns the saved settings, or {@link UserSettings#defaults()} when none were saved.
     */
    UserSettings getUserSettings(String instanceId);

    void saveUserSettings(String instanceId, UserSettings settings);
}
