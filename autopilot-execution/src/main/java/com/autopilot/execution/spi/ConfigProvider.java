package com.autopilot.execution.spi;

import com.autopilot.exchange.model.TradingConfig;

import java.io.IOException;

/**
 * Source of the active trading configuration. Every {@link #get()} hands out an independent copy.
 */
public interface ConfigProvider {

    TradingConfig get();

    /**
     * Re-reads the backing source and returns a copy of the new configuration.
     */
    TradingConfig reload() throws IOException;
}
