package com.autopilot.execution.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A persisted strategy assignment. Parameters are kept loosely typed, exactly as supplied.
 */
public record StrategySettings(
    String id,
    String symbol,
    String type,
    Map<String, Object> parameters,
    boolean active
) {
    public StrategySettings {
        parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
    }
}
