package com.autopilot.execution.harness;

import com.autopilot.core.strategy.StrategyParameters;
import com.autopilot.core.strategy.StrategyType;

/**
 * A strategy bound to a symbol within one instance.
 */
public record StrategyAssignment(
    String id,
    String symbol,
    StrategyType type,
    StrategyParameters parameters,
    boolean active
) {
    public StrategyAssignment {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("id is required");
        if (symbol == null || symbol.isBlank()) throw new IllegalArgumentException("symbol is required");
        if (type == null) throw new IllegalArgumentException("type is required");
        if (parameters == null) parameters = StrategyParameters.defaults();
    }

    public StrategyAssignment withActive(boolean value) {
        return new StrategyAssignment(id, symbol, type, parameters, value);
    }

    public StrategyAssignment withSymbol(String value) {
        return new StrategyAssignment(id, value, type, parameters, active);
    }
}
