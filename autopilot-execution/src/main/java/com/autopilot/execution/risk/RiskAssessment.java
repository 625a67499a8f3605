package com.autopilot.execution.risk;

import com.autopilot.execution.position.ManagedPosition;

import java.util.List;

/**
 * Portfolio-level view computed after each cycle.
 *
 * @param toReduce positions to close, highest leverage first; empty when no limit is breached
 */
public record RiskAssessment(
    double concentration,
    double closestLiquidationDistance,
    List<ManagedPosition> toReduce,
    List<String> warnings
) {
    public RiskAssessment {
        toReduce = List.copyOf(toReduce);
        warnings = List.copyOf(warnings);
    }

    public boolean needsReduction() {
        return !toReduce.isEmpty();
    }
}
