package com.autopilot.execution.harness;

import com.autopilot.core.model.Signal;

final class SignalValidator {

    private SignalValidator() {}

    /**
     * @throws IllegalArgumentException naming the first missing or invalid field
     */
    static void validate(Signal signal) {
        if (signal.action() == null) throw new IllegalArgumentException("action is missing");
        if (signal.symbol() == null || signal.symbol().isBlank()) throw new IllegalArgumentException("symbol is missing");
        if (!(signal.quantity() > 0)) throw new IllegalArgumentException("quantity must be positive, was " + signal.quantity());
        if (!(signal.price() > 0)) throw new IllegalArgumentException("price must be positive, was " + signal.price());
    }
}
