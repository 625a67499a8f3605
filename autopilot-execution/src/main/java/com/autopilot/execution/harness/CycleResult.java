package com.autopilot.execution.harness;

import com.autopilot.core.model.Signal;
import com.autopilot.execution.order.LiveOrder;

/**
 * Final signal of one trading cycle and what was done with it.
 *
 * @param order the submitted order, only for SUBMITTED
 */
public record CycleResult(Outcome outcome, Signal signal, LiveOrder order) {

    public enum Outcome {
        SKIPPED,
        HOLD,
        REJECTED,
        SUBMITTED,
        FAILED
    }

    public static CycleResult skipped(Signal signal) {
        return new CycleResult(Outcome.SKIPPED, signal, null);
    }

    public static CycleResult hold(Signal signal) {
        return new CycleResult(Outcome.HOLD, signal, null);
    }

    public static CycleResult rejected(Signal signal) {
        return new CycleResult(Outcome.REJECTED, signal, null);
    }

    public static CycleResult submitted(Signal signal, LiveOrder order) {
        return new CycleResult(Outcome.SUBMITTED, signal, order);
    }

    public static CycleResult failed(Signal signal) {
        return new CycleResult(Outcome.FAILED, signal, null);
    }

    public String reason() {
        return signal != null ? signal.reason() : null;
    }
}
