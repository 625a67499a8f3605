package com.autopilot.execution.position;

/**
 * What one price tick did to a position.
 *
 * @param exitPrice      fill price of the confirmed close, 0 otherwise
 * @param closedQuantity size closed by the confirmed close, 0 otherwise
 * @param realizedPnl    PnL booked by the confirmed close, 0 otherwise
 */
public record TickResult(ManagedPosition position, Outcome outcome, double exitPrice,
                         double closedQuantity, double realizedPnl) {

    public enum Outcome {
        HELD,
        CLOSE_PENDING,
        CLOSED
    }

    static TickResult held(ManagedPosition position) {
        return new TickResult(position, Outcome.HELD, 0, 0, 0);
    }

    static TickResult pending(ManagedPosition position) {
        return new TickResult(position, Outcome.CLOSE_PENDING, 0, 0, 0);
    }

    static TickResult closed(ManagedPosition position, double exitPrice, double closedQuantity, double realizedPnl) {
        return new TickResult(position, Outcome.CLOSED, exitPrice, closedQuantity, realizedPnl);
    }

    public boolean isClosed() {
        return outcome == Outcome.CLOSED;
    }
}
