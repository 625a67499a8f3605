package com.autopilot.exchange.exception;

public class RetriesExhaustedException extends ExchangeException {

    private final int attempts;

    public RetriesExhaustedException(int attempts, ExchangeException lastError) {
        super("All retry attempts failed. Last error: "
                + (lastError != null ? lastError.getMessage() : "unknown"), lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
