package com.autopilot.exchange.exception;

public class InsufficientBalanceException extends ExchangeException {

    public InsufficientBalanceException(String message) {
        super(message);
    }
}
