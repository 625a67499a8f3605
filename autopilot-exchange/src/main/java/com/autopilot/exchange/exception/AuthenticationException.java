package com.autopilot.exchange.exception;

public class AuthenticationException extends ExchangeException {

    public AuthenticationException(String message) {
        super(message);
    }
}
