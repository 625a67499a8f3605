package com.autopilot.exchange.exception;

/**
 * Timeout, connection reset or any other transport-level failure.
 */
public class NetworkException extends ExchangeException {

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
