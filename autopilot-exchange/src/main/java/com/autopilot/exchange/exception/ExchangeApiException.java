package com.autopilot.exchange.exception;

/**
 * The exchange answered but refused the request, either with an HTTP 4xx/5xx status
 * or with an error code inside a 2xx envelope.
 */
public class ExchangeApiException extends ExchangeException {

    private final int httpStatus;
    private final String errorCode;

    public ExchangeApiException(int httpStatus, String errorCode, String message) {
        super(message);
        this.httpStatus = httpStatus;
        this.errorCode = errorCode;
    }

    public static ExchangeApiException ofStatus(int httpStatus, String body) {
        return new ExchangeApiException(httpStatus, String.valueOf(httpStatus),
                "HTTP " + httpStatus + ": " + body);
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isServerError() {
        return httpStatus >= 500;
    }
}
