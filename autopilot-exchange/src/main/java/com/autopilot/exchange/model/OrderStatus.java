package com.autopilot.exchange.model;

public enum OrderStatus {
    PENDING,
    PARTIALLY_FILLED,
    FILLED,
    CANCELED,
    REJECTED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELED || this == REJECTED;
    }

    /**
     * Maps exchange status strings onto the normalized lifecycle.
     */
    public static OrderStatus parse(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        return switch (value.trim().toUpperCase()) {
            case "FILLED", "CLOSED" -> FILLED;
            case "PARTIALLY_FILLED", "PARTIAL_FILLED" -> PARTIALLY_FILLED;
            case "CANCELED", "CANCELLED", "EXPIRED" -> CANCELED;
            case "REJECTED" -> REJECTED;
            default -> PENDING;
        };
    }
}
