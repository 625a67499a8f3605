package com.autopilot.exchange.model;

import java.time.Instant;

/**
 * Quote-currency balance normalized across account dialects.
 */
public record AccountBalance(
    String currency,
    double total,
    double available,
    double frozen,
    Instant timestamp
) {
    public static AccountBalance empty(String currency) {
        return new AccountBalance(currency, 0, 0, 0, Instant.now());
    }
}
