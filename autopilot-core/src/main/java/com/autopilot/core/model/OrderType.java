package com.autopilot.core.model;

/**
 * Order types a strategy may request and the exchange client can submit.
 */
public enum OrderType {
    MARKET,
    LIMIT,
    STOP_MARKET,
    TAKE_PROFIT_MARKET,
    TRAILING_STOP_MARKET
}
