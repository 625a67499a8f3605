package com.autopilot.exchange.model;

import java.time.Instant;

public record PublicTrade(
    String tradeId,
    String symbol,
    OrderSide side,
    double price,
    double size,
    Instant timestamp
) {}
