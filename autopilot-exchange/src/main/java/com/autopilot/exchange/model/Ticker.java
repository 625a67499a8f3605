package com.autopilot.exchange.model;

import java.time.Instant;

public record Ticker(
    String symbol,
    double price,
    double volume,
    Instant timestamp
) {}
