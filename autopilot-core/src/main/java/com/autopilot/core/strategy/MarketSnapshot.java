package com.autopilot.core.strategy;

import com.autopilot.core.model.Candle;

import java.time.Instant;
import java.util.List;

/**
 * Everything a strategy may look at for one evaluation.
 *
 * @param candles       primary timeframe series, oldest first
 * @param higherCandles confirmation timeframe series, oldest first; may be empty
 */
public record MarketSnapshot(
    String symbol,
    double price,
    double balance,
    List<Candle> candles,
    List<Candle> higherCandles,
    Instant timestamp
) {
    public MarketSnapshot {
        candles = candles != null ? List.copyOf(candles) : List.of();
        higherCandles = higherCandles != null ? List.copyOf(higherCandles) : List.of();
    }

    public static MarketSnapshot of(String symbol, double price, double balance, List<Candle> candles) {
        return new MarketSnapshot(symbol, price, balance, candles, List.of(), Instant.now());
    }
}
