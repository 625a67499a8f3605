package com.autopilot.execution;

import com.autopilot.core.model.Candle;

import java.util.ArrayList;
import java.util.List;

/**
 * Five-minute candle series with flat bars, so RSI depends only on the direction of the closes.
 */
public final class Candles {

    private Candles() {}

    public static List<Candle> falling(int count, double start, double step) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            double c = start - i * step;
            candles.add(new Candle(i * 300_000L, c, c, c, c, 100));
        }
        return candles;
    }

    public static List<Candle> rising(int count, double start, double step) {
        return falling(count, start, -step);
    }
}
