package com.autopilot.core.indicators;

import com.autopilot.core.model.Candle;

import java.util.List;

final class Series {

    private Series() {}

    static double[] closes(List<Candle> candles) {
        double[] values = new double[candles.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = candles.get(i).close();
        }
        return values;
    }
}
