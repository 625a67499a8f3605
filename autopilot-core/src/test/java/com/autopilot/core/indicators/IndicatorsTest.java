package com.autopilot.core.indicators;

import com.autopilot.core.model.Candle;
import com.autopilot.core.model.TestCandles;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the indicator calculations used by the strategies.
 */
class IndicatorsTest {

    private static final double EPS = 1e-9;

    @Nested
    @DisplayName("RSI")
    class RsiTests {

        @Test
        @DisplayName("Warmup bars are NaN and first value sits at index period")
        void warmup() {
            double[] rsi = RSI.calculate(TestCandles.rising(20, 100, 1), 14);
            for (int i = 0; i < 14; i++) {
                assertTrue(Double.isNaN(rsi[i]), "Bar " + i + " should be NaN during warmup");
            }
            assertFalse(Double.isNaN(rsi[14]), "Bar 14 should hold the first RSI value");
        }

        @Test
        @DisplayName("Only gains give 100, only losses give 0")
        void extremes() {
            assertEquals(100.0, RSI.latest(TestCandles.rising(30, 100, 1), 14), EPS, "Monotonic rise should be 100");
            assertEquals(0.0, RSI.latest(TestCandles.falling(30, 100, 1), 14), EPS, "Monotonic fall should be 0");
        }

        @Test
        @DisplayName("Balanced gains and losses give 50")
        void balanced() {
            double[] rsi = RSI.calculate(TestCandles.oscillating(15, 100), 14);
            assertEquals(50.0, rsi[14], EPS, "Seven gains and seven losses of equal size should be 50");
        }

        @Test
        @DisplayName("Series shorter than period + 1 yields NaN")
        void tooShort() {
            assertTrue(Double.isNaN(RSI.latest(TestCandles.rising(14, 100, 1), 14)), "14 bars cannot produce RSI(14)");
            assertTrue(Double.isNaN(RSI.latest(List.of(), 14)), "Empty series has no RSI");
        }
    }

    @Nested
    @DisplayName("Moving averages")
    class MovingAverageTests {

        @Test
        @DisplayName("SMA is the rolling mean")
        void sma() {
            double[] sma = SMA.calculate(new double[]{1, 2, 3, 4, 5}, 3);
            assertTrue(Double.isNaN(sma[0]), "First bar is warmup");
            assertTrue(Double.isNaN(sma[1]), "Second bar is warmup");
            assertEquals(2.0, sma[2], EPS);
            assertEquals(3.0, sma[3], EPS);
            assertEquals(4.0, sma[4], EPS);
        }

        @Test
        @DisplayName("EMA is seeded with the SMA and weights recent values")
        void ema() {
            double[] ema = EMA.calculate(new double[]{2, 4, 6, 8}, 3);
            assertEquals(4.0, ema[2], EPS, "Seed should be SMA of first three values");
            assertEquals(6.0, ema[3], EPS, "(8 - 4) * 0.5 + 4");
        }

        @Test
        @DisplayName("EMA of a constant series is constant")
        void emaConstant() {
            double[] ema = EMA.calculate(TestCandles.flat(40, 250), 20);
            assertEquals(250.0, ema[39], EPS);
        }
    }

    @Nested
    @DisplayName("MACD and Bollinger")
    class CompositeTests {

        @Test
        @DisplayName("MACD signal starts after slow + signal - 2 bars")
        void macdWarmup() {
            MACD.Result macd = MACD.calculate(TestCandles.flat(40, 100), 12, 26, 9);
            assertTrue(Double.isNaN(macd.line()[24]), "Line needs the slow EMA");
            assertEquals(0.0, macd.line()[25], EPS, "Flat prices give a zero line");
            assertTrue(Double.isNaN(macd.signal()[32]), "Signal still warming up");
            assertEquals(0.0, macd.signal()[33], EPS, "Signal seeded at index 33");
            assertEquals(0.0, macd.histogram()[39], EPS);
        }

        @Test
        @DisplayName("MACD line is above signal in an accelerating rise")
        void macdAcceleratingRise() {
            List<Candle> candles = TestCandles.generate(60, i -> 100 + i * i * 0.01);
            MACD.Result macd = MACD.calculate(candles, 12, 26, 9);
            assertTrue(macd.line()[59] > macd.signal()[59], "Line should lead signal when slope grows");
        }

        @Test
        @DisplayName("Bollinger bands collapse on a flat series")
        void bollingerFlat() {
            BollingerBands.Result bands = BollingerBands.calculate(TestCandles.flat(25, 100), 20, 2.0);
            assertEquals(100.0, bands.upper()[24], EPS);
            assertEquals(100.0, bands.middle()[24], EPS);
            assertEquals(100.0, bands.lower()[24], EPS);
            assertEquals(0.0, bands.width()[24], EPS);
        }

        @Test
        @DisplayName("Bollinger bands use population standard deviation")
        void bollingerWidth() {
            BollingerBands.Result bands = BollingerBands.calculate(TestCandles.fromCloses(1, 3), 2, 1.0);
            assertEquals(3.0, bands.upper()[1], EPS, "mean 2 + stddev 1");
            assertEquals(1.0, bands.lower()[1], EPS, "mean 2 - stddev 1");
        }
    }

    @Nested
    @DisplayName("Levels and volume")
    class LevelTests {

        @Test
        @DisplayName("Prior range excludes the latest bar")
        void priorRange() {
            List<Candle> candles = TestCandles.fromCloses(100, 105, 95, 120);
            PriceLevels.Range range = PriceLevels.priorRange(candles, 3);
            assertNotNull(range);
            assertEquals(105.0, range.high(), EPS, "120 is the current bar and must be excluded");
            assertEquals(95.0, range.low(), EPS);
            assertNull(PriceLevels.priorRange(candles, 4), "Not enough bars for lookback 4");
        }

        @Test
        @DisplayName("Volume spike compares against EMA of volume")
        void volumeSpike() {
            List<Candle> quiet = TestCandles.flat(30, 100);
            assertFalse(Volume.isSpike(quiet, 20, 1.5), "Constant volume is not a spike");
            assertTrue(Volume.isSpike(TestCandles.withLastVolume(quiet, 1000), 20, 1.5), "10x volume is a spike");
        }
    }
}
