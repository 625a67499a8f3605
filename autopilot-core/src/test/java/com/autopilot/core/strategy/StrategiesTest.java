package com.autopilot.core.strategy;

import com.autopilot.core.model.Candle;
import com.autopilot.core.model.Signal;
import com.autopilot.core.model.SignalAction;
import com.autopilot.core.model.TestCandles;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the strategy variants.
 */
class StrategiesTest {

    private static final double EPS = 1e-9;
    private static final Instant NOW = Instant.parse("2026-01-05T10:00:00Z");
    private final StrategyParameters params = StrategyParameters.defaults();

    private static MarketSnapshot snapshot(List<Candle> candles, double price) {
        return new MarketSnapshot("BTC_USDT", price, 1000, candles, List.of(), NOW);
    }

    private static MarketSnapshot snapshot(List<Candle> candles, List<Candle> higher, double price) {
        return new MarketSnapshot("BTC_USDT", price, 1000, candles, higher, NOW);
    }

    @Nested
    @DisplayName("RSI")
    class RsiTests {

        private final Strategy strategy = StrategyType.RSI.create();

        @Test
        @DisplayName("Oversold series produces a sized BUY with stop and target")
        void buysOversold() {
            List<Candle> candles = TestCandles.falling(30, 200, 1);
            Signal signal = strategy.evaluate(snapshot(candles, 171), params);

            assertEquals(SignalAction.BUY, signal.action());
            assertEquals(1000 * 0.1 / 171, signal.quantity(), EPS, "quantity = balance * positionSize / price");
            assertEquals(171 * (1 - 0.015), signal.stopLoss(), EPS, "1.5% stop below entry");
            assertEquals(171 * (1 + 0.025), signal.takeProfit(), EPS, "2.5% target above entry");
            assertEquals(0.7, signal.confidence(), EPS);
            assertEquals("RSI", signal.strategyName());
            assertTrue(signal.isActionable(), "BUY with positive size and price is actionable");
        }

        @Test
        @DisplayName("Overbought series produces a SELL with mirrored levels")
        void sellsOverbought() {
            Signal signal = strategy.evaluate(snapshot(TestCandles.rising(30, 100, 1), 129), params);

            assertEquals(SignalAction.SELL, signal.action());
            assertTrue(signal.stopLoss() > signal.price(), "Short stop sits above entry");
            assertTrue(signal.takeProfit() < signal.price(), "Short target sits below entry");
        }

        @Test
        @DisplayName("Neutral RSI holds")
        void holdsNeutral() {
            Signal signal = strategy.evaluate(snapshot(TestCandles.oscillating(30, 100), 100), params);

            assertEquals(SignalAction.HOLD, signal.action());
            assertTrue(signal.reason().startsWith("RSI neutral"), signal.reason());
            assertFalse(signal.isActionable(), "HOLD is never actionable");
        }

        @Test
        @DisplayName("Too few candles or no price hold with a reason")
        void holdsOnBadInput() {
            Signal shortSeries = strategy.evaluate(snapshot(TestCandles.falling(5, 100, 1), 95), params);
            assertEquals(SignalAction.HOLD, shortSeries.action());
            assertTrue(shortSeries.reason().contains("Insufficient data"), shortSeries.reason());

            Signal noPrice = strategy.evaluate(snapshot(TestCandles.falling(30, 100, 1), 0), params);
            assertEquals(SignalAction.HOLD, noPrice.action());

            Signal empty = strategy.evaluate(snapshot(List.of(), 100), params);
            assertEquals("No market data available", empty.reason());
        }

        @Test
        @DisplayName("Identical inputs give identical signals")
        void deterministic() {
            MarketSnapshot snap = snapshot(TestCandles.falling(30, 200, 1), 171);
            assertEquals(strategy.evaluate(snap, params), strategy.evaluate(snap, params));
        }
    }

    @Nested
    @DisplayName("Multi-timeframe RSI")
    class MultiTimeframeTests {

        private final Strategy strategy = StrategyType.RSI_MULTI_TF.create();

        @Test
        @DisplayName("Both timeframes oversold gives BUY with 0.8 confidence")
        void bothOversold() {
            Signal signal = strategy.evaluate(snapshot(
                    TestCandles.falling(30, 200, 1), TestCandles.falling(30, 300, 2), 171), params);

            assertEquals(SignalAction.BUY, signal.action());
            assertEquals(0.8, signal.confidence(), EPS);
        }

        @Test
        @DisplayName("Disagreeing timeframes hold")
        void mixed() {
            Signal signal = strategy.evaluate(snapshot(
                    TestCandles.falling(30, 200, 1), TestCandles.rising(30, 100, 1), 171), params);

            assertEquals(SignalAction.HOLD, signal.action());
            assertTrue(signal.reason().contains("1 buy, 1 sell"), signal.reason());
        }

        @Test
        @DisplayName("Missing higher timeframe holds")
        void missingHigher() {
            Signal signal = strategy.evaluate(snapshot(TestCandles.falling(30, 200, 1), 171), params);
            assertEquals(SignalAction.HOLD, signal.action());
        }
    }

    @Nested
    @DisplayName("Volume filter")
    class VolumeFilterTests {

        private final Strategy strategy = StrategyType.VOLUME_FILTER.create();

        @Test
        @DisplayName("RSI signal passes on a volume spike")
        void passesOnSpike() {
            List<Candle> candles = TestCandles.withLastVolume(TestCandles.falling(30, 200, 1), 1000);
            Signal signal = strategy.evaluate(snapshot(candles, 171), params);

            assertEquals(SignalAction.BUY, signal.action());
            assertEquals("VOLUME_FILTER", signal.strategyName());
        }

        @Test
        @DisplayName("RSI signal is suppressed on ordinary volume")
        void blocksQuietVolume() {
            Signal signal = strategy.evaluate(snapshot(TestCandles.falling(30, 200, 1), 171), params);

            assertEquals(SignalAction.HOLD, signal.action());
            assertEquals("Volume below threshold", signal.reason());
        }
    }

    @Nested
    @DisplayName("Advanced")
    class AdvancedTests {

        private final Strategy strategy = StrategyType.ADVANCED.create();

        @Test
        @DisplayName("Accelerating rise wins on EMA and MACD votes")
        void buyMajority() {
            List<Candle> candles = TestCandles.generate(60, i -> 100 + i * i * 0.01);
            double price = candles.get(59).close();
            Signal signal = strategy.evaluate(snapshot(candles, price), params);

            assertEquals(SignalAction.BUY, signal.action(), signal.reason());
            assertTrue(signal.reason().contains("2/3"), signal.reason());
            assertEquals(2.0 / 3.0, signal.confidence(), EPS, "Two votes without confirmations");
        }

        @Test
        @DisplayName("Accelerating fall wins on EMA and MACD votes")
        void sellMajority() {
            List<Candle> candles = TestCandles.generate(60, i -> 200 - i * i * 0.01);
            double price = candles.get(59).close();
            Signal signal = strategy.evaluate(snapshot(candles, price), params);

            assertEquals(SignalAction.SELL, signal.action(), signal.reason());
        }

        @Test
        @DisplayName("Volume spike adds a confidence bonus")
        void volumeBonus() {
            List<Candle> candles = TestCandles.withLastVolume(TestCandles.generate(60, i -> 100 + i * i * 0.01), 5000);
            double price = candles.get(59).close();
            Signal signal = strategy.evaluate(snapshot(candles, price), params);

            assertEquals(SignalAction.BUY, signal.action(), signal.reason());
            assertEquals(2.0 / 3.0 + 0.1, signal.confidence(), EPS);
        }

        @Test
        @DisplayName("Holds until MACD warmup is covered")
        void warmup() {
            Signal signal = strategy.evaluate(snapshot(TestCandles.rising(20, 100, 1), 119), params);
            assertEquals(SignalAction.HOLD, signal.action());
        }
    }

    @Nested
    @DisplayName("Grid and DCA")
    class GridDcaTests {

        @Test
        @DisplayName("Grid buys below and sells above the nearest level")
        void grid() {
            Strategy grid = StrategyType.GRID.create();
            List<Candle> candles = TestCandles.flat(20, 100);

            assertEquals(SignalAction.BUY, grid.evaluate(snapshot(candles, 99.7), params).action());
            assertEquals(SignalAction.SELL, grid.evaluate(snapshot(candles, 100.3), params).action());

            Signal atLevel = grid.evaluate(snapshot(candles, 100.05), params);
            assertEquals(SignalAction.HOLD, atLevel.action());
            assertTrue(atLevel.reason().startsWith("At grid level"), atLevel.reason());
        }

        @Test
        @DisplayName("Grid levels are centred on the anchor")
        void gridLevels() {
            double[] levels = GridStrategy.levels(100, 10, 0.01);
            assertEquals(10, levels.length);
            assertEquals(95.0, levels[0], EPS);
            assertEquals(100.0, levels[5], EPS);
            assertEquals(104.0, levels[9], EPS);
        }

        @Test
        @DisplayName("DCA always buys the configured quote amount")
        void dca() {
            Signal signal = StrategyType.DCA.create().evaluate(snapshot(List.of(), 50_000), params);

            assertEquals(SignalAction.BUY, signal.action());
            assertEquals(100.0 / 50_000, signal.quantity(), EPS);
            assertEquals(0.6, signal.confidence(), EPS);
        }
    }

    @Nested
    @DisplayName("Breakout")
    class BreakoutTests {

        private final Strategy strategy = StrategyType.BREAKOUT.create();

        @Test
        @DisplayName("Price beyond buffered prior high buys")
        void longBreakout() {
            Signal signal = strategy.evaluate(snapshot(TestCandles.flat(21, 100), 103), params);
            assertEquals(SignalAction.BUY, signal.action(), signal.reason());
        }

        @Test
        @DisplayName("Price beyond buffered prior low sells")
        void shortBreakout() {
            Signal signal = strategy.evaluate(snapshot(TestCandles.flat(21, 100), 97), params);
            assertEquals(SignalAction.SELL, signal.action(), signal.reason());
        }

        @Test
        @DisplayName("Price inside the range holds")
        void insideRange() {
            Signal signal = strategy.evaluate(snapshot(TestCandles.flat(21, 100), 100.5), params);
            assertEquals(SignalAction.HOLD, signal.action());
        }

        @Test
        @DisplayName("Overlapping levels trade only the larger breakout")
        void overlappingLevels() {
            StrategyParameters negative = params.toBuilder().breakoutBufferPercent(-2).build();
            Signal signal = strategy.evaluate(snapshot(TestCandles.flat(21, 100), 101), negative);
            assertEquals(SignalAction.BUY, signal.action(), "Long distance 3 beats short distance 1");
        }
    }
}
