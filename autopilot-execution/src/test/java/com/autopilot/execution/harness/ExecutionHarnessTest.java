package com.autopilot.execution.harness;

import com.autopilot.core.model.OrderType;
import com.autopilot.core.model.Signal;
import com.autopilot.core.model.SignalAction;
import com.autopilot.core.strategy.RsiFilter;
import com.autopilot.core.strategy.StrategyParameters;
import com.autopilot.core.strategy.StrategyType;
import com.autopilot.exchange.exception.NetworkException;
import com.autopilot.exchange.exception.OrderRejectedException;
import com.autopilot.exchange.feed.PriceSource;
import com.autopilot.exchange.model.AccountBalance;
import com.autopilot.exchange.model.OrderRequest;
import com.autopilot.exchange.model.OrderSide;
import com.autopilot.exchange.model.OrderStatus;
import com.autopilot.exchange.model.TimeInForce;
import com.autopilot.exchange.model.TradingConfig;
import com.autopilot.execution.Candles;
import com.autopilot.execution.FakeExchangeClient;
import com.autopilot.execution.MutableClock;
import com.autopilot.execution.RecordingStore;
import com.autopilot.execution.journal.ExecutionJournal;
import com.autopilot.execution.position.ExitReason;
import com.autopilot.execution.position.ManagedPosition;
import com.autopilot.execution.spi.TradeRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionHarnessTest {

    private static final String SYMBOL = "BTC_USDT";

    @TempDir
    Path dataDir;

    private FakeExchangeClient exchange;
    private RecordingStore store;
    private MutableClock clock;
    private ExecutionJournal journal;
    private TradingConfig config;
    private ExecutionHarness harness;

    @BeforeEach
    void setUp() {
        exchange = new FakeExchangeClient().price(SYMBOL, 100);
        exchange.candles = Candles.falling(40, 140, 1);
        store = new RecordingStore();
        clock = new MutableClock(Instant.parse("2026-03-03T12:00:00Z"));
        journal = new ExecutionJournal(dataDir, clock);
        config = new TradingConfig();
        config.getPaperTrading().setEnabled(true);
        config.getTrading().setDataDir(dataDir.toString());
    }

    @AfterEach
    void tearDown() {
        if (harness != null) {
            harness.close();
        }
        journal.close();
    }

    private ExecutionHarness harness() {
        harness = new ExecutionHarness("main", config, exchange, PriceSource.restOnly(exchange),
                journal, store, store, clock);
        return harness;
    }

    private static StrategyAssignment rsi() {
        return new StrategyAssignment("a1", SYMBOL, StrategyType.RSI, StrategyParameters.defaults(), true);
    }

    @Nested
    @DisplayName("Entry")
    class Entry {

        @Test
        @DisplayName("An oversold market becomes a filled long with its protective stop")
        void submitsAndOpensPosition() {
            CycleResult result = harness().runCycle(rsi());

            assertEquals(CycleResult.Outcome.SUBMITTED, result.outcome(), result.reason());
            OrderRequest request = exchange.placed.get(0);
            assertEquals(OrderSide.BUY, request.side());
            assertEquals(OrderType.MARKET, request.type());
            assertEquals(TimeInForce.IOC, request.timeInForce());
            assertEquals(1.0, request.quantity(), 1e-9, "10% of 1000 at 100");
            assertTrue(request.clientOrderId().startsWith("ap-"));
            assertEquals(List.of("BTC_USDT:10:ISOLATED"), exchange.leverageCalls);

            assertEquals(1, harness.getPositions().size());
            assertEquals(98.5, harness.getPositions().getOpenPositions().get(0).getStopLossPrice(), 1e-9);

            TradeRecord trade = store.trades.get(0);
            assertEquals("main", trade.instanceId());
            assertEquals(OrderStatus.FILLED, trade.status());
            assertNull(trade.realizedPnl());
            assertTrue(store.notified("Order Placed"));
            assertEquals(HealthStatus.HEALTHY, harness.getLastHealth().status());
            assertEquals(1, harness.getStats().get("RSI").getExecutions());
        }

        @Test
        void neutralMarketHolds() {
            exchange.candles = Candles.falling(40, 100, 0);

            CycleResult result = harness().runCycle(rsi());

            assertEquals(CycleResult.Outcome.HOLD, result.outcome());
            assertTrue(result.reason().startsWith("RSI neutral"), result.reason());
            assertTrue(exchange.placed.isEmpty());
        }

        @Test
        @DisplayName("Leverage is set once per symbol")
        void leverageOnce() {
            harness().runCycle(rsi());
            exchange.candles = Candles.rising(40, 60, 1);

            CycleResult second = harness.runCycle(rsi());

            assertEquals(CycleResult.Outcome.SUBMITTED, second.outcome(), second.reason());
            assertEquals(OrderSide.SELL, exchange.placed.get(1).side());
            assertEquals(1, exchange.leverageCalls.size());
        }

        @Test
        @DisplayName("The RSI filter can veto a strategy signal")
        void rsiFilterBlocks() {
            StrategyParameters params = StrategyParameters.builder()
                    .rsiFilter(new RsiFilter.Settings(true, RsiFilter.Mode.REDUCED, -1, 50, 70, 50))
                    .build();

            CycleResult result = harness().runCycle(new StrategyAssignment("a1", SYMBOL, StrategyType.RSI, params, true));

            assertEquals(CycleResult.Outcome.HOLD, result.outcome());
            assertTrue(result.reason().startsWith("RSI filter blocked BUY"), result.reason());
        }
    }

    @Nested
    @DisplayName("Gates")
    class Gates {

        @Test
        void outsideTradingHours() {
            config.getTradingHours().setEnabled(true);
            config.getTradingHours().setStart("09:00");
            config.getTradingHours().setEnd("11:00");
            config.getTradingHours().setTimezone("UTC");

            CycleResult result = harness().runCycle(rsi());

            assertEquals(CycleResult.Outcome.SKIPPED, result.outcome());
            assertEquals("Outside trading hours", result.reason());
        }

        @Test
        void balanceUnavailable() {
            exchange.balanceFailure = new NetworkException("reset", null);

            CycleResult result = harness().runCycle(rsi());

            assertEquals(CycleResult.Outcome.HOLD, result.outcome());
            assertEquals("Failed to get balance: reset", result.reason());
        }

        @Test
        void balanceBelowMinimum() {
            exchange.balance = new AccountBalance("USDT", 5, 5, 0, Instant.now());

            CycleResult result = harness().runCycle(rsi());

            assertEquals("Insufficient balance: 5.00 (minimum 10.00)", result.reason());
        }

        @Test
        void unhealthySkipsEvaluation() {
            config.getTrading().setMinBalance(0);
            exchange.balance = new AccountBalance("USDT", 0, 0, 0, Instant.now());
            exchange.connectionFailure = new NetworkException("down", null);

            CycleResult result = harness().runCycle(rsi());

            assertEquals("System unhealthy", result.reason());
            assertNull(harness.getStats().get("RSI"), "Strategy never ran");
        }

        @Test
        @DisplayName("A degraded system still trades")
        void degradedProceeds() {
            exchange.connectionFailure = new NetworkException("ping failed", null);

            CycleResult result = harness().runCycle(rsi());

            assertEquals(CycleResult.Outcome.SUBMITTED, result.outcome(), result.reason());
            assertEquals(HealthStatus.DEGRADED, harness.getLastHealth().status());
        }

        @Test
        void riskRejection() {
            config.getRisk().setMinConfidence(0.9);

            CycleResult result = harness().runCycle(rsi());

            assertEquals(CycleResult.Outcome.REJECTED, result.outcome());
            assertEquals("Confidence 0.70 below minimum 0.90", result.reason());
            assertTrue(result.signal().isHold());
            assertTrue(exchange.placed.isEmpty());
        }

        @Test
        @DisplayName("A strategy data failure becomes a HOLD with a classified reason")
        void strategyFailure() {
            exchange.prices.clear();

            CycleResult result = harness().runCycle(rsi());

            assertEquals(CycleResult.Outcome.HOLD, result.outcome());
            assertEquals("Network connection error", result.reason());
            assertEquals(0.0, harness.getStats().get("RSI").getSuccessRate());
        }
    }

    @Nested
    @DisplayName("Submission failures")
    class Failures {

        @Test
        void exchangeRejectionIsFailedAndNotified() {
            exchange.placeFailure = new OrderRejectedException("margin check failed", "MARGIN");

            CycleResult result = harness().runCycle(rsi());

            assertEquals(CycleResult.Outcome.FAILED, result.outcome());
            assertEquals("Order failed: margin check failed", result.reason());
            assertTrue(store.notified("Order Failed"));
            assertTrue(store.trades.isEmpty());
            assertEquals(0, harness.getPositions().size());
        }

        @Test
        void notificationsCanBeSwitchedOff() {
            config.getNotifications().setEnabled(false);

            harness().runCycle(rsi());

            assertTrue(store.notifications.isEmpty());
            assertEquals(1, store.trades.size());
        }
    }

    @Nested
    @DisplayName("Open position management")
    class Management {

        @Test
        @DisplayName("A stop-out on the next cycle closes the position and records the PnL")
        void stopOutClosesPosition() {
            harness().runCycle(rsi());
            exchange.price(SYMBOL, 98);
            exchange.candles = Candles.falling(40, 100, 0);

            CycleResult result = harness.runCycle(rsi());

            assertEquals(CycleResult.Outcome.HOLD, result.outcome());
            assertEquals(0, harness.getPositions().size());
            TradeRecord close = store.trades.get(1);
            assertEquals(OrderSide.SELL, close.side());
            assertEquals(1.0, close.quantity(), 1e-9);
            assertEquals(98, close.price(), 1e-9);
            assertEquals(-2, close.realizedPnl(), 1e-9);
            assertEquals(ExitReason.STOP_LOSS.name(), close.reason());
            assertTrue(store.notified("Position Closed"));
            assertEquals(-2, harness.getRiskManager().getDailyRealizedPnl(), 1e-9);
        }

        @Test
        @DisplayName("Positions are managed even outside trading hours")
        void managedOutsideHours() {
            config.getTradingHours().setEnabled(true);
            config.getTradingHours().setStart("00:00");
            config.getTradingHours().setEnd("01:00");
            config.getTradingHours().setTimezone("UTC");
            harness().getPositions().restore(new ManagedPosition("RSI", SYMBOL, OrderSide.BUY, 1, 100, 99, 10));
            exchange.price(SYMBOL, 98);

            CycleResult result = harness.runCycle(rsi());

            assertEquals(CycleResult.Outcome.SKIPPED, result.outcome());
            assertEquals(0, harness.getPositions().size());
            assertEquals(-2, store.trades.get(0).realizedPnl(), 1e-9);
        }

        @Test
        @DisplayName("A pending entry that fills later opens the position and notifies")
        void pendingEntryFillsLater() {
            exchange.fillOnPlace = false;
            CycleResult first = harness().runCycle(rsi());
            assertEquals(OrderStatus.PENDING, first.order().getStatus());
            assertEquals(0, harness.getPositions().size());

            exchange.settle(first.order().getOrderId(), OrderStatus.FILLED, 1);
            exchange.candles = Candles.falling(40, 100, 0);
            harness.runCycle(rsi());

            assertEquals(1, harness.getPositions().size());
            assertTrue(store.notified("Order Filled"));
        }

        @Test
        @DisplayName("Auto-reduce closes the riskiest position when concentration is breached")
        void autoReduce() {
            config.getRisk().setAutoReduce(true);
            config.getRisk().setMaxConcentration(0.05);
            harness().runCycle(rsi());
            exchange.candles = Candles.falling(40, 100, 0);

            harness.runCycle(rsi());

            assertEquals(0, harness.getPositions().size());
            assertEquals(ExitReason.RISK_REDUCTION.name(), store.trades.get(1).reason());
        }
    }

    @Nested
    @DisplayName("Order requests")
    class Requests {

        private Signal signal(OrderType type) {
            return new Signal(SYMBOL, SignalAction.SELL, 2, 100, 103, 95, type, "RSI", 0.8, "test", Instant.now());
        }

        @Test
        void limitUsesSignalPriceAndGtc() {
            OrderRequest request = harness().buildRequest(signal(OrderType.LIMIT));

            assertEquals(100.0, request.price());
            assertEquals(TimeInForce.GTC, request.timeInForce());
            assertEquals(OrderSide.SELL, request.side());
        }

        @Test
        void stopAndTakeProfitTriggers() {
            assertEquals(103.0, harness().buildRequest(signal(OrderType.STOP_MARKET)).triggerPrice());
            assertEquals(95.0, harness.buildRequest(signal(OrderType.TAKE_PROFIT_MARKET)).triggerPrice());
        }

        @Test
        void trailingUsesConfiguredDistance() {
            config.getExits().setTrailingDistancePercent(1.5);

            OrderRequest request = harness().buildRequest(signal(OrderType.TRAILING_STOP_MARKET));

            assertEquals(1.5, request.callbackRate());
        }
    }
}
