package com.autopilot.execution.harness;

import com.autopilot.core.model.SignalAction;
import com.autopilot.core.strategy.MarketSnapshot;
import com.autopilot.core.strategy.StrategyType;
import com.autopilot.exchange.exception.ExchangeException;
import com.autopilot.exchange.exception.NetworkException;
import com.autopilot.exchange.exception.RetriesExhaustedException;
import com.autopilot.execution.Candles;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StrategyEvaluatorTest {

    private static final String SYMBOL = "BTC_USDT";

    private StrategyEvaluator evaluator = new StrategyEvaluator("test", 2_000);

    @AfterEach
    void tearDown() {
        evaluator.close();
    }

    private static StrategyAssignment assignment(StrategyType type) {
        return new StrategyAssignment("a1", SYMBOL, type, null, true);
    }

    private static MarketSnapshot oversold() {
        return MarketSnapshot.of(SYMBOL, 100, 1000, Candles.falling(30, 130, 1));
    }

    @Nested
    @DisplayName("Normal evaluation")
    class Normal {

        @Test
        void returnsStrategySignalAndSnapshot() {
            MarketSnapshot snapshot = oversold();

            StrategyEvaluator.Evaluation evaluation = evaluator.evaluate(assignment(StrategyType.RSI), () -> snapshot);

            assertTrue(evaluation.success());
            assertFalse(evaluation.fallbackUsed());
            assertEquals(SignalAction.BUY, evaluation.signal().action());
            assertSame(snapshot, evaluation.snapshot());
        }

        @Test
        void holdIsStillASuccess() {
            StrategyEvaluator.Evaluation evaluation = evaluator.evaluate(assignment(StrategyType.RSI),
                    () -> MarketSnapshot.of(SYMBOL, 100, 1000, Candles.falling(3, 130, 1)));

            assertTrue(evaluation.success());
            assertTrue(evaluation.signal().isHold());
        }
    }

    @Nested
    @DisplayName("Timeout")
    class Timeout {

        @Test
        @DisplayName("A slow evaluation becomes HOLD without waiting for the worker")
        void slowSourceTimesOut() {
            evaluator.close();
            evaluator = new StrategyEvaluator("slow", 200);

            long start = System.nanoTime();
            StrategyEvaluator.Evaluation evaluation = evaluator.evaluate(assignment(StrategyType.ADVANCED), () -> {
                Thread.sleep(10_000);
                return oversold();
            });
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertTrue(evaluation.signal().isHold());
            assertEquals(StrategyEvaluator.TIMEOUT_REASON, evaluation.signal().reason());
            assertFalse(evaluation.success());
            assertFalse(evaluation.fallbackUsed(), "A timeout is not retried with the fallback");
            assertTrue(elapsedMs < 5_000, "took " + elapsedMs + " ms");
        }
    }

    @Nested
    @DisplayName("Fallback")
    class Fallback {

        @Test
        @DisplayName("A failed strategy gets one plain RSI attempt")
        void rsiFallbackProducesTrade() {
            AtomicInteger calls = new AtomicInteger();

            StrategyEvaluator.Evaluation evaluation = evaluator.evaluate(assignment(StrategyType.ADVANCED), () -> {
                if (calls.incrementAndGet() == 1) {
                    throw new IllegalStateException("indicator blew up");
                }
                return oversold();
            });

            assertEquals(2, calls.get());
            assertEquals(SignalAction.BUY, evaluation.signal().action());
            assertEquals("RSI", evaluation.signal().strategyName());
            assertTrue(evaluation.fallbackUsed());
            assertFalse(evaluation.success(), "The primary strategy still counts as failed");
        }

        @Test
        void fallbackFailureKeepsTheOriginalReason() {
            StrategyEvaluator.Evaluation evaluation = evaluator.evaluate(assignment(StrategyType.GRID), () -> {
                throw new ExchangeException("maintenance");
            });

            assertTrue(evaluation.signal().isHold());
            assertEquals("API service error: maintenance", evaluation.signal().reason());
            assertEquals("GRID", evaluation.signal().strategyName());
            assertFalse(evaluation.fallbackUsed());
        }

        @Test
        void rsiItselfHasNoFallback() {
            AtomicInteger calls = new AtomicInteger();

            StrategyEvaluator.Evaluation evaluation = evaluator.evaluate(assignment(StrategyType.RSI), () -> {
                calls.incrementAndGet();
                throw new NetworkException("reset", null);
            });

            assertEquals(1, calls.get());
            assertEquals("Network connection error", evaluation.signal().reason());
        }
    }

    @Test
    @DisplayName("Errors are classified into operator-facing reasons")
    void classify() {
        assertEquals(StrategyEvaluator.TIMEOUT_REASON, StrategyEvaluator.classify(new TimeoutException()));
        assertEquals(StrategyEvaluator.TIMEOUT_REASON, StrategyEvaluator.classify(new SocketTimeoutException("read")));
        assertEquals(StrategyEvaluator.TIMEOUT_REASON, StrategyEvaluator.classify(new InterruptedIOException()));
        assertEquals("Network connection error",
                StrategyEvaluator.classify(new RetriesExhaustedException(3, new NetworkException("refused", null))));
        assertEquals("API service error: bad symbol",
                StrategyEvaluator.classify(new ExchangeException("bad symbol")));
        assertEquals("Strategy execution error: boom",
                StrategyEvaluator.classify(new IllegalStateException("boom")));
    }
}
