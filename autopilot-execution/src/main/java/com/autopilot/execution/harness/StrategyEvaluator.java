package com.autopilot.execution.harness;

import com.autopilot.core.model.Signal;
import com.autopilot.core.strategy.MarketSnapshot;
import com.autopilot.core.strategy.Strategy;
import com.autopilot.core.strategy.StrategyParameters;
import com.autopilot.core.strategy.StrategyType;
import com.autopilot.exchange.exception.ExchangeException;
import com.autopilot.exchange.exception.NetworkException;
import com.autopilot.exchange.exception.RetriesExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one strategy evaluation on a worker thread under a hard timeout.
 *
 * <p>On timeout the worker is interrupted and abandoned. On failure the plain RSI variant gets one
 * chance to produce a trade; if it cannot, the result is a HOLD whose reason names the error class.
 */
public class StrategyEvaluator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StrategyEvaluator.class);

    public static final String TIMEOUT_REASON = "Strategy execution timed out";

    @FunctionalInterface
    public interface SnapshotSource {
        MarketSnapshot load() throws Exception;
    }

    /**
     * @param snapshot the data the signal was computed from, null when none was loaded
     * @param success  false on timeout or error, even when the fallback produced the signal
     */
    public record Evaluation(Signal signal, MarketSnapshot snapshot, boolean success,
                             boolean fallbackUsed, long elapsedMs) {}

    private record Outcome(Signal signal, MarketSnapshot snapshot) {}

    private final ExecutorService workers;
    private final long timeoutMs;

    public StrategyEvaluator(String instanceId, long timeoutMs) {
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "autopilot-strategy-" + instanceId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.timeoutMs = timeoutMs;
    }

    public Evaluation evaluate(StrategyAssignment assignment, SnapshotSource source) {
        long start = System.nanoTime();
        StrategyType type = assignment.type();
        String symbol = assignment.symbol();

        Future<Outcome> future = workers.submit(() -> run(type.create(), source, assignment.parameters()));
        try {
            Outcome outcome = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            Signal signal = outcome.signal() != null
                    ? outcome.signal()
                    : Signal.hold(symbol, type.name(), "Strategy returned no signal");
            return new Evaluation(signal, outcome.snapshot(), true, false, elapsed(start));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Strategy {} on {} timed out after {} ms", type, symbol, timeoutMs);
            return new Evaluation(Signal.hold(symbol, type.name(), TIMEOUT_REASON), null, false, false, elapsed(start));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return new Evaluation(Signal.hold(symbol, type.name(), "Strategy evaluation interrupted"),
                    null, false, false, elapsed(start));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Strategy {} on {} failed: {}", type, symbol, cause.toString());
            return fallback(assignment, source, cause, start);
        }
    }

    private Evaluation fallback(StrategyAssignment assignment, SnapshotSource source, Throwable error, long start) {
        String symbol = assignment.symbol();
        String reason = classify(error);
        if (assignment.type() != StrategyType.RSI) {
            Future<Outcome> future = workers.submit(() -> run(StrategyType.RSI.create(), source, assignment.parameters()));
            try {
                Outcome outcome = future.get(timeoutMs, TimeUnit.MILLISECONDS);
                if (outcome.signal() != null && !outcome.signal().isHold()) {
                    log.info("Fallback RSI produced {} for {} after {} failed",
                            outcome.signal().action(), symbol, assignment.type());
                    return new Evaluation(outcome.signal(), outcome.snapshot(), false, true, elapsed(start));
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Fallback RSI on {} timed out", symbol);
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
            } catch (ExecutionException e) {
                log.warn("Fallback RSI on {} also failed: {}", symbol, String.valueOf(e.getCause()));
            }
        }
        return new Evaluation(Signal.hold(symbol, assignment.type().name(), reason), null, false, false, elapsed(start));
    }

    private static Outcome run(Strategy strategy, SnapshotSource source, StrategyParameters params) throws Exception {
        MarketSnapshot snapshot = source.load();
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Evaluation interrupted");
        }
        return new Outcome(strategy.evaluate(snapshot, params), snapshot);
    }

    /**
     * Human-readable HOLD reason for an evaluation error.
     */
    static String classify(Throwable error) {
        if (error instanceof RetriesExhaustedException && error.getCause() != null) {
            return classify(error.getCause());
        }
        if (error instanceof TimeoutException || error instanceof InterruptedIOException) {
            return TIMEOUT_REASON;
        }
        if (error instanceof NetworkException || error instanceof IOException) {
            return "Network connection error";
        }
        if (error instanceof ExchangeException) {
            return "API service error: " + error.getMessage();
        }
        return "Strategy execution error: " + error.getMessage();
    }

    private static long elapsed(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }
}
