package com.autopilot.execution.harness;

import com.autopilot.core.model.Candle;
import com.autopilot.core.strategy.MarketSnapshot;
import com.autopilot.core.strategy.RsiFilter;
import com.autopilot.core.strategy.StrategyParameters;
import com.autopilot.core.strategy.StrategyType;
import com.autopilot.exchange.ExchangeClient;
import com.autopilot.exchange.exception.ExchangeException;
import com.autopilot.exchange.feed.PriceSource;
import com.autopilot.exchange.model.KlineInterval;

import java.time.Clock;
import java.util.List;

/**
 * Gathers price and candles for one evaluation. Checks for interruption between exchange calls,
 * so a timed-out evaluation stops at the next call boundary.
 */
public class MarketSnapshotLoader {

    private final ExchangeClient client;
    private final PriceSource prices;
    private final KlineInterval primary;
    private final KlineInterval higher;
    private final int candleLimit;
    private final Clock clock;

    public MarketSnapshotLoader(ExchangeClient client, PriceSource prices, KlineInterval primary,
                                KlineInterval higher, int candleLimit, Clock clock) {
        this.client = client;
        this.prices = prices;
        this.primary = primary;
        this.higher = higher;
        this.candleLimit = candleLimit;
        this.clock = clock;
    }

    public MarketSnapshot load(String symbol, double balance, boolean withHigherTimeframe)
            throws ExchangeException, InterruptedException {
        double price = prices.currentPrice(symbol);
        checkInterrupted();
        List<Candle> candles = client.getKlines(symbol, primary, candleLimit);
        checkInterrupted();
        List<Candle> higherCandles = withHigherTimeframe
                ? client.getKlines(symbol, higher, candleLimit)
                : List.of();
        checkInterrupted();
        return new MarketSnapshot(symbol, price, balance, candles, higherCandles, clock.instant());
    }

    /**
     * The multi-timeframe variant and the two-timeframe RSI filter read the higher series.
     */
    public static boolean needsHigherTimeframe(StrategyType type, StrategyParameters params) {
        if (type == StrategyType.RSI_MULTI_TF) {
            return true;
        }
        RsiFilter.Settings filter = params.rsiFilter();
        return filter != null && filter.enabled() && filter.mode() == RsiFilter.Mode.NORMAL;
    }

    private static void checkInterrupted() throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Snapshot load interrupted");
        }
    }
}
