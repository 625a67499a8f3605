package com.autopilot.exchange.feed;

import com.autopilot.exchange.ExchangeClient;
import com.autopilot.exchange.exception.ExchangeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;

/**
 * Current price lookup preferring the streamed quote and falling back to the REST ticker.
 */
public class PriceSource {

    private static final Logger log = LoggerFactory.getLogger(PriceSource.class);

    private final MarketDataFeed feed;
    private final TickerCache cache;
    private final ExchangeClient rest;
    private final long stalenessMs;

    public PriceSource(MarketDataFeed feed, TickerCache cache, ExchangeClient rest, long stalenessMs) {
        this.feed = feed;
        this.cache = cache;
        this.rest = rest;
        this.stalenessMs = stalenessMs;
    }

    /**
     * REST-only source, used when streaming is disabled.
     */
    public static PriceSource restOnly(ExchangeClient rest) {
        return new PriceSource(null, null, rest, 0);
    }

    public double currentPrice(String symbol) throws ExchangeException {
        if (feed != null && feed.getState() == FeedState.CONNECTED) {
            OptionalDouble cached = cache.latest(symbol, stalenessMs);
            if (cached.isPresent()) {
                return cached.getAsDouble();
            }
            log.debug("Streamed price for {} is stale, using REST", symbol);
        }
        return rest.getTicker(symbol).price();
    }
}
