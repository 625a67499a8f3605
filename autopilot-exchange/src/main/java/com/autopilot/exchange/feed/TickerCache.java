package com.autopilot.exchange.feed;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Last streamed price per symbol, stamped with the local receive time.
 * Accepts ticker messages carrying the price as {@code data.close}, {@code data.price} or top-level {@code price}.
 */
public class TickerCache implements Consumer<JsonNode> {

    public static final String CHANNEL = "ticker";

    record Quote(double price, long receivedAt) {}

    private final Map<String, Quote> quotes = new ConcurrentHashMap<>();
    private final LongSupplier clock;

    public TickerCache(LongSupplier clock) {
        this.clock = clock;
    }

    public TickerCache() {
        this(System::currentTimeMillis);
    }

    @Override
    public void accept(JsonNode message) {
        JsonNode data = message.has("data") ? message.get("data") : message;
        String symbol = data.has("symbol") ? data.path("symbol").asText() : message.path("symbol").asText("");
        if (symbol.isEmpty()) {
            throw new IllegalArgumentException("Ticker message without symbol");
        }

        double price = data.has("close") ? data.path("close").asDouble() : data.path("price").asDouble();
        if (price > 0) {
            quotes.put(symbol, new Quote(price, clock.getAsLong()));
        }
    }

    /**
     * Cached price for the symbol, or empty when there is none younger than {@code maxAgeMs}.
     */
    public OptionalDouble latest(String symbol, long maxAgeMs) {
        Quote quote = quotes.get(symbol);
        if (quote == null || clock.getAsLong() - quote.receivedAt() > maxAgeMs) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(quote.price());
    }

    public void clear() {
        quotes.clear();
    }
}
