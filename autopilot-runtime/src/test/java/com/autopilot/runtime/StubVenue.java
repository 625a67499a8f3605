package com.autopilot.runtime;

import com.autopilot.core.model.Candle;
import com.autopilot.exchange.ExchangeClient;
import com.autopilot.exchange.exception.ExchangeException;
import com.autopilot.exchange.exception.NetworkException;
import com.autopilot.exchange.model.*;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Minimal venue for lifecycle tests. Counts balance calls so tests can tell cycles ran.
 */
public class StubVenue implements ExchangeClient {

    public volatile AccountBalance balance = new AccountBalance("USDT", 1000, 800, 200, Instant.now());
    public volatile ExchangeException balanceFailure;
    public volatile RuntimeException crash;
    public volatile long balanceDelayMs;
    public final AtomicInteger balanceCalls = new AtomicInteger();

    @Override
    public String getVenueName() {
        return "stub";
    }

    @Override
    public AccountBalance getBalance() throws ExchangeException {
        balanceCalls.incrementAndGet();
        if (balanceDelayMs > 0) {
            try {
                Thread.sleep(balanceDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (crash != null) throw crash;
        if (balanceFailure != null) throw balanceFailure;
        return balance;
    }

    @Override
    public List<ExchangePosition> getPositions() {
        return List.of();
    }

    @Override
    public OrderResponse placeOrder(OrderRequest request) throws ExchangeException {
        throw new ExchangeException("orders are not supported by the stub venue");
    }

    @Override
    public OrderResponse getOrder(String symbol, String orderId) throws ExchangeException {
        throw new ExchangeException("unknown order " + orderId);
    }

    @Override
    public OrderResponse cancelOrder(String symbol, String orderId) throws ExchangeException {
        throw new ExchangeException("unknown order " + orderId);
    }

    @Override
    public List<OrderResponse> getOpenOrders(String symbol) {
        return List.of();
    }

    @Override
    public List<Fill> getFills(String symbol, String orderId) {
        return List.of();
    }

    @Override
    public List<Candle> getKlines(String symbol, KlineInterval interval, int limit) {
        return List.of();
    }

    @Override
    public Ticker getTicker(String symbol) throws ExchangeException {
        throw new NetworkException("no ticker for " + symbol, null);
    }

    @Override
    public OrderBook getDepth(String symbol, int limit) {
        return new OrderBook(symbol, List.of(), List.of(), Instant.now());
    }

    @Override
    public List<PublicTrade> getRecentTrades(String symbol, int limit) {
        return List.of();
    }

    @Override
    public void setLeverage(String symbol, int leverage, MarginMode mode) {
    }

    @Override
    public void testConnection() {
    }
}
