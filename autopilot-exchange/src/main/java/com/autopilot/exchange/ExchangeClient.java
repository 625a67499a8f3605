package com.autopilot.exchange;

import com.autopilot.core.model.Candle;
import com.autopilot.exchange.exception.ExchangeException;
import com.autopilot.exchange.model.*;

import java.util.List;

public interface ExchangeClient extends AutoCloseable {

    String getVenueName();

    // Account
    AccountBalance getBalance() throws ExchangeException;
    List<ExchangePosition> getPositions() throws ExchangeException;

    // Orders
    OrderResponse placeOrder(OrderRequest request) throws ExchangeException;
    OrderResponse getOrder(String symbol, String orderId) throws ExchangeException;
    OrderResponse cancelOrder(String symbol, String orderId) throws ExchangeException;
    List<OrderResponse> getOpenOrders(String symbol) throws ExchangeException;
    List<Fill> getFills(String symbol, String orderId) throws ExchangeException;

    // Market data
    List<Candle> getKlines(String symbol, KlineInterval interval, int limit) throws ExchangeException;
    Ticker getTicker(String symbol) throws ExchangeException;
    OrderBook getDepth(String symbol, int limit) throws ExchangeException;
    List<PublicTrade> getRecentTrades(String symbol, int limit) throws ExchangeException;

    // Margin
    void setLeverage(String symbol, int leverage, MarginMode mode) throws ExchangeException;

    /**
     * Performs one authenticated round trip. Throws the underlying failure when the venue is unreachable
     * or rejects the credentials.
     */
    void testConnection() throws ExchangeException;

    @Override
    default void close() {
    }
}
