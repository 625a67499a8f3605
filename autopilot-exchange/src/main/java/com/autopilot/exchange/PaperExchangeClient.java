package com.autopilot.exchange;

import com.autopilot.core.model.Candle;
import com.autopilot.core.model.OrderType;
import com.autopilot.exchange.exception.ExchangeApiException;
import com.autopilot.exchange.exception.ExchangeException;
import com.autopilot.exchange.exception.InsufficientBalanceException;
import com.autopilot.exchange.exception.OrderRejectedException;
import com.autopilot.exchange.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulated venue for paper trading. Public market data comes from a live delegate;
 * balances, fills and positions are kept locally.
 * Market orders fill immediately at the reference price (or the delegate's last price).
 * Resting orders are acknowledged and stay open until cancelled.
 */
public class PaperExchangeClient implements ExchangeClient {

    private static final Logger log = LoggerFactory.getLogger(PaperExchangeClient.class);

    private final ExchangeClient marketData;
    private final String quoteCurrency;
    private double available;
    private final Map<String, PaperPosition> positions = new LinkedHashMap<>();
    private final Map<String, Integer> leverage = new HashMap<>();
    private final Map<String, Double> lastPrices = new HashMap<>();
    private final Map<String, OrderResponse> orders = new LinkedHashMap<>();
    private final List<Fill> fills = new ArrayList<>();
    private final AtomicLong orderIdSeq = new AtomicLong(1);

    public PaperExchangeClient(ExchangeClient marketData, double initialBalance, String quoteCurrency) {
        this.marketData = marketData;
        this.available = initialBalance;
        this.quoteCurrency = quoteCurrency;
    }

    @Override
    public String getVenueName() {
        return "paper";
    }

    // ========== Account ==========

    @Override
    public synchronized AccountBalance getBalance() {
        double margin = positions.values().stream().mapToDouble(p -> p.margin).sum();
        return new AccountBalance(quoteCurrency, available + margin, available, margin, Instant.now());
    }

    @Override
    public synchronized List<ExchangePosition> getPositions() {
        return positions.values().stream()
                .map(p -> p.toExchangePosition(lastPrices.getOrDefault(p.symbol, p.entryPrice)))
                .toList();
    }

    // ========== Orders ==========

    @Override
    public OrderResponse placeOrder(OrderRequest request) throws ExchangeException {
        String orderId = "paper-" + orderIdSeq.getAndIncrement();

        if (request.type() != OrderType.MARKET) {
            Instant now = Instant.now();
            OrderResponse resting = new OrderResponse(orderId, request.clientOrderId(), request.symbol(),
                    request.side(), request.type(), OrderStatus.PENDING, request.quantity(), 0, null, now, now);
            synchronized (this) {
                orders.put(orderId, resting);
            }
            log.info("Paper {} order resting: {} {} {} (order {})",
                    request.type(), request.side(), request.quantity(), request.symbol(), orderId);
            return resting;
        }

        double fillPrice = request.price() != null ? request.price() : getTicker(request.symbol()).price();
        if (fillPrice <= 0) {
            throw new OrderRejectedException("No reference price for " + request.symbol(), "NO_PRICE");
        }

        synchronized (this) {
            lastPrices.put(request.symbol(), fillPrice);
            applyFill(request, fillPrice);

            Instant now = Instant.now();
            Fill fill = new Fill(orderId, orderId, request.symbol(), request.side(),
                    fillPrice, request.quantity(), 0, quoteCurrency, now);
            fills.add(fill);

            OrderResponse filled = new OrderResponse(orderId, request.clientOrderId(), request.symbol(),
                    request.side(), request.type(), OrderStatus.FILLED,
                    request.quantity(), request.quantity(), fillPrice, now, now);
            orders.put(orderId, filled);

            log.info("Paper {} {} {} @ {} (order {})",
                    request.side(), request.quantity(), request.symbol(), fillPrice, orderId);
            return filled;
        }
    }

    private void applyFill(OrderRequest request, double price) throws ExchangeException {
        String symbol = request.symbol();
        PaperPosition pos = positions.get(symbol);
        double qty = request.quantity();

        if (pos != null && pos.side != request.side()) {
            double closing = Math.min(qty, pos.quantity);
            double pnl = (price - pos.entryPrice) * closing * (pos.side == OrderSide.BUY ? 1 : -1);
            double released = pos.margin * closing / pos.quantity;
            pos.quantity -= closing;
            pos.margin -= released;
            available += released + pnl;
            qty -= closing;
            if (pos.quantity <= 1e-12) {
                positions.remove(symbol);
                pos = null;
            }
            if (qty <= 1e-12) return;
        } else if (request.reduceOnly()) {
            throw new OrderRejectedException("Reduce-only order has no position to reduce on " + symbol, "REDUCE_ONLY");
        }

        if (request.reduceOnly()) return;

        int lev = leverage.getOrDefault(symbol, 1);
        double margin = price * qty / lev;
        if (margin > available) {
            throw new InsufficientBalanceException(
                    String.format("Insufficient balance: need %.2f, have %.2f", margin, available));
        }
        available -= margin;

        if (pos == null) {
            positions.put(symbol, new PaperPosition(symbol, request.side(), qty, price, lev, margin));
        } else {
            double totalCost = pos.entryPrice * pos.quantity + price * qty;
            pos.quantity += qty;
            pos.entryPrice = totalCost / pos.quantity;
            pos.margin += margin;
        }
    }

    @Override
    public synchronized OrderResponse getOrder(String symbol, String orderId) throws ExchangeException {
        OrderResponse order = orders.get(orderId);
        if (order == null) {
            throw new ExchangeApiException(404, "ORDER_NOT_FOUND", "Unknown paper order " + orderId);
        }
        return order;
    }

    @Override
    public synchronized OrderResponse cancelOrder(String symbol, String orderId) throws ExchangeException {
        OrderResponse order = getOrder(symbol, orderId);
        if (order.status().isTerminal()) {
            return order;
        }
        OrderResponse cancelled = new OrderResponse(order.orderId(), order.clientOrderId(), order.symbol(),
                order.side(), order.type(), OrderStatus.CANCELED, order.requestedQuantity(),
                order.filledQuantity(), order.avgFillPrice(), order.createdAt(), Instant.now());
        orders.put(orderId, cancelled);
        log.info("Paper order {} cancelled", orderId);
        return cancelled;
    }

    @Override
    public synchronized List<OrderResponse> getOpenOrders(String symbol) {
        return orders.values().stream()
                .filter(OrderResponse::isOpen)
                .filter(o -> symbol == null || o.symbol().equals(symbol))
                .toList();
    }

    @Override
    public synchronized List<Fill> getFills(String symbol, String orderId) {
        return fills.stream()
                .filter(f -> symbol == null || f.symbol().equals(symbol))
                .filter(f -> orderId == null || f.orderId().equals(orderId))
                .toList();
    }

    // ========== Market data ==========

    @Override
    public List<Candle> getKlines(String symbol, KlineInterval interval, int limit) throws ExchangeException {
        return marketData.getKlines(symbol, interval, limit);
    }

    @Override
    public Ticker getTicker(String symbol) throws ExchangeException {
        Ticker ticker = marketData.getTicker(symbol);
        synchronized (this) {
            lastPrices.put(symbol, ticker.price());
        }
        return ticker;
    }

    @Override
    public OrderBook getDepth(String symbol, int limit) throws ExchangeException {
        return marketData.getDepth(symbol, limit);
    }

    @Override
    public List<PublicTrade> getRecentTrades(String symbol, int limit) throws ExchangeException {
        return marketData.getRecentTrades(symbol, limit);
    }

    // ========== Margin ==========

    @Override
    public synchronized void setLeverage(String symbol, int leverage, MarginMode mode) {
        this.leverage.put(symbol, Math.max(1, leverage));
        log.info("Paper set leverage: {} {}x {}", symbol, leverage, mode);
    }

    @Override
    public void testConnection() {
        log.debug("Paper venue is always reachable");
    }

    @Override
    public void close() {
        marketData.close();
    }

    private static class PaperPosition {
        final String symbol;
        final OrderSide side;
        final int leverage;
        double quantity;
        double entryPrice;
        double margin;

        PaperPosition(String symbol, OrderSide side, double quantity, double entryPrice, int leverage, double margin) {
            this.symbol = symbol;
            this.side = side;
            this.quantity = quantity;
            this.entryPrice = entryPrice;
            this.leverage = leverage;
            this.margin = margin;
        }

        ExchangePosition toExchangePosition(double markPrice) {
            double pnl = (markPrice - entryPrice) * quantity * (side == OrderSide.BUY ? 1 : -1);
            return new ExchangePosition(symbol, side, quantity, entryPrice, markPrice,
                    pnl, 0, leverage, MarginMode.ISOLATED, 0, Instant.now());
        }
    }
}
