package com.autopilot.exchange.pionex;

import com.autopilot.core.model.Candle;
import com.autopilot.core.model.OrderType;
import com.autopilot.exchange.ExchangeClient;
import com.autopilot.exchange.dialect.ResponseDialect;
import com.autopilot.exchange.exception.AuthenticationException;
import com.autopilot.exchange.exception.ExchangeApiException;
import com.autopilot.exchange.exception.ExchangeException;
import com.autopilot.exchange.http.*;
import com.autopilot.exchange.model.*;
import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pionex REST client. Account responses are normalized through the configured {@link ResponseDialect}.
 */
public class PionexClient implements ExchangeClient {

    private static final Logger log = LoggerFactory.getLogger(PionexClient.class);

    static final String BALANCES = "/api/v1/account/balances";
    static final String ORDER = "/api/v1/trade/order";
    static final String OPEN_ORDERS = "/api/v1/trade/openOrders";
    static final String FILLS = "/api/v1/trade/fills";
    static final String KLINES = "/api/v1/market/klines";
    static final String TICKERS = "/api/v1/market/tickers";
    static final String DEPTH = "/api/v1/market/depth";
    static final String TRADES = "/api/v1/market/trades";
    static final int MAX_KLINES = 500;

    private final SignedRestClient rest;
    private final ResponseDialect dialect;
    private final TradingConfig.ExchangeConfig config;
    private final OkHttpClient httpClient;

    public PionexClient(TradingConfig.ExchangeConfig config) {
        this.config = config;
        this.dialect = ResponseDialect.forName(config.getDialect());
        this.httpClient = HttpClients.create(config);

        RequestSigner signer = hasText(config.getApiKey()) && hasText(config.getApiSecret())
                ? new RequestSigner(config.getApiKey(), config.getApiSecret())
                : null;
        if (signer == null) {
            log.warn("No API credentials configured, only public market data is available");
        }

        this.rest = new SignedRestClient(httpClient, config.getBaseUrl(), signer,
                new ServerTimestampSource(httpClient, config.getBaseUrl(), config.getClockSyncIntervalMs()),
                RetryPolicy.fromConfig(config),
                new RateLimiter(config.getRateLimitDelayMs()),
                Sleeper.SYSTEM);
    }

    PionexClient(SignedRestClient rest, ResponseDialect dialect, TradingConfig.ExchangeConfig config) {
        this.rest = rest;
        this.dialect = dialect;
        this.config = config;
        this.httpClient = null;
    }

    @Override
    public String getVenueName() {
        return "pionex-" + dialect.name();
    }

    public ResponseDialect getDialect() {
        return dialect;
    }

    // ========== Account ==========

    @Override
    public AccountBalance getBalance() throws ExchangeException {
        JsonNode data = rest.signedGet(BALANCES, Map.of());
        return dialect.parseBalance(data, config.getQuoteCurrency());
    }

    @Override
    public List<ExchangePosition> getPositions() throws ExchangeException {
        // No dedicated positions endpoint; the balances document carries them for futures accounts
        JsonNode data = rest.signedGet(BALANCES, Map.of());
        return dialect.parsePositions(data);
    }

    // ========== Orders ==========

    @Override
    public OrderResponse placeOrder(OrderRequest request) throws ExchangeException {
        Map<String, Object> params = orderParams(request);
        JsonNode data = rest.signedPost(ORDER, params);
        String orderId = data.path("orderId").asText("");
        if (orderId.isEmpty()) {
            throw new ExchangeApiException(200, "NO_ORDER_ID", "Order response carried no orderId: " + data);
        }

        log.info("Placed {} {} {} {} (order {})",
                request.type(), request.side(), format(request.quantity()), request.symbol(), orderId);

        Instant now = Instant.now();
        return new OrderResponse(orderId, data.path("clientOrderId").asText(request.clientOrderId()),
                request.symbol(), request.side(), request.type(), OrderStatus.PENDING,
                request.quantity(), 0, null, now, now);
    }

    static Map<String, Object> orderParams(OrderRequest request) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("symbol", request.symbol());
        params.put("side", request.side().name());
        params.put("type", request.type().name());
        params.put("size", format(request.quantity()));
        if (request.clientOrderId() != null) {
            params.put("clientOrderId", request.clientOrderId());
        }

        switch (request.type()) {
            case MARKET -> {
                if (request.timeInForce() == TimeInForce.IOC) params.put("IOC", true);
            }
            case LIMIT -> {
                params.put("price", format(request.price()));
                if (request.timeInForce() == TimeInForce.IOC) params.put("IOC", true);
                if (request.timeInForce() == TimeInForce.FOK) params.put("FOK", true);
            }
            case STOP_MARKET, TAKE_PROFIT_MARKET -> {
                params.put("activationPrice", format(request.triggerPrice()));
                params.put("workingType", "MARK_PRICE");
            }
            case TRAILING_STOP_MARKET -> {
                params.put("callbackRate", format(request.callbackRate()));
                params.put("workingType", "MARK_PRICE");
            }
        }
        if (request.reduceOnly()) {
            params.put("reduceOnly", true);
        }
        return params;
    }

    @Override
    public OrderResponse getOrder(String symbol, String orderId) throws ExchangeException {
        JsonNode data = rest.signedGet(ORDER, Map.of("symbol", symbol, "orderId", orderId));
        return parseOrder(data, symbol);
    }

    @Override
    public OrderResponse cancelOrder(String symbol, String orderId) throws ExchangeException {
        rest.signedDelete(ORDER, Map.of("symbol", symbol, "orderId", orderId));
        log.info("Cancelled order {} on {}", orderId, symbol);
        return getOrder(symbol, orderId);
    }

    @Override
    public List<OrderResponse> getOpenOrders(String symbol) throws ExchangeException {
        Map<String, Object> params = new LinkedHashMap<>();
        if (symbol != null) params.put("symbol", symbol);
        JsonNode data = rest.signedGet(OPEN_ORDERS, params);

        List<OrderResponse> orders = new ArrayList<>();
        for (JsonNode node : rowsOf(data, "orders")) {
            orders.add(parseOrder(node, symbol));
        }
        return orders;
    }

    @Override
    public List<Fill> getFills(String symbol, String orderId) throws ExchangeException {
        Map<String, Object> params = new LinkedHashMap<>();
        if (symbol != null) params.put("symbol", symbol);
        if (orderId != null) params.put("orderId", orderId);
        JsonNode data = rest.signedGet(FILLS, params);

        List<Fill> fills = new ArrayList<>();
        for (JsonNode node : rowsOf(data, "fills")) {
            fills.add(new Fill(
                    node.path("id").asText(node.path("tradeId").asText()),
                    node.path("orderId").asText(),
                    node.path("symbol").asText(symbol),
                    OrderSide.parse(node.path("side").asText()),
                    node.path("price").asDouble(),
                    node.path("size").asDouble(),
                    node.path("fee").asDouble(0),
                    node.path("feeCoin").asText(config.getQuoteCurrency()),
                    Instant.ofEpochMilli(node.path("timestamp").asLong(System.currentTimeMillis()))));
        }
        return fills;
    }

    static OrderResponse parseOrder(JsonNode node, String fallbackSymbol) {
        String rawStatus = node.path("status").asText(null);
        double size = node.path("size").asDouble(0);
        double filled = node.path("filledSize").asDouble(0);
        double filledAmount = node.path("filledAmount").asDouble(0);

        OrderStatus status = OrderStatus.parse(rawStatus);
        // A CLOSED order that never completed was cancelled
        if ("CLOSED".equalsIgnoreCase(rawStatus) && size > 0 && filled < size) {
            status = OrderStatus.CANCELED;
        } else if (status == OrderStatus.PENDING && filled > 0) {
            status = OrderStatus.PARTIALLY_FILLED;
        }

        Double avgPrice = filled > 0 && filledAmount > 0 ? filledAmount / filled : null;
        OrderSide side = node.has("side") ? OrderSide.parse(node.path("side").asText()) : null;

        return new OrderResponse(
                node.path("orderId").asText(),
                node.hasNonNull("clientOrderId") ? node.path("clientOrderId").asText() : null,
                node.path("symbol").asText(fallbackSymbol),
                side,
                parseType(node.path("type").asText()),
                status,
                size,
                filled,
                avgPrice,
                Instant.ofEpochMilli(node.path("createTime").asLong(System.currentTimeMillis())),
                Instant.ofEpochMilli(node.path("updateTime").asLong(System.currentTimeMillis())));
    }

    private static OrderType parseType(String value) {
        try {
            return OrderType.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return OrderType.MARKET;
        }
    }

    // ========== Market data ==========

    @Override
    public List<Candle> getKlines(String symbol, KlineInterval interval, int limit) throws ExchangeException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("interval", interval.code());
        params.put("limit", Math.min(limit, MAX_KLINES));
        JsonNode data = rest.publicGet(KLINES, params);

        List<Candle> candles = new ArrayList<>();
        for (JsonNode k : rowsOf(data, "klines")) {
            if (k.isArray()) {
                candles.add(new Candle(k.get(0).asLong(), k.get(1).asDouble(), k.get(2).asDouble(),
                        k.get(3).asDouble(), k.get(4).asDouble(), k.get(5).asDouble()));
            } else {
                candles.add(new Candle(
                        k.path("time").asLong(),
                        k.path("open").asDouble(),
                        k.path("high").asDouble(),
                        k.path("low").asDouble(),
                        k.path("close").asDouble(),
                        k.path("volume").asDouble()));
            }
        }
        candles.sort(Comparator.comparingLong(Candle::timestamp));
        return candles;
    }

    @Override
    public Ticker getTicker(String symbol) throws ExchangeException {
        JsonNode data = rest.publicGet(TICKERS, Map.of("symbol", symbol));
        for (JsonNode t : rowsOf(data, "tickers")) {
            if (symbol.equals(t.path("symbol").asText())) {
                long time = t.path("closeTime").asLong(data.path("timestamp").asLong(System.currentTimeMillis()));
                return new Ticker(symbol, t.path("close").asDouble(), t.path("volume").asDouble(0),
                        Instant.ofEpochMilli(time));
            }
        }
        throw new ExchangeApiException(200, "NO_TICKER", "No ticker returned for " + symbol);
    }

    @Override
    public OrderBook getDepth(String symbol, int limit) throws ExchangeException {
        JsonNode data = rest.publicGet(DEPTH, Map.of("symbol", symbol, "limit", limit));
        return new OrderBook(symbol, levels(data.path("bids")), levels(data.path("asks")),
                Instant.ofEpochMilli(data.path("updateTime").asLong(System.currentTimeMillis())));
    }

    private static List<OrderBook.Level> levels(JsonNode side) {
        List<OrderBook.Level> levels = new ArrayList<>();
        for (JsonNode level : side) {
            levels.add(new OrderBook.Level(level.get(0).asDouble(), level.get(1).asDouble()));
        }
        return levels;
    }

    @Override
    public List<PublicTrade> getRecentTrades(String symbol, int limit) throws ExchangeException {
        JsonNode data = rest.publicGet(TRADES, Map.of("symbol", symbol, "limit", limit));
        List<PublicTrade> trades = new ArrayList<>();
        for (JsonNode t : rowsOf(data, "trades")) {
            trades.add(new PublicTrade(
                    t.path("tradeId").asText(t.path("id").asText()),
                    symbol,
                    OrderSide.parse(t.path("side").asText("BUY")),
                    t.path("price").asDouble(),
                    t.path("size").asDouble(t.path("qty").asDouble()),
                    Instant.ofEpochMilli(t.path("timestamp").asLong(System.currentTimeMillis()))));
        }
        return trades;
    }

    // ========== Margin ==========

    @Override
    public void setLeverage(String symbol, int leverage, MarginMode mode) throws ExchangeException {
        if (!dialect.supportsLeverage()) {
            log.debug("Leverage not applicable to {} accounts, skipping {}x for {}", dialect.name(), leverage, symbol);
            return;
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("leverage", leverage);
        params.put("marginMode", mode.name());
        rest.signedPost(config.getLeveragePath(), params);
        log.info("Set leverage {}x {} for {}", leverage, mode, symbol);
    }

    @Override
    public void testConnection() throws ExchangeException {
        if (!rest.hasCredentials()) {
            throw new AuthenticationException("API credentials are not configured");
        }
        try {
            rest.signedGet(BALANCES, Map.of());
        } catch (ExchangeApiException e) {
            if (e.getHttpStatus() == 401 || e.getHttpStatus() == 403) {
                throw new AuthenticationException("Authentication error: " + e.getMessage());
            }
            throw e;
        }
    }

    @Override
    public void close() {
        if (httpClient != null) {
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
    }

    // ========== Helpers ==========

    private static Iterable<JsonNode> rowsOf(JsonNode data, String field) {
        if (data.has(field)) return data.get(field);
        return data.isArray() ? data : List.<JsonNode>of();
    }

    static String format(Double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
