package com.autopilot.exchange.pionex;

import com.autopilot.core.model.Candle;
import com.autopilot.core.model.OrderType;
import com.autopilot.exchange.dialect.FuturesDialect;
import com.autopilot.exchange.dialect.SpotDialect;
import com.autopilot.exchange.exception.AuthenticationException;
import com.autopilot.exchange.http.RateLimiter;
import com.autopilot.exchange.http.RequestSigner;
import com.autopilot.exchange.http.RetryPolicy;
import com.autopilot.exchange.http.SignedRestClient;
import com.autopilot.exchange.model.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PionexClientTest {

    private MockWebServer server;
    private TradingConfig.ExchangeConfig config;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        config = new TradingConfig.ExchangeConfig();
        config.setBaseUrl(server.url("/").toString());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private SignedRestClient rest(RequestSigner signer) {
        return new SignedRestClient(new OkHttpClient(), config.getBaseUrl(), signer, () -> 1L,
                new RetryPolicy(1, 1, 0, 0), new RateLimiter(0), ms -> { });
    }

    private PionexClient spot() {
        return new PionexClient(rest(new RequestSigner("k", "s")), new SpotDialect(), config);
    }

    private PionexClient futures() {
        return new PionexClient(rest(new RequestSigner("k", "s")), new FuturesDialect(), config);
    }

    private void respond(String data) {
        server.enqueue(new MockResponse().setBody("{\"result\":true,\"data\":" + data + ",\"timestamp\":1}"));
    }

    @Nested
    @DisplayName("Market data")
    class MarketData {

        @Test
        @DisplayName("Klines are sorted oldest first and the limit is capped")
        void klines() throws Exception {
            respond("{\"klines\":["
                    + "{\"time\":2000,\"open\":\"2\",\"high\":\"3\",\"low\":\"1\",\"close\":\"2.5\",\"volume\":\"10\"},"
                    + "{\"time\":1000,\"open\":\"1\",\"high\":\"2\",\"low\":\"0.5\",\"close\":\"2\",\"volume\":\"5\"}]}");

            List<Candle> candles = spot().getKlines("BTC_USDT", KlineInterval.M5, 1000);

            assertEquals(2, candles.size());
            assertEquals(1000, candles.get(0).timestamp());
            assertEquals(2.5, candles.get(1).close());

            RecordedRequest request = server.takeRequest();
            assertEquals("/api/v1/market/klines", request.getRequestUrl().encodedPath());
            assertEquals("5M", request.getRequestUrl().queryParameter("interval"));
            assertEquals("500", request.getRequestUrl().queryParameter("limit"));
            assertNull(request.getHeader(RequestSigner.SIGNATURE_HEADER), "Market data is public");
        }

        @Test
        @DisplayName("Ticker price is the close of the matching entry")
        void ticker() throws Exception {
            respond("{\"tickers\":[{\"symbol\":\"ETH_USDT\",\"close\":\"2000\"},"
                    + "{\"symbol\":\"BTC_USDT\",\"close\":\"43210.5\",\"volume\":\"12\",\"closeTime\":1700000000000}]}");
            Ticker ticker = spot().getTicker("BTC_USDT");
            assertEquals(43210.5, ticker.price());
            assertEquals(1700000000000L, ticker.timestamp().toEpochMilli());
        }

        @Test
        void depthLevels() throws Exception {
            respond("{\"bids\":[[\"99.5\",\"2\"],[\"99\",\"1\"]],\"asks\":[[\"100.5\",\"3\"]],\"updateTime\":5}");
            OrderBook book = spot().getDepth("BTC_USDT", 2);
            assertEquals(99.5, book.bestBid());
            assertEquals(100.5, book.bestAsk());
            assertEquals(2, book.bids().size());
        }

        @Test
        void recentTrades() throws Exception {
            respond("{\"trades\":[{\"tradeId\":\"t1\",\"price\":\"100\",\"size\":\"0.1\",\"side\":\"SELL\",\"timestamp\":7}]}");
            List<PublicTrade> trades = spot().getRecentTrades("BTC_USDT", 10);
            assertEquals(1, trades.size());
            assertEquals(OrderSide.SELL, trades.get(0).side());
        }
    }

    @Nested
    @DisplayName("Orders")
    class Orders {

        @Test
        @DisplayName("Market IOC order body carries size and IOC flag")
        void marketOrder() throws Exception {
            respond("{\"orderId\":123456,\"clientOrderId\":\"c-1\"}");
            OrderRequest request = OrderRequest.builder()
                    .symbol("BTC_USDT").side(OrderSide.BUY).type(OrderType.MARKET)
                    .quantity(0.0100).timeInForce(TimeInForce.IOC).clientOrderId("c-1").build();

            OrderResponse response = spot().placeOrder(request);

            assertEquals("123456", response.orderId());
            assertEquals(OrderStatus.PENDING, response.status());

            RecordedRequest recorded = server.takeRequest();
            assertEquals("POST", recorded.getMethod());
            JsonNode body = new ObjectMapper().readTree(recorded.getBody().readUtf8());
            assertEquals("0.01", body.path("size").asText());
            assertTrue(body.path("IOC").asBoolean());
            assertEquals("BUY", body.path("side").asText());
        }

        @Test
        void stopAndTrailingParameters() {
            Map<String, Object> stop = PionexClient.orderParams(OrderRequest.builder()
                    .symbol("BTC_USDT").side(OrderSide.SELL).type(OrderType.STOP_MARKET)
                    .quantity(1).triggerPrice(95.5).reduceOnly(true).build());
            assertEquals("95.5", stop.get("activationPrice"));
            assertEquals("MARK_PRICE", stop.get("workingType"));
            assertEquals(true, stop.get("reduceOnly"));

            Map<String, Object> trailing = PionexClient.orderParams(OrderRequest.builder()
                    .symbol("BTC_USDT").side(OrderSide.SELL).type(OrderType.TRAILING_STOP_MARKET)
                    .quantity(1).callbackRate(1.0).build());
            assertEquals("1", trailing.get("callbackRate"));

            Map<String, Object> fok = PionexClient.orderParams(OrderRequest.builder()
                    .symbol("BTC_USDT").side(OrderSide.BUY).type(OrderType.LIMIT)
                    .quantity(1).price(100.0).timeInForce(TimeInForce.FOK).build());
            assertEquals("100", fok.get("price"));
            assertEquals(true, fok.get("FOK"));
        }

        @Test
        @DisplayName("Order status normalization")
        void orderStatus() throws Exception {
            ObjectMapper mapper = new ObjectMapper();
            OrderResponse filled = PionexClient.parseOrder(mapper.readTree(
                    "{\"orderId\":1,\"symbol\":\"BTC_USDT\",\"side\":\"BUY\",\"type\":\"MARKET\",\"status\":\"CLOSED\","
                            + "\"size\":\"0.2\",\"filledSize\":\"0.2\",\"filledAmount\":\"20\"}"), null);
            assertEquals(OrderStatus.FILLED, filled.status());
            assertEquals(100.0, filled.avgFillPrice(), 1e-9);

            OrderResponse cancelled = PionexClient.parseOrder(mapper.readTree(
                    "{\"orderId\":2,\"status\":\"CLOSED\",\"size\":\"1\",\"filledSize\":\"0\"}"), "BTC_USDT");
            assertEquals(OrderStatus.CANCELED, cancelled.status());
            assertEquals("BTC_USDT", cancelled.symbol());

            OrderResponse partial = PionexClient.parseOrder(mapper.readTree(
                    "{\"orderId\":3,\"status\":\"OPEN\",\"size\":\"1\",\"filledSize\":\"0.4\",\"filledAmount\":\"40\"}"), "X");
            assertEquals(OrderStatus.PARTIALLY_FILLED, partial.status());
            assertEquals(0.6, partial.remainingQuantity(), 1e-9);
        }

        @Test
        void getOrderIsSigned() throws Exception {
            respond("{\"orderId\":9,\"symbol\":\"BTC_USDT\",\"status\":\"OPEN\",\"size\":\"1\",\"filledSize\":\"0\"}");
            OrderResponse order = spot().getOrder("BTC_USDT", "9");
            assertEquals(OrderStatus.PENDING, order.status());
            RecordedRequest request = server.takeRequest();
            assertEquals("9", request.getRequestUrl().queryParameter("orderId"));
            assertNotNull(request.getHeader(RequestSigner.SIGNATURE_HEADER));
        }
    }

    @Nested
    @DisplayName("Account")
    class Account {

        @Test
        void futuresPositionsFromBalances() throws Exception {
            respond("{\"balances\":[{\"currency\":\"USDT\",\"available\":\"100\"}],"
                    + "\"positions\":[{\"symbol\":\"BTC_USDT\",\"side\":\"SHORT\",\"size\":\"0.1\",\"entryPrice\":\"100\",\"markPrice\":\"99\"}]}");
            List<ExchangePosition> positions = futures().getPositions();
            assertEquals(1, positions.size());
            assertEquals("/api/v1/account/balances", server.takeRequest().getRequestUrl().encodedPath());
        }

        @Test
        @DisplayName("Spot accounts skip the leverage call entirely")
        void spotLeverageIsNoop() throws Exception {
            spot().setLeverage("BTC_USDT", 10, MarginMode.ISOLATED);
            assertEquals(0, server.getRequestCount());
        }

        @Test
        void futuresLeverageUsesConfiguredPath() throws Exception {
            respond("{}");
            futures().setLeverage("BTC_USDT", 5, MarginMode.CROSS);
            RecordedRequest request = server.takeRequest();
            assertEquals(config.getLeveragePath(), request.getRequestUrl().encodedPath());
            assertTrue(request.getBody().readUtf8().contains("\"leverage\":5"));
        }

        @Test
        @DisplayName("401 on the connection test is an authentication failure")
        void connectionTestAuth() {
            server.enqueue(new MockResponse().setResponseCode(401).setBody("invalid key"));
            assertThrows(AuthenticationException.class, () -> spot().testConnection());
        }

        @Test
        void connectionTestWithoutCredentials() {
            PionexClient anonymous = new PionexClient(rest(null), new SpotDialect(), config);
            assertThrows(AuthenticationException.class, anonymous::testConnection);
        }
    }
}
