package com.autopilot.exchange.feed;

import com.autopilot.exchange.model.TradingConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Streaming market data with URL rotation, bounded reconnects and subscription replay.
 *
 * <p>A failed connect rotates to the next candidate URL; a drop after a successful open retries
 * the same URL first. Once more than {@code maxReconnectAttempts} consecutive attempts fail the feed
 * goes {@link FeedState#DEGRADED} and stays there until {@link #start()} is called again.
 */
public class MarketDataFeed {

    private static final Logger log = LoggerFactory.getLogger(MarketDataFeed.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final List<URI> urls;
    private final FeedConnector connector;
    private final ReconnectScheduler scheduler;
    private final long reconnectDelayMs;
    private final int maxReconnectAttempts;

    private final Map<String, Map<String, Object>> subscriptions = new LinkedHashMap<>();
    private final Map<String, Consumer<JsonNode>> handlers = new ConcurrentHashMap<>();
    private final List<Consumer<FeedState>> stateListeners = new CopyOnWriteArrayList<>();

    private volatile FeedState state = FeedState.DISCONNECTED;
    private FeedConnection connection;
    private int generation;
    private int urlIndex;
    private int attempts;
    private boolean opened;
    private boolean running;

    public MarketDataFeed(List<String> urls, FeedConnector connector, ReconnectScheduler scheduler,
                          long reconnectDelayMs, int maxReconnectAttempts) {
        if (urls == null || urls.isEmpty()) {
            throw new IllegalArgumentException("At least one feed URL is required");
        }
        this.urls = urls.stream().map(URI::create).toList();
        this.connector = connector;
        this.scheduler = scheduler;
        this.reconnectDelayMs = reconnectDelayMs;
        this.maxReconnectAttempts = maxReconnectAttempts;
    }

    public static MarketDataFeed create(TradingConfig.ExchangeConfig config) {
        return new MarketDataFeed(config.getWebsocketUrls(), new JavaWebSocketConnector(),
                ReconnectScheduler.daemon("MarketDataFeed-Reconnect"),
                config.getReconnectDelayMs(), config.getMaxReconnectAttempts());
    }

    // ========== Lifecycle ==========

    public synchronized void start() {
        if (running && state != FeedState.DEGRADED) {
            return;
        }
        running = true;
        attempts = 0;
        openConnection();
    }

    public synchronized void stop() {
        running = false;
        generation++;
        if (connection != null) {
            connection.close();
            connection = null;
        }
        setState(FeedState.DISCONNECTED);
    }

    private void openConnection() {
        int gen = ++generation;
        URI uri = urls.get(urlIndex);
        opened = false;
        setState(FeedState.CONNECTING);
        log.info("Connecting market data feed to {} (attempt {})", uri, attempts + 1);
        try {
            connection = connector.connect(uri, new GenerationListener(gen));
        } catch (RuntimeException e) {
            log.warn("Feed connect to {} failed: {}", uri, e.getMessage());
            connection = null;
            handleClosed(gen);
        }
    }

    private synchronized void handleOpen(int gen) {
        if (gen != generation || !running) return;
        opened = true;
        attempts = 0;
        setState(FeedState.CONNECTED);
        log.info("Market data feed connected to {}", urls.get(urlIndex));

        for (Map<String, Object> message : subscriptions.values()) {
            send("subscribe", message);
        }
    }

    private synchronized void handleClosed(int gen) {
        if (gen != generation || !running) return;
        generation++;
        connection = null;
        attempts++;

        if (attempts > maxReconnectAttempts) {
            log.error("Market data feed gave up after {} attempts, falling back to REST polling", attempts - 1);
            setState(FeedState.DEGRADED);
            return;
        }

        if (opened) {
            log.warn("Market data feed dropped from {}, reconnecting", urls.get(urlIndex));
        } else {
            urlIndex = (urlIndex + 1) % urls.size();
            log.warn("Market data feed connect failed, rotating to {}", urls.get(urlIndex));
        }
        setState(FeedState.CONNECTING);
        scheduler.schedule(this::reconnect, reconnectDelayMs);
    }

    private synchronized void reconnect() {
        if (running && state == FeedState.CONNECTING && connection == null) {
            openConnection();
        }
    }

    // ========== Subscriptions ==========

    /**
     * Registers a subscription and sends it when connected. Returns false if it was already active.
     */
    public synchronized boolean subscribe(String channel, Map<String, ?> params) {
        Map<String, Object> message = subscriptionBody(channel, params);
        String key = keyOf(message);
        if (subscriptions.containsKey(key)) {
            return false;
        }
        subscriptions.put(key, message);
        if (state == FeedState.CONNECTED) {
            send("subscribe", message);
        }
        return true;
    }

    public synchronized boolean unsubscribe(String channel, Map<String, ?> params) {
        Map<String, Object> message = subscriptionBody(channel, params);
        if (subscriptions.remove(keyOf(message)) == null) {
            return false;
        }
        if (state == FeedState.CONNECTED) {
            send("unsubscribe", message);
        }
        return true;
    }

    public synchronized int subscriptionCount() {
        return subscriptions.size();
    }

    private static Map<String, Object> subscriptionBody(String channel, Map<String, ?> params) {
        Map<String, Object> body = new TreeMap<>();
        if (params != null) body.putAll(params);
        body.put("channel", channel);
        return body;
    }

    private String keyOf(Map<String, Object> body) {
        return toJson(withEvent("subscribe", body));
    }

    private void send(String event, Map<String, Object> body) {
        if (connection != null) {
            connection.send(toJson(withEvent(event, body)));
        }
    }

    private static Map<String, Object> withEvent(String event, Map<String, Object> body) {
        Map<String, Object> message = new TreeMap<>(body);
        message.put("event", event);
        return message;
    }

    private String toJson(Map<String, Object> message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable subscription: " + message, e);
        }
    }

    // ========== Dispatch ==========

    public void onChannel(String channel, Consumer<JsonNode> handler) {
        handlers.put(channel, handler);
    }

    void dispatch(String text) {
        JsonNode message;
        try {
            message = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("Dropping malformed feed message: {}", e.getOriginalMessage());
            return;
        }

        String channel = message.path("channel").asText("");
        Consumer<JsonNode> handler = handlers.get(channel);
        if (handler == null) {
            log.debug("No handler for feed message on channel '{}'", channel);
            return;
        }
        try {
            handler.accept(message);
        } catch (Exception e) {
            log.warn("Feed handler error on channel {}", channel, e);
        }
    }

    // ========== State ==========

    public FeedState getState() {
        return state;
    }

    public synchronized URI currentUrl() {
        return urls.get(urlIndex);
    }

    public void addStateListener(Consumer<FeedState> listener) {
        stateListeners.add(listener);
    }

    private void setState(FeedState newState) {
        FeedState old = this.state;
        this.state = newState;
        if (old != newState) {
            log.debug("Feed state {} -> {}", old, newState);
            for (Consumer<FeedState> l : stateListeners) {
                try {
                    l.accept(newState);
                } catch (Exception e) {
                    log.warn("Feed state listener error", e);
                }
            }
        }
    }

    private class GenerationListener implements FeedConnector.Listener {
        private final int gen;

        GenerationListener(int gen) {
            this.gen = gen;
        }

        @Override
        public void onOpen() {
            handleOpen(gen);
        }

        @Override
        public void onMessage(String text) {
            dispatch(text);
        }

        @Override
        public void onClose(int code, String reason) {
            log.debug("Feed socket closed: code={}, reason={}", code, reason);
            handleClosed(gen);
        }

        @Override
        public void onError(Exception error) {
            log.warn("Feed socket error: {}", error.getMessage());
        }
    }
}
