package com.autopilot.exchange.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.function.LongSupplier;

/**
 * Exchange clock derived from the public ticker endpoint, cached as an offset to the local clock.
 * Falls back to local time when the exchange clock cannot be read.
 */
public class ServerTimestampSource implements TimestampSource {

    private static final Logger log = LoggerFactory.getLogger(ServerTimestampSource.class);
    static final String TICKERS_PATH = "/api/v1/market/tickers";

    private final OkHttpClient httpClient;
    private final String baseUrl;
    private final ObjectMapper mapper = new ObjectMapper();
    private final long syncIntervalMs;
    private final LongSupplier localClock;

    private long offsetMs;
    private long lastSyncAt = Long.MIN_VALUE;

    public ServerTimestampSource(OkHttpClient httpClient, String baseUrl, long syncIntervalMs, LongSupplier localClock) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl;
        this.syncIntervalMs = syncIntervalMs;
        this.localClock = localClock;
    }

    public ServerTimestampSource(OkHttpClient httpClient, String baseUrl, long syncIntervalMs) {
        this(httpClient, baseUrl, syncIntervalMs, System::currentTimeMillis);
    }

    @Override
    public synchronized long currentTimeMillis() {
        long now = localClock.getAsLong();
        if (lastSyncAt == Long.MIN_VALUE || now - lastSyncAt >= syncIntervalMs) {
            sync(now);
        }
        return localClock.getAsLong() + offsetMs;
    }

    private void sync(long now) {
        lastSyncAt = now;
        Request request = new Request.Builder().url(baseUrl + TICKERS_PATH).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                log.warn("Server time unavailable (HTTP {}), using local clock", response.code());
                return;
            }
            JsonNode root = mapper.readTree(response.body().bytes());
            long serverTime = root.path("data").path("timestamp").asLong(0);
            if (serverTime <= 0) {
                serverTime = root.path("timestamp").asLong(0);
            }
            if (serverTime <= 0) {
                log.warn("Server time missing from ticker response, using local clock");
                return;
            }
            offsetMs = serverTime - localClock.getAsLong();
            log.debug("Synced exchange clock, offset {} ms", offsetMs);
        } catch (IOException e) {
            log.warn("Server time sync failed: {}, using local clock", e.getMessage());
        }
    }
}
