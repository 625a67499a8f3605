package com.autopilot.exchange.http;

import com.autopilot.exchange.model.TradingConfig;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

import java.util.concurrent.TimeUnit;

/**
 * Shared OkHttp client configuration for exchange traffic.
 */
public final class HttpClients {

    private HttpClients() {}

    public static OkHttpClient create(TradingConfig.ExchangeConfig config) {
        return new OkHttpClient.Builder()
                .connectTimeout(config.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .writeTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .callTimeout(config.getTimeoutSeconds() + config.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
                .connectionPool(new ConnectionPool(5, 5, TimeUnit.MINUTES))
                .retryOnConnectionFailure(true)
                .build();
    }
}
