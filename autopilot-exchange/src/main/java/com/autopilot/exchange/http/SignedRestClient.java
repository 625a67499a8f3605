package com.autopilot.exchange.http;

import com.autopilot.exchange.exception.ExchangeApiException;
import com.autopilot.exchange.exception.ExchangeException;
import com.autopilot.exchange.exception.NetworkException;
import com.autopilot.exchange.exception.RateLimitException;
import com.autopilot.exchange.exception.RetriesExhaustedException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Map;
import java.util.TreeMap;

/**
 * REST transport with request signing, rate limiting and bounded retries.
 * Every attempt is re-signed with a fresh timestamp. The client never deduplicates:
 * a retried POST may reach the exchange twice, so callers own idempotency.
 */
public class SignedRestClient {

    private static final Logger log = LoggerFactory.getLogger(SignedRestClient.class);
    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final String baseUrl;
    private final RequestSigner signer;
    private final TimestampSource timestamps;
    private final RetryPolicy retryPolicy;
    private final RateLimiter rateLimiter;
    private final Sleeper sleeper;
    private final ObjectMapper mapper = new ObjectMapper();

    public SignedRestClient(OkHttpClient httpClient, String baseUrl, RequestSigner signer,
                            TimestampSource timestamps, RetryPolicy retryPolicy,
                            RateLimiter rateLimiter, Sleeper sleeper) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.signer = signer;
        this.timestamps = timestamps;
        this.retryPolicy = retryPolicy;
        this.rateLimiter = rateLimiter;
        this.sleeper = sleeper;
    }

    public JsonNode publicGet(String path, Map<String, ?> params) throws ExchangeException {
        return execute("GET", path, params, false);
    }

    public JsonNode signedGet(String path, Map<String, ?> params) throws ExchangeException {
        return execute("GET", path, params, true);
    }

    public JsonNode signedPost(String path, Map<String, ?> params) throws ExchangeException {
        return execute("POST", path, params, true);
    }

    public JsonNode signedDelete(String path, Map<String, ?> params) throws ExchangeException {
        return execute("DELETE", path, params, true);
    }

    public boolean hasCredentials() {
        return signer != null;
    }

    private JsonNode execute(String method, String path, Map<String, ?> params, boolean signed)
            throws ExchangeException {
        if (signed && signer == null) {
            throw new ExchangeException("API credentials are not configured for " + method + " " + path);
        }

        int attempt = 0;
        int rateLimitHits = 0;
        ExchangeException lastError = null;

        while (attempt < retryPolicy.maxAttempts()) {
            try {
                rateLimiter.acquire();
                Request request = buildRequest(method, path, params, signed);
                try (Response response = httpClient.newCall(request).execute()) {
                    int status = response.code();
                    String body = response.body() != null ? response.body().string() : "";

                    if (status == 429) {
                        rateLimitHits++;
                        long waitMs = retryAfterMs(response);
                        if (rateLimitHits > retryPolicy.maxRateLimitRetries()) {
                            throw new RateLimitException("Rate limited on " + method + " " + path
                                    + " after " + rateLimitHits + " responses", waitMs);
                        }
                        log.warn("Rate limited on {} {}, waiting {} ms", method, path, waitMs);
                        sleeper.sleep(waitMs);
                        continue;
                    }
                    rateLimitHits = 0;

                    if (status >= 500) {
                        lastError = ExchangeApiException.ofStatus(status, body);
                        log.warn("Server error on {} {} (attempt {}/{}): {}",
                                method, path, attempt + 1, retryPolicy.maxAttempts(), lastError.getMessage());
                    } else if (status >= 400) {
                        throw ExchangeApiException.ofStatus(status, body);
                    } else {
                        return unwrap(body);
                    }
                }
            } catch (InterruptedIOException e) {
                abortIfInterrupted(e);
                lastError = new NetworkException("Request timed out: " + method + " " + path, e);
                log.warn("Timeout on {} {} (attempt {}/{})", method, path, attempt + 1, retryPolicy.maxAttempts());
            } catch (IOException e) {
                abortIfInterrupted(e);
                lastError = new NetworkException("Connection error: " + e.getMessage(), e);
                log.warn("Connection error on {} {} (attempt {}/{}): {}",
                        method, path, attempt + 1, retryPolicy.maxAttempts(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NetworkException("Request interrupted: " + method + " " + path, e);
            }

            if (attempt < retryPolicy.maxAttempts() - 1) {
                pause(retryPolicy.backoffMillis(attempt), method, path);
            }
            attempt++;
        }

        log.error("All {} attempts failed for {} {}", retryPolicy.maxAttempts(), method, path);
        throw new RetriesExhaustedException(retryPolicy.maxAttempts(), lastError);
    }

    private Request buildRequest(String method, String path, Map<String, ?> params, boolean signed)
            throws JsonProcessingException {
        TreeMap<String, String> query = new TreeMap<>();
        String body = null;
        boolean hasBody = !"GET".equals(method);

        if (hasBody) {
            TreeMap<String, Object> sorted = new TreeMap<>();
            if (params != null) {
                params.forEach((k, v) -> {
                    if (v != null) sorted.put(k, v);
                });
            }
            body = mapper.writeValueAsString(sorted);
        } else if (params != null) {
            params.forEach((k, v) -> {
                if (v != null) query.put(k, String.valueOf(v));
            });
        }

        Request.Builder builder = new Request.Builder();
        if (signed) {
            long timestamp = timestamps.currentTimeMillis();
            query.put("timestamp", String.valueOf(timestamp));
            String signature = signer.sign(method, path, query, body);
            builder.header(RequestSigner.KEY_HEADER, signer.getApiKey())
                    .header(RequestSigner.SIGNATURE_HEADER, signature)
                    .header(RequestSigner.TIMESTAMP_HEADER, String.valueOf(timestamp));
        }

        HttpUrl.Builder url = HttpUrl.get(baseUrl + path).newBuilder();
        query.forEach(url::addQueryParameter);
        builder.url(url.build());

        RequestBody requestBody = hasBody ? RequestBody.create(body, JSON) : null;
        return builder.method(method, requestBody).build();
    }

    /**
     * Returns the envelope's {@code data} node, or the whole document when there is none.
     */
    JsonNode unwrap(String body) throws ExchangeException {
        JsonNode root;
        try {
            root = body.isBlank() ? mapper.createObjectNode() : mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ExchangeApiException(200, "MALFORMED_RESPONSE", "Malformed response: " + e.getOriginalMessage());
        }

        JsonNode result = root.get("result");
        JsonNode code = root.get("code");
        boolean failedResult = result != null && result.isBoolean() && !result.asBoolean();
        boolean failedCode = code != null && !code.isNull() && !"0".equals(code.asText()) && !code.asText().isEmpty();
        if (failedResult || failedCode) {
            String errorCode = code != null ? code.asText() : "UNKNOWN";
            String message = root.path("message").asText(root.path("msg").asText("Unknown exchange error"));
            throw new ExchangeApiException(200, errorCode, errorCode + ": " + message);
        }
        return root.has("data") ? root.get("data") : root;
    }

    private long retryAfterMs(Response response) {
        String header = response.header("Retry-After");
        if (header != null) {
            try {
                return Math.max(0, Long.parseLong(header.trim())) * 1000;
            } catch (NumberFormatException e) {
                log.debug("Unparseable Retry-After header: {}", header);
            }
        }
        return retryPolicy.defaultRetryAfterMs();
    }

    private void pause(long millis, String method, String path) throws NetworkException {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException("Retry interrupted: " + method + " " + path, e);
        }
    }

    private static void abortIfInterrupted(IOException e) throws NetworkException {
        if (Thread.currentThread().isInterrupted()) {
            throw new NetworkException("Request interrupted", e);
        }
    }
}
