package com.autopilot.exchange.http;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * HMAC-SHA256 request signing.
 * The signed payload is {@code METHOD + PATH + "?" + sortedQuery}, followed by the JSON body for POST and DELETE.
 */
public class RequestSigner {

    public static final String KEY_HEADER = "PIONEX-KEY";
    public static final String SIGNATURE_HEADER = "PIONEX-SIGNATURE";
    public static final String TIMESTAMP_HEADER = "PIONEX-TIMESTAMP";

    private final String apiKey;
    private final byte[] secret;

    public RequestSigner(String apiKey, String apiSecret) {
        if (apiKey == null || apiKey.isBlank()) throw new IllegalArgumentException("apiKey is required");
        if (apiSecret == null || apiSecret.isBlank()) throw new IllegalArgumentException("apiSecret is required");
        this.apiKey = apiKey;
        this.secret = apiSecret.getBytes(StandardCharsets.UTF_8);
    }

    public String getApiKey() {
        return apiKey;
    }

    public String sign(String method, String path, Map<String, String> query, String body) {
        return hmacSha256Hex(payload(method, path, query, body));
    }

    static String payload(String method, String path, Map<String, String> query, String body) {
        StringBuilder sb = new StringBuilder()
                .append(method.toUpperCase())
                .append(path)
                .append('?')
                .append(canonicalQuery(query));
        if (body != null && !body.isEmpty()) {
            sb.append(body);
        }
        return sb.toString();
    }

    /**
     * {@code k=v} pairs sorted by key and joined with {@code &}, without URL encoding.
     */
    public static String canonicalQuery(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        new TreeMap<>(params).forEach((k, v) -> joiner.add(k + "=" + v));
        return joiner.toString();
    }

    String hmacSha256Hex(String payload) {
        HMac mac = new HMac(new SHA256Digest());
        mac.init(new KeyParameter(secret));
        byte[] input = payload.getBytes(StandardCharsets.UTF_8);
        mac.update(input, 0, input.length);
        byte[] out = new byte[mac.getMacSize()];
        mac.doFinal(out, 0);
        return Hex.toHexString(out);
    }
}
