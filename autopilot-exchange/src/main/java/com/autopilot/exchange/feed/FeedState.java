package com.autopilot.exchange.feed;

public enum FeedState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    /** Reconnect budget exhausted; callers poll REST until the feed is restarted. */
    DEGRADED
}
