package com.autopilot.exchange.feed;

/**
 * One live (or pending) socket opened by a {@link FeedConnector}.
 */
public interface FeedConnection {

    void send(String text);

    void close();
}
