package com.autopilot.exchange.feed;

import java.net.URI;

/**
 * Opens sockets for the feed. Connecting is asynchronous: the outcome arrives through the listener.
 */
public interface FeedConnector {

    FeedConnection connect(URI uri, Listener listener);

    interface Listener {
        void onOpen();

        void onMessage(String text);

        void onClose(int code, String reason);

        void onError(Exception error);
    }
}
