package com.autopilot.exchange.feed;

import org.java_websocket.client.WebSocketClient;
import org.java_websocket.handshake.ServerHandshake;

import java.net.URI;

/**
 * {@link FeedConnector} backed by Java-WebSocket.
 */
public class JavaWebSocketConnector implements FeedConnector {

    private static final int CONNECTION_LOST_TIMEOUT_SECONDS = 30;

    @Override
    public FeedConnection connect(URI uri, Listener listener) {
        FeedSocket socket = new FeedSocket(uri, listener);
        socket.setConnectionLostTimeout(CONNECTION_LOST_TIMEOUT_SECONDS);
        socket.connect();
        return new FeedConnection() {
            @Override
            public void send(String text) {
                if (socket.isOpen()) {
                    socket.send(text);
                }
            }

            @Override
            public void close() {
                socket.close();
            }
        };
    }

    private static class FeedSocket extends WebSocketClient {

        private final Listener listener;

        FeedSocket(URI uri, Listener listener) {
            super(uri);
            this.listener = listener;
        }

        @Override
        public void onOpen(ServerHandshake handshake) {
            listener.onOpen();
        }

        @Override
        public void onMessage(String message) {
            listener.onMessage(message);
        }

        @Override
        public void onClose(int code, String reason, boolean remote) {
            listener.onClose(code, reason);
        }

        @Override
        public void onError(Exception ex) {
            listener.onError(ex);
        }
    }
}
