package io.trading.monitor.netty;

import java.io.IOException;
import java.net.URI;

/**
 * A streaming text connection to the market data feed.
 * Implementations report lifecycle and inbound messages through a {@link Listener}.
 */
public interface FeedTransport extends AutoCloseable {

    /**
     * Opens the connection. Returns once the socket is established; the listener's
     * {@link Listener#onConnected()} fires when the protocol handshake completes.
     *
     * @throws IOException if the connection could not be opened
     */
    void connect() throws IOException;

    /**
     * Sends a text message. Dropped with a warning if not connected.
     */
    void send(String message);

    /**
     * Returns whether the connection is open and the handshake completed.
     */
    boolean isConnected();

    /**
     * Closes the connection and releases its threads. Safe to call more than once.
     */
    @Override
    void close();

    /**
     * Callbacks for a single connection. Invoked on the transport's I/O thread.
     */
    interface Listener {
        void onConnected();

        void onMessage(String message);

        void onError(Throwable error);

        void onDisconnected();
    }

    /**
     * Creates a transport bound to a listener.
     */
    @FunctionalInterface
    interface Factory {
        FeedTransport create(URI uri, Listener listener);
    }
}
