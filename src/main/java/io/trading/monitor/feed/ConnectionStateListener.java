package io.trading.monitor.feed;

import io.trading.monitor.model.ConnectionState;

/**
 * Observer of feed connection state transitions. Must return quickly.
 */
@FunctionalInterface
public interface ConnectionStateListener {
    void onStateChange(ConnectionState previous, ConnectionState current);
}
