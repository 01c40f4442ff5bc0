package io.trading.monitor.model;

/**
 * Lifecycle of the feed connection.
 */
public enum ConnectionState {
    DISCONNECTED("Disconnected"),
    CONNECTING("Connecting"),
    CONNECTED("Connected"),
    CLOSING("Closing");

    private final String displayName;

    ConnectionState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
