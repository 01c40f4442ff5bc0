package io.trading.monitor.feed;

/**
 * A feed message could not be turned into a market record.
 */
public class DecodeException extends RuntimeException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
