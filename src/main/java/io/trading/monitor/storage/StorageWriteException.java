package io.trading.monitor.storage;

/**
 * A storage write did not succeed. Records involved are still pending in the
 * {@link BatchWriter} unless stated otherwise by the thrower.
 */
public class StorageWriteException extends RuntimeException {

    private final int pendingRecords;

    public StorageWriteException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public StorageWriteException(String message, int pendingRecords, Throwable cause) {
        super(message, cause);
        this.pendingRecords = pendingRecords;
    }

    /**
     * Records still waiting for a durable write when this exception was raised.
     */
    public int getPendingRecords() {
        return pendingRecords;
    }
}
