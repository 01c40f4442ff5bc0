package io.trading.monitor.storage;

import io.trading.monitor.model.MarketRecord;

import java.util.List;

/**
 * Durable sink for market records. {@link BatchWriter} is its only caller.
 */
public interface RecordStore extends AutoCloseable {

    /**
     * Writes the records atomically: either all of them are stored or none.
     *
     * @throws StorageWriteException if the write failed
     */
    void writeBatch(List<MarketRecord> records);

    /**
     * Releases the underlying storage resources.
     */
    @Override
    void close();
}
