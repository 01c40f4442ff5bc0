package io.trading.monitor.storage;

import io.trading.monitor.model.MarketRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory RecordStore that can be told to fail a number of writes.
 */
public class FakeRecordStore implements RecordStore {

    private final List<List<MarketRecord>> batches = new ArrayList<>();
    private int failuresRemaining;
    private boolean failAlways;
    private int attempts;
    private boolean closed;

    public synchronized void failNext(int count) {
        this.failuresRemaining = count;
    }

    public synchronized void failAlways(boolean failAlways) {
        this.failAlways = failAlways;
    }

    @Override
    public synchronized void writeBatch(List<MarketRecord> records) {
        attempts++;
        if (failAlways || failuresRemaining > 0) {
            if (failuresRemaining > 0) {
                failuresRemaining--;
            }
            throw new StorageWriteException("simulated storage failure", null);
        }
        batches.add(List.copyOf(records));
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    public synchronized List<List<MarketRecord>> batches() {
        return new ArrayList<>(batches);
    }

    public synchronized List<MarketRecord> written() {
        List<MarketRecord> all = new ArrayList<>();
        batches.forEach(all::addAll);
        return all;
    }

    public synchronized int attempts() {
        return attempts;
    }

    public synchronized boolean isClosed() {
        return closed;
    }
}
