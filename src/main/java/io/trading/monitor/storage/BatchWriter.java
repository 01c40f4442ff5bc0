package io.trading.monitor.storage;

import io.trading.monitor.metrics.MonitorMetrics;
import io.trading.monitor.model.MarketRecord;
import io.trading.monitor.util.ExponentialBackoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Accumulates market records and writes them to a {@link RecordStore} in batches.
 *
 * A record stays in the pending batch until the store has acknowledged the chunk
 * containing it, so a failed write never loses data. Automatic flushes run on the
 * writer's own thread and only write full batches; {@link #flush()} writes everything
 * that was pending when it was called.
 *
 * With the time-based flush disabled, N full batches of records produce exactly N
 * store writes. A periodic flush may write partial batches in between.
 */
public class BatchWriter implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchWriter.class);
    private static final long CLOSE_TIMEOUT_MS = 10000;

    private final RecordStore store;
    private final int batchSize;
    private final int maxAttempts;
    private final ExponentialBackoff retryBackoff;
    private final MonitorMetrics metrics;
    private final ScheduledExecutorService executor;

    private final Object pendingLock = new Object();
    private final List<MarketRecord> pending = new ArrayList<>();
    private final ReentrantLock flushLock = new ReentrantLock();

    private final AtomicBoolean autoFlushScheduled = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong persistedCount = new AtomicLong(0);
    private final AtomicLong failedFlushCount = new AtomicLong(0);

    private volatile FlushListener flushListener;

    /**
     * Creates a batch writer.
     *
     * @param store           Destination of the batches
     * @param batchSize       Pending record count that triggers an automatic flush
     * @param flushIntervalMs Period of the time-based flush, 0 to disable
     * @param maxAttempts     Write attempts per chunk within one flush
     * @param retryBackoff    Delay between attempts
     * @param metrics         Metrics sink
     */
    public BatchWriter(
        RecordStore store,
        int batchSize,
        long flushIntervalMs,
        int maxAttempts,
        ExponentialBackoff retryBackoff,
        MonitorMetrics metrics
    ) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.store = store;
        this.batchSize = batchSize;
        this.maxAttempts = maxAttempts;
        this.retryBackoff = retryBackoff;
        this.metrics = metrics;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "batch-writer");
            thread.setDaemon(true);
            return thread;
        });

        if (flushIntervalMs > 0) {
            executor.scheduleWithFixedDelay(
                this::periodicFlush,
                flushIntervalMs,
                flushIntervalMs,
                TimeUnit.MILLISECONDS
            );
        }
        LOGGER.info("Batch writer started (batchSize={}, flushInterval={} ms, maxAttempts={})",
            batchSize, flushIntervalMs, maxAttempts);
    }

    /**
     * Appends a record to the pending batch. Schedules an automatic flush once a full
     * batch is pending; never waits for storage.
     *
     * @throws IllegalStateException if the writer has been closed
     */
    public void enqueue(MarketRecord record) {
        int size;
        synchronized (pendingLock) {
            if (closed.get()) {
                throw new IllegalStateException("Batch writer is closed");
            }
            pending.add(record);
            size = pending.size();

            // Scheduled under the lock so close() cannot shut the executor down in between
            if (size >= batchSize && autoFlushScheduled.compareAndSet(false, true)) {
                try {
                    executor.execute(this::autoFlush);
                } catch (RejectedExecutionException e) {
                    autoFlushScheduled.set(false);
                    LOGGER.debug("Automatic flush not scheduled, writer is shutting down");
                }
            }
        }

        metrics.recordEnqueued();
        metrics.setPendingRecords(size);
    }

    /**
     * Writes every record that is pending at the time of the call.
     *
     * @return number of records written
     * @throws StorageWriteException if a chunk still failed after all attempts;
     *                               it and all later records remain pending
     */
    public int flush() {
        return writePending(true);
    }

    /**
     * Sets the callback notified when a background flush gives up.
     */
    public void setFlushListener(FlushListener listener) {
        this.flushListener = listener;
    }

    public int pendingCount() {
        synchronized (pendingLock) {
            return pending.size();
        }
    }

    public long persistedCount() {
        return persistedCount.get();
    }

    public long failedFlushCount() {
        return failedFlushCount.get();
    }

    public int getBatchSize() {
        return batchSize;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stops background flushing, writes what is left and closes the store.
     * Only the first call has an effect.
     *
     * @throws StorageWriteException if the final flush failed; the store is closed anyway
     */
    @Override
    public void close() {
        synchronized (pendingLock) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
        }

        executor.shutdown();
        try {
            if (!executor.awaitTermination(CLOSE_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        StorageWriteException failure = null;
        try {
            int written = flush();
            LOGGER.info("Final flush wrote {} records", written);
        } catch (StorageWriteException e) {
            failure = e;
        } finally {
            store.close();
        }

        if (failure != null) {
            int lost = pendingCount();
            LOGGER.error("Final flush failed, {} records were not persisted", lost, failure);
            throw new StorageWriteException("Final flush failed; " + lost + " records not persisted", lost, failure);
        }
        LOGGER.info("Batch writer closed (persisted={})", persistedCount.get());
    }

    private void autoFlush() {
        autoFlushScheduled.set(false);
        try {
            writePending(false);
        } catch (StorageWriteException e) {
            onBackgroundFailure(e);
        }
    }

    private void periodicFlush() {
        try {
            writePending(true);
        } catch (StorageWriteException e) {
            onBackgroundFailure(e);
        }
    }

    private void onBackgroundFailure(StorageWriteException e) {
        LOGGER.warn("Background flush failed, {} records kept pending: {}", e.getPendingRecords(), e.getMessage());
        FlushListener listener = flushListener;
        if (listener != null) {
            listener.onFlushFailed(e);
        }
    }

    private int writePending(boolean includePartial) {
        flushLock.lock();
        try {
            int target;
            synchronized (pendingLock) {
                target = pending.size();
            }

            int written = 0;
            while (written < target) {
                List<MarketRecord> chunk;
                synchronized (pendingLock) {
                    int available = Math.min(pending.size(), target - written);
                    if (available == 0 || (!includePartial && available < batchSize)) {
                        break;
                    }
                    chunk = new ArrayList<>(pending.subList(0, Math.min(batchSize, available)));
                }

                writeWithRetry(chunk);

                int remaining;
                synchronized (pendingLock) {
                    pending.subList(0, chunk.size()).clear();
                    remaining = pending.size();
                }
                written += chunk.size();
                persistedCount.addAndGet(chunk.size());
                metrics.recordPersisted(chunk.size());
                metrics.setPendingRecords(remaining);
            }

            if (written > 0) {
                LOGGER.debug("Flushed {} records", written);
            }
            return written;
        } finally {
            flushLock.unlock();
        }
    }

    private void writeWithRetry(List<MarketRecord> chunk) {
        RuntimeException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            long start = System.nanoTime();
            try {
                store.writeBatch(chunk);
                metrics.recordFlushLatency((System.nanoTime() - start) / 1_000_000.0);
                if (attempt > 1) {
                    LOGGER.info("Storage write succeeded on attempt {}/{}", attempt, maxAttempts);
                }
                return;
            } catch (RuntimeException e) {
                lastError = e;
                LOGGER.warn("Storage write attempt {}/{} failed for {} records: {}",
                    attempt, maxAttempts, chunk.size(), e.getMessage());
            }

            if (attempt < maxAttempts && !pause(retryBackoff.delayForAttempt(attempt))) {
                break;
            }
        }

        failedFlushCount.incrementAndGet();
        metrics.recordFlushFailure();
        throw new StorageWriteException(
            "Storage write failed after " + maxAttempts + " attempts",
            pendingCount(),
            lastError
        );
    }

    private static boolean pause(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Notified when an automatic or periodic flush exhausts its attempts.
     */
    @FunctionalInterface
    public interface FlushListener {
        void onFlushFailed(StorageWriteException error);
    }
}
