package io.trading.monitor.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Summary;
import io.prometheus.client.hotspot.DefaultExports;
import io.trading.monitor.model.ConnectionState;

/**
 * Prometheus metrics collector for the Crypto Monitor.
 *
 * Tracks:
 * - Feed message counts per record type
 * - Decode errors, untracked symbols, book desyncs and resyncs
 * - Connection state and reconnect attempts
 * - Records enqueued, persisted and pending; flush failures and latency
 */
public class MonitorMetrics {

    private final CollectorRegistry registry;

    // Counters
    private final Counter messagesReceived;
    private final Counter decodeErrors;
    private final Counter unknownSymbols;
    private final Counter bookDesyncs;
    private final Counter bookResyncs;
    private final Counter reconnectAttempts;
    private final Counter recordsEnqueued;
    private final Counter recordsPersisted;
    private final Counter flushFailures;

    // Gauges
    private final Gauge connectionState;
    private final Gauge pendingRecords;

    // Summary (latency tracking)
    private final Summary flushLatency;

    /**
     * Creates metrics on the default registry, including JVM metrics.
     */
    public static MonitorMetrics withDefaultRegistry() {
        DefaultExports.initialize();
        return new MonitorMetrics(CollectorRegistry.defaultRegistry);
    }

    public MonitorMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.messagesReceived = Counter.build()
            .name("monitor_messages_received_total")
            .help("Total number of decoded feed messages")
            .labelNames("type")
            .register(registry);

        this.decodeErrors = Counter.build()
            .name("monitor_decode_errors_total")
            .help("Total number of feed messages that failed to decode")
            .register(registry);

        this.unknownSymbols = Counter.build()
            .name("monitor_unknown_symbol_total")
            .help("Total number of records dropped for an untracked symbol")
            .register(registry);

        this.bookDesyncs = Counter.build()
            .name("monitor_book_desyncs_total")
            .help("Total number of order book sequence regressions")
            .labelNames("symbol")
            .register(registry);

        this.bookResyncs = Counter.build()
            .name("monitor_book_resyncs_total")
            .help("Total number of order book snapshots applied after a desync")
            .labelNames("symbol")
            .register(registry);

        this.reconnectAttempts = Counter.build()
            .name("monitor_reconnect_attempts_total")
            .help("Total number of feed reconnection attempts")
            .register(registry);

        this.recordsEnqueued = Counter.build()
            .name("monitor_records_enqueued_total")
            .help("Total number of records handed to the batch writer")
            .register(registry);

        this.recordsPersisted = Counter.build()
            .name("monitor_records_persisted_total")
            .help("Total number of records acknowledged by storage")
            .register(registry);

        this.flushFailures = Counter.build()
            .name("monitor_flush_failures_total")
            .help("Total number of flushes that exhausted their storage retries")
            .register(registry);

        // Connection state gauge (ordinal of ConnectionState)
        this.connectionState = Gauge.build()
            .name("monitor_connection_state")
            .help("Feed connection state (0 = disconnected, 1 = connecting, 2 = connected, 3 = closing)")
            .register(registry);

        this.pendingRecords = Gauge.build()
            .name("monitor_pending_records")
            .help("Records waiting in the batch writer")
            .register(registry);

        this.flushLatency = Summary.build()
            .name("monitor_flush_latency_milliseconds")
            .help("Storage batch write latency in milliseconds")
            .register(registry);
    }

    public void recordMessageReceived(String type) {
        messagesReceived.labels(type).inc();
    }

    public void recordDecodeError() {
        decodeErrors.inc();
    }

    public void recordUnknownSymbol() {
        unknownSymbols.inc();
    }

    public void recordBookDesync(String symbol) {
        bookDesyncs.labels(symbol).inc();
    }

    public void recordBookResync(String symbol) {
        bookResyncs.labels(symbol).inc();
    }

    public void recordReconnectAttempt() {
        reconnectAttempts.inc();
    }

    public void recordEnqueued() {
        recordsEnqueued.inc();
    }

    public void recordPersisted(int count) {
        recordsPersisted.inc(count);
    }

    public void recordFlushFailure() {
        flushFailures.inc();
    }

    public void setConnectionState(ConnectionState state) {
        connectionState.set(state.ordinal());
    }

    public void setPendingRecords(int count) {
        pendingRecords.set(count);
    }

    public void recordFlushLatency(double latencyMs) {
        flushLatency.observe(latencyMs);
    }

    /**
     * Returns the CollectorRegistry for the HTTP server.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }

    public double getMessagesReceived(String type) {
        return messagesReceived.labels(type).get();
    }

    public double getDecodeErrors() {
        return decodeErrors.get();
    }

    public double getRecordsPersisted() {
        return recordsPersisted.get();
    }

    public double getFlushFailures() {
        return flushFailures.get();
    }
}
