package io.trading.monitor.feed;

import io.trading.monitor.metrics.MonitorMetrics;
import io.trading.monitor.model.ConnectionState;
import io.trading.monitor.model.MarketRecord;
import io.trading.monitor.model.OrderBookUpdate;
import io.trading.monitor.model.TradeRecord;
import io.trading.monitor.netty.FeedTransport;
import io.trading.monitor.netty.ReconnectHandler;
import io.trading.monitor.state.MarketState;
import io.trading.monitor.state.SequenceDesyncException;
import io.trading.monitor.state.UnknownSymbolException;
import io.trading.monitor.storage.BatchWriter;
import io.trading.monitor.util.ExponentialBackoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Binance combined-stream ingestor.
 *
 * Owns the feed connection and its reconnect loop. Every inbound message is decoded,
 * applied to {@link MarketState} and, when accepted, handed to the {@link BatchWriter}.
 * Each connection attempt opens a new session; callbacks from an earlier session are
 * ignored, so nothing from a dropped connection reaches the state or the writer.
 */
public class StreamIngestor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamIngestor.class);

    private static final String NAME = "Feed";
    private static final long SCHEDULER_SHUTDOWN_TIMEOUT_MS = 5000;

    private final URI feedUri;
    private final List<String> symbols;
    private final int bookDepth;
    private final MarketState marketState;
    private final BatchWriter batchWriter;
    private final BinanceStreamParser parser;
    private final BookSnapshotSource snapshotSource;
    private final MonitorMetrics metrics;
    private final FeedTransport.Factory transportFactory;

    private final ScheduledExecutorService scheduler;
    private final ReconnectHandler reconnectHandler;

    private final Object sessionLock = new Object();
    private final Set<String> resyncInFlight = ConcurrentHashMap.newKeySet();
    private final List<ConnectionStateListener> stateListeners = new CopyOnWriteArrayList<>();

    private final AtomicLong messageCount = new AtomicLong(0);
    private final AtomicLong errorCount = new AtomicLong(0);
    private final AtomicLong reconnectCount = new AtomicLong(0);
    private final AtomicLong requestId = new AtomicLong(0);

    private FeedTransport transport;
    private volatile long activeSession = 0;
    private volatile ConnectionState connectionState = ConnectionState.DISCONNECTED;
    private volatile boolean closed = false;

    /**
     * Creates an ingestor. Nothing is opened until {@link #connect()}.
     *
     * @param feedUri          Combined-stream WebSocket endpoint
     * @param symbols          Symbols to subscribe to
     * @param bookDepth        Partial depth levels per side (5, 10 or 20)
     * @param marketState      Destination of decoded records
     * @param batchWriter      Persistence queue for accepted records
     * @param parser           Message decoder
     * @param snapshotSource   REST snapshot source used after a desync, or null to keep the current book
     * @param metrics          Metrics sink
     * @param transportFactory Creates one transport per connection attempt
     * @param reconnectBackoff Delay policy between reconnection attempts
     */
    public StreamIngestor(
        URI feedUri,
        List<String> symbols,
        int bookDepth,
        MarketState marketState,
        BatchWriter batchWriter,
        BinanceStreamParser parser,
        BookSnapshotSource snapshotSource,
        MonitorMetrics metrics,
        FeedTransport.Factory transportFactory,
        ExponentialBackoff reconnectBackoff
    ) {
        if (symbols == null || symbols.isEmpty()) {
            throw new IllegalArgumentException("symbols cannot be null or empty");
        }
        this.feedUri = feedUri;
        this.symbols = List.copyOf(symbols);
        this.bookDepth = bookDepth;
        this.marketState = marketState;
        this.batchWriter = batchWriter;
        this.parser = parser;
        this.snapshotSource = snapshotSource;
        this.metrics = metrics;
        this.transportFactory = transportFactory;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "feed-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        this.reconnectHandler = new ReconnectHandler(NAME, reconnectBackoff, scheduler, this::reconnectAttempt);
    }

    /**
     * Starts connecting in the background. Failures are retried with backoff; never throws.
     */
    public void connect() {
        if (closed) {
            LOGGER.warn("[Feed] Cannot connect, ingestor is closed");
            return;
        }
        reconnectHandler.start();
        submit(this::openSession);
    }

    /**
     * Drops the current session, if any, and connects again immediately.
     */
    public void reconnect() {
        if (closed) {
            LOGGER.warn("[Feed] Cannot reconnect, ingestor is closed");
            return;
        }
        LOGGER.info("[Feed] Manual reconnect requested");
        reconnectHandler.start();
        reconnectHandler.cancel();
        submit(this::reconnectAttempt);
    }

    /**
     * Closes the session and stops all background work. Only the first call has an effect.
     */
    @Override
    public void close() {
        FeedTransport current;
        synchronized (sessionLock) {
            if (closed) {
                return;
            }
            closed = true;
            activeSession++;
            setState(ConnectionState.CLOSING);
            current = transport;
            transport = null;
        }

        reconnectHandler.stop();
        closeTransport(current);

        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(SCHEDULER_SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                LOGGER.warn("[Feed] Scheduler did not terminate within {} ms", SCHEDULER_SHUTDOWN_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        synchronized (sessionLock) {
            setState(ConnectionState.DISCONNECTED);
        }
        LOGGER.info("[Feed] Closed (messages={}, errors={}, reconnects={})",
            messageCount.get(), errorCount.get(), reconnectCount.get());
    }

    public void addConnectionStateListener(ConnectionStateListener listener) {
        stateListeners.add(listener);
    }

    public ConnectionState getConnectionState() {
        return connectionState;
    }

    public long getMessageCount() {
        return messageCount.get();
    }

    public long getErrorCount() {
        return errorCount.get();
    }

    public long getReconnectCount() {
        return reconnectCount.get();
    }

    public boolean isClosed() {
        return closed;
    }

    public List<String> getSymbols() {
        return symbols;
    }

    /**
     * Builds the SUBSCRIBE request for the trade and partial depth streams of every symbol.
     */
    String subscribeMessage() {
        List<String> streams = new ArrayList<>(symbols.size() * 2);
        for (String symbol : symbols) {
            String lower = symbol.toLowerCase();
            streams.add(lower + "@trade");
            streams.add(lower + "@depth" + bookDepth + "@100ms");
        }
        return String.format(
            "{\"method\":\"SUBSCRIBE\",\"params\":[\"%s\"],\"id\":%d}",
            String.join("\",\"", streams),
            requestId.incrementAndGet()
        );
    }

    private void reconnectAttempt() {
        reconnectCount.incrementAndGet();
        metrics.recordReconnectAttempt();
        openSession();
    }

    /**
     * Runs on the feed scheduler. Replaces the current session with a new one.
     */
    private void openSession() {
        FeedTransport previous;
        FeedTransport next;
        long session;
        synchronized (sessionLock) {
            if (closed) {
                return;
            }
            previous = transport;
            session = ++activeSession;
            next = transportFactory.create(feedUri, new SessionListener(session));
            transport = next;
            setState(ConnectionState.CONNECTING);
        }

        closeTransport(previous);

        LOGGER.info("[Feed] Connecting to {} (session {})", feedUri, session);
        try {
            next.connect();
        } catch (IOException | RuntimeException e) {
            errorCount.incrementAndGet();
            LOGGER.warn("[Feed] Connection attempt failed: {}", e.getMessage());
            onSessionLost(session);
        }
    }

    private void onSessionConnected(long session) {
        FeedTransport current;
        synchronized (sessionLock) {
            if (closed || session != activeSession) {
                return;
            }
            setState(ConnectionState.CONNECTED);
            current = transport;
        }

        reconnectHandler.reset();
        String subscribe = subscribeMessage();
        current.send(subscribe);
        LOGGER.info("[Feed] Subscribed to {} symbols: {}", symbols.size(), symbols);
    }

    private void onSessionLost(long session) {
        FeedTransport lost;
        synchronized (sessionLock) {
            if (closed || session != activeSession) {
                return;
            }
            setState(ConnectionState.DISCONNECTED);
            lost = transport;
            transport = null;
        }

        // The transport cannot be closed from its own I/O thread
        if (lost != null) {
            submit(() -> closeTransport(lost));
        }
        reconnectHandler.scheduleReconnect();
    }

    private void onSessionMessage(long session, String message) {
        if (session != activeSession || connectionState != ConnectionState.CONNECTED) {
            return;
        }
        messageCount.incrementAndGet();

        MarketRecord record;
        try {
            record = parser.decode(message, System.currentTimeMillis());
        } catch (DecodeException e) {
            errorCount.incrementAndGet();
            metrics.recordDecodeError();
            LOGGER.warn("[Feed] Skipping undecodable message: {}", e.getMessage());
            return;
        }

        if (record != null) {
            apply(record);
        }
    }

    private void apply(MarketRecord record) {
        try {
            if (record instanceof TradeRecord trade) {
                metrics.recordMessageReceived("trade");
                if (marketState.recordTrade(trade)) {
                    batchWriter.enqueue(trade);
                } else {
                    LOGGER.debug("[Feed] Duplicate trade {} for {} ignored", trade.tradeId(), trade.symbol());
                }
            } else if (record instanceof OrderBookUpdate book) {
                metrics.recordMessageReceived("book");
                applyBook(book);
            }
        } catch (UnknownSymbolException e) {
            metrics.recordUnknownSymbol();
            LOGGER.warn("[Feed] Dropping record for untracked symbol {}", e.getSymbol());
        } catch (IllegalStateException e) {
            LOGGER.warn("[Feed] Record not persisted: {}", e.getMessage());
        }
    }

    private void applyBook(OrderBookUpdate book) {
        try {
            marketState.replaceBook(book);
        } catch (SequenceDesyncException e) {
            onDesync(e);
            return;
        }
        batchWriter.enqueue(book);
    }

    private void onDesync(SequenceDesyncException e) {
        String symbol = e.getSymbol();
        metrics.recordBookDesync(symbol);

        if (snapshotSource == null) {
            LOGGER.warn("[Feed] {} book sequence regressed ({} < {}), keeping current book",
                symbol, e.getReceivedSequence(), e.getStoredSequence());
            return;
        }
        if (!resyncInFlight.add(symbol)) {
            LOGGER.debug("[Feed] Resync for {} already in progress", symbol);
            return;
        }

        LOGGER.warn("[Feed] {} book sequence regressed ({} < {}), resyncing from snapshot",
            symbol, e.getReceivedSequence(), e.getStoredSequence());
        marketState.dropBook(symbol);
        if (!submit(() -> resync(symbol))) {
            resyncInFlight.remove(symbol);
        }
    }

    private void resync(String symbol) {
        try {
            OrderBookUpdate snapshot = snapshotSource.fetchSnapshot(symbol);
            marketState.replaceBook(snapshot);
            batchWriter.enqueue(snapshot);
            metrics.recordBookResync(symbol);
            LOGGER.info("[Feed] {} book resynced at sequence {}", symbol, snapshot.sequence());
        } catch (IOException e) {
            LOGGER.warn("[Feed] Snapshot fetch for {} failed: {}", symbol, e.getMessage());
        } catch (SequenceDesyncException e) {
            LOGGER.info("[Feed] Stream for {} is ahead of the snapshot ({} < {}), keeping streamed book",
                symbol, e.getReceivedSequence(), e.getStoredSequence());
        } catch (IllegalStateException e) {
            LOGGER.warn("[Feed] Snapshot for {} not persisted: {}", symbol, e.getMessage());
        } finally {
            resyncInFlight.remove(symbol);
        }
    }

    /**
     * Called with {@link #sessionLock} held.
     */
    private void setState(ConnectionState next) {
        ConnectionState previous = connectionState;
        if (previous == next) {
            return;
        }
        connectionState = next;
        metrics.setConnectionState(next);
        LOGGER.info("[Feed] {} -> {}", previous, next);

        for (ConnectionStateListener listener : stateListeners) {
            try {
                listener.onStateChange(previous, next);
            } catch (RuntimeException e) {
                LOGGER.error("[Feed] Connection state listener failed", e);
            }
        }
    }

    private boolean submit(Runnable task) {
        try {
            scheduler.execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            LOGGER.debug("[Feed] Scheduler is shut down, task not run");
            return false;
        }
    }

    private static void closeTransport(FeedTransport t) {
        if (t == null) {
            return;
        }
        try {
            t.close();
        } catch (RuntimeException e) {
            LOGGER.warn("[Feed] Error closing transport: {}", e.getMessage());
        }
    }

    /**
     * Transport callbacks bound to one session id.
     */
    private final class SessionListener implements FeedTransport.Listener {
        private final long session;

        SessionListener(long session) {
            this.session = session;
        }

        @Override
        public void onConnected() {
            onSessionConnected(session);
        }

        @Override
        public void onMessage(String message) {
            onSessionMessage(session, message);
        }

        @Override
        public void onError(Throwable error) {
            if (session == activeSession) {
                errorCount.incrementAndGet();
                LOGGER.warn("[Feed] Transport error: {}", error.getMessage());
            }
        }

        @Override
        public void onDisconnected() {
            onSessionLost(session);
        }
    }
}
