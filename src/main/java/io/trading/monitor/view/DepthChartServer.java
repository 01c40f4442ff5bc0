package io.trading.monitor.view;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.trading.monitor.core.MonitorStatus;
import io.trading.monitor.model.TradeRecord;
import io.trading.monitor.state.MarketSnapshot;
import io.trading.monitor.state.MarketState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * HTTP view of the market state.
 *
 * A refresh thread samples every symbol's book into a bounded history of cumulative
 * depth frames; the endpoints serve those frames, the current books and trades,
 * pipeline status, health and Prometheus metrics. Only reads {@link MarketState}.
 */
public class DepthChartServer implements MarketView {

    private static final Logger LOGGER = LoggerFactory.getLogger(DepthChartServer.class);

    public static final long DEFAULT_REFRESH_INTERVAL_MS = 1000;
    public static final int DEFAULT_HISTORY_FRAMES = 300;

    private static final int HTTP_THREADS = 2;

    private final int port;
    private final MarketState marketState;
    private final CollectorRegistry registry;
    private final Supplier<MonitorStatus> statusSupplier;
    private final long refreshIntervalMs;
    private final int historyFrames;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, Deque<DepthFrame>> frames = new LinkedHashMap<>();

    private HttpServer server;
    private ExecutorService httpExecutor;
    private ScheduledExecutorService refresher;
    private volatile boolean running = false;

    public DepthChartServer(int port, MarketState marketState, CollectorRegistry registry, Supplier<MonitorStatus> statusSupplier) {
        this(port, marketState, registry, statusSupplier, DEFAULT_REFRESH_INTERVAL_MS, DEFAULT_HISTORY_FRAMES);
    }

    /**
     * @param port              Listen port, 0 for an ephemeral port
     * @param marketState       State to present
     * @param registry          Metrics exported at /metrics
     * @param statusSupplier    Source of the /api/status document
     * @param refreshIntervalMs Sampling period of the depth history
     * @param historyFrames     Frames kept per symbol
     */
    public DepthChartServer(
        int port,
        MarketState marketState,
        CollectorRegistry registry,
        Supplier<MonitorStatus> statusSupplier,
        long refreshIntervalMs,
        int historyFrames
    ) {
        if (refreshIntervalMs <= 0) {
            throw new IllegalArgumentException("refreshIntervalMs must be positive");
        }
        if (historyFrames <= 0) {
            throw new IllegalArgumentException("historyFrames must be positive");
        }
        this.port = port;
        this.marketState = marketState;
        this.registry = registry;
        this.statusSupplier = statusSupplier;
        this.refreshIntervalMs = refreshIntervalMs;
        this.historyFrames = historyFrames;
        for (String symbol : marketState.symbols()) {
            frames.put(symbol, new ArrayDeque<>(historyFrames));
        }
    }

    @Override
    public synchronized boolean start() {
        if (running) {
            return true;
        }

        HttpServer created;
        try {
            created = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            LOGGER.error("Failed to start depth chart server on port {}", port, e);
            return false;
        }

        created.createContext("/metrics", handleMetrics());
        created.createContext("/health", handleHealth());
        created.createContext("/api/status", handleStatus());
        created.createContext("/api/book", handleBook());
        created.createContext("/api/trades", handleTrades());
        created.createContext("/api/depth", handleDepth());

        httpExecutor = Executors.newFixedThreadPool(HTTP_THREADS, daemonThreads("depth-chart-http"));
        created.setExecutor(httpExecutor);
        created.start();
        server = created;

        refresher = Executors.newSingleThreadScheduledExecutor(daemonThreads("depth-chart-refresh"));
        refresher.scheduleAtFixedRate(this::refresh, 0, refreshIntervalMs, TimeUnit.MILLISECONDS);

        running = true;
        LOGGER.info("Depth chart server started on port {}", getPort());
        LOGGER.info("  Depth:   http://localhost:{}/api/depth?symbol=<SYMBOL>", getPort());
        LOGGER.info("  Status:  http://localhost:{}/api/status", getPort());
        LOGGER.info("  Metrics: http://localhost:{}/metrics", getPort());
        return true;
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;

        refresher.shutdownNow();
        server.stop(0);
        httpExecutor.shutdownNow();
        server = null;
        LOGGER.info("Depth chart server stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Bound port, or the configured port when not running.
     */
    public synchronized int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    /**
     * Depth history of a symbol, oldest first.
     */
    public List<DepthFrame> depthHistory(String symbol) {
        Deque<DepthFrame> history = frames.get(symbol);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    void refresh() {
        long now = System.currentTimeMillis();
        try {
            for (MarketSnapshot snapshot : marketState.snapshots()) {
                if (!snapshot.hasBook()) {
                    continue;
                }
                Deque<DepthFrame> history = frames.get(snapshot.symbol());
                synchronized (history) {
                    if (history.size() == historyFrames) {
                        history.pollFirst();
                    }
                    history.addLast(DepthFrame.of(snapshot.book(), now));
                }
            }
        } catch (RuntimeException e) {
            // An exception would cancel the periodic task
            LOGGER.error("Depth refresh failed", e);
        }
    }

    private HttpHandler handleMetrics() {
        return exchange -> {
            try {
                Writer writer = new StringWriter();
                TextFormat.write004(writer, registry.metricFamilySamples());
                send(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString());
            } catch (Exception e) {
                LOGGER.error("Error serving metrics", e);
                sendJson(exchange, 500, Map.of("error", "Internal server error"));
            }
        };
    }

    private HttpHandler handleHealth() {
        return exchange -> send(exchange, 200, "text/plain", "OK");
    }

    private HttpHandler handleStatus() {
        return exchange -> {
            try {
                sendJson(exchange, 200, statusSupplier.get());
            } catch (Exception e) {
                LOGGER.error("Error handling status request", e);
                sendJson(exchange, 500, Map.of("error", "Internal server error"));
            }
        };
    }

    private HttpHandler handleBook() {
        return symbolHandler((exchange, symbol) -> {
            MarketSnapshot snapshot = marketState.snapshot(symbol);
            if (!snapshot.hasBook()) {
                sendJson(exchange, 404, Map.of("error", "No order book yet for " + symbol));
                return;
            }
            sendJson(exchange, 200, snapshot.book());
        });
    }

    private HttpHandler handleTrades() {
        return symbolHandler((exchange, symbol) -> {
            List<TradeRecord> trades = marketState.snapshot(symbol).recentTrades();
            sendJson(exchange, 200, trades);
        });
    }

    private HttpHandler handleDepth() {
        return symbolHandler((exchange, symbol) -> sendJson(exchange, 200, depthHistory(symbol)));
    }

    private HttpHandler symbolHandler(SymbolRequest request) {
        return exchange -> {
            try {
                String symbol = queryParams(exchange.getRequestURI().getRawQuery()).get("symbol");
                if (symbol == null || symbol.isBlank()) {
                    sendJson(exchange, 400, Map.of("error", "Missing query parameter: symbol"));
                    return;
                }
                symbol = symbol.trim().toUpperCase();
                if (!marketState.isTracked(symbol)) {
                    sendJson(exchange, 404, Map.of("error", "Symbol not tracked: " + symbol));
                    return;
                }
                request.handle(exchange, symbol);
            } catch (Exception e) {
                LOGGER.error("Error handling {} request", exchange.getRequestURI().getPath(), e);
                sendJson(exchange, 500, Map.of("error", "Internal server error"));
            }
        };
    }

    static Map<String, String> queryParams(String query) {
        Map<String, String> params = new HashMap<>();
        if (query == null || query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                params.put(pair.substring(0, eq), URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
            }
        }
        return params;
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        send(exchange, statusCode, "application/json", objectMapper.writeValueAsString(body));
    }

    private static void send(HttpExchange exchange, int statusCode, String contentType, String response) throws IOException {
        byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static ThreadFactory daemonThreads(String name) {
        return r -> {
            Thread thread = new Thread(r, name);
            thread.setDaemon(true);
            return thread;
        };
    }

    @FunctionalInterface
    private interface SymbolRequest {
        void handle(HttpExchange exchange, String symbol) throws IOException;
    }
}
