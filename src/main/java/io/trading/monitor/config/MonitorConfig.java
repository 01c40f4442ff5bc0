package io.trading.monitor.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Startup configuration for the Crypto Monitor.
 *
 * @param databaseId              JDBC URL, or a SQLite file name
 * @param symbols                 Tracked symbols, upper case, in subscription order
 * @param batchSize               Pending record count that triggers an automatic flush
 * @param vizEnabled              Whether to start the depth chart server at startup
 * @param vizPort                 Port of the depth chart server
 * @param feedUrl                 Combined-stream WebSocket URL
 * @param restUrl                 REST base URL used for order book snapshots
 * @param tradeHistoryCapacity    Recent trades kept per symbol
 * @param bookDepth               Order book levels subscribed per side (5, 10 or 20)
 * @param flushIntervalMs         Period of the time-based flush, 0 to disable
 * @param flushMaxAttempts        Storage write attempts per chunk within one flush
 * @param flushMaxBackoffMs       Cap of the delay between storage write attempts
 * @param reconnectInitialDelayMs First reconnect delay
 * @param reconnectMaxDelayMs     Cap of the reconnect delay
 * @param resyncEnabled           Whether a desynced book is refetched over REST
 */
public record MonitorConfig(
    String databaseId,
    List<String> symbols,
    int batchSize,
    boolean vizEnabled,
    int vizPort,
    String feedUrl,
    String restUrl,
    int tradeHistoryCapacity,
    int bookDepth,
    long flushIntervalMs,
    int flushMaxAttempts,
    long flushMaxBackoffMs,
    long reconnectInitialDelayMs,
    long reconnectMaxDelayMs,
    boolean resyncEnabled
) {
    public static final String DEFAULT_DATABASE = "crypto_data.db";
    public static final String DEFAULT_SYMBOLS = "BTCUSDT,ETHUSDT";
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final int DEFAULT_VIZ_PORT = 8050;
    public static final String DEFAULT_FEED_URL = "wss://stream.binance.com:9443/stream";
    public static final String DEFAULT_REST_URL = "https://api.binance.com";
    public static final int DEFAULT_TRADE_HISTORY = 1000;
    public static final int DEFAULT_BOOK_DEPTH = 20;
    public static final long DEFAULT_FLUSH_INTERVAL_MS = 0;
    public static final int DEFAULT_FLUSH_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_FLUSH_MAX_BACKOFF_MS = 2000;
    public static final long DEFAULT_RECONNECT_INITIAL_DELAY_MS = 1000;
    public static final long DEFAULT_RECONNECT_MAX_DELAY_MS = 60000;

    private static final Set<Integer> SUPPORTED_DEPTHS = Set.of(5, 10, 20);

    public MonitorConfig {
        if (databaseId == null || databaseId.isBlank()) {
            throw new IllegalArgumentException("databaseId cannot be null or empty");
        }
        if (symbols == null || symbols.isEmpty()) {
            throw new IllegalArgumentException("symbols cannot be null or empty");
        }
        symbols = normalizeSymbols(symbols);
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        if (vizPort < 1 || vizPort > 65535) {
            throw new IllegalArgumentException("vizPort must be between 1 and 65535");
        }
        if (feedUrl == null || feedUrl.isBlank()) {
            throw new IllegalArgumentException("feedUrl cannot be null or empty");
        }
        if (restUrl == null || restUrl.isBlank()) {
            throw new IllegalArgumentException("restUrl cannot be null or empty");
        }
        if (tradeHistoryCapacity <= 0) {
            throw new IllegalArgumentException("tradeHistoryCapacity must be positive");
        }
        if (!SUPPORTED_DEPTHS.contains(bookDepth)) {
            throw new IllegalArgumentException("bookDepth must be one of " + SUPPORTED_DEPTHS);
        }
        if (flushIntervalMs < 0) {
            throw new IllegalArgumentException("flushIntervalMs cannot be negative");
        }
        if (flushMaxAttempts <= 0) {
            throw new IllegalArgumentException("flushMaxAttempts must be positive");
        }
        if (flushMaxBackoffMs < 0) {
            throw new IllegalArgumentException("flushMaxBackoffMs cannot be negative");
        }
        if (reconnectInitialDelayMs <= 0) {
            throw new IllegalArgumentException("reconnectInitialDelayMs must be positive");
        }
        if (reconnectMaxDelayMs < reconnectInitialDelayMs) {
            throw new IllegalArgumentException("reconnectMaxDelayMs cannot be below reconnectInitialDelayMs");
        }
    }

    /**
     * Returns the JDBC URL for {@link #databaseId()}. Plain names are treated as SQLite files.
     */
    public String jdbcUrl() {
        if (databaseId.startsWith("jdbc:")) {
            return databaseId;
        }
        return "jdbc:sqlite:" + databaseId;
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables:
     * - MONITOR_DB: JDBC URL or SQLite file (default: "crypto_data.db")
     * - SYMBOLS: Comma separated symbols (default: "BTCUSDT,ETHUSDT")
     * - BATCH_SIZE: Records per storage batch (default: 100)
     * - VIZ_ENABLED: Start the depth chart server (default: false)
     * - VIZ_PORT: Depth chart server port (default: 8050)
     * - FEED_URL / REST_URL: Binance endpoints
     * - TRADE_HISTORY: Recent trades kept per symbol (default: 1000)
     * - BOOK_DEPTH: Book levels per side, 5, 10 or 20 (default: 20)
     * - FLUSH_INTERVAL_MS: Time-based flush period, 0 disables (default: 0)
     * - FLUSH_MAX_ATTEMPTS: Storage attempts per chunk (default: 3)
     * - RECONNECT_INITIAL_DELAY_MS / RECONNECT_MAX_DELAY_MS: Reconnect backoff bounds
     * - RESYNC_ENABLED: Refetch desynced books over REST (default: true)
     */
    public static MonitorConfig fromEnv() {
        return builder()
            .databaseId(stringEnv("MONITOR_DB", DEFAULT_DATABASE))
            .symbols(parseSymbols(stringEnv("SYMBOLS", DEFAULT_SYMBOLS)))
            .batchSize(parseIntEnv("BATCH_SIZE", DEFAULT_BATCH_SIZE))
            .vizEnabled(Boolean.parseBoolean(stringEnv("VIZ_ENABLED", "false")))
            .vizPort(parseIntEnv("VIZ_PORT", DEFAULT_VIZ_PORT))
            .feedUrl(stringEnv("FEED_URL", DEFAULT_FEED_URL))
            .restUrl(stringEnv("REST_URL", DEFAULT_REST_URL))
            .tradeHistoryCapacity(parseIntEnv("TRADE_HISTORY", DEFAULT_TRADE_HISTORY))
            .bookDepth(parseIntEnv("BOOK_DEPTH", DEFAULT_BOOK_DEPTH))
            .flushIntervalMs(parseIntEnv("FLUSH_INTERVAL_MS", (int) DEFAULT_FLUSH_INTERVAL_MS))
            .flushMaxAttempts(parseIntEnv("FLUSH_MAX_ATTEMPTS", DEFAULT_FLUSH_MAX_ATTEMPTS))
            .reconnectInitialDelayMs(parseIntEnv("RECONNECT_INITIAL_DELAY_MS", (int) DEFAULT_RECONNECT_INITIAL_DELAY_MS))
            .reconnectMaxDelayMs(parseIntEnv("RECONNECT_MAX_DELAY_MS", (int) DEFAULT_RECONNECT_MAX_DELAY_MS))
            .resyncEnabled(Boolean.parseBoolean(stringEnv("RESYNC_ENABLED", "true")))
            .build();
    }

    /**
     * Parses a comma or whitespace separated symbol list.
     * Example: "btcusdt, ETHUSDT" -> [BTCUSDT, ETHUSDT]
     */
    public static List<String> parseSymbols(String value) {
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split("[,\\s]+"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private static List<String> normalizeSymbols(List<String> symbols) {
        Set<String> unique = new LinkedHashSet<>();
        for (String symbol : symbols) {
            if (symbol == null || symbol.isBlank()) {
                throw new IllegalArgumentException("symbol cannot be null or empty");
            }
            unique.add(symbol.trim().toUpperCase());
        }
        return List.copyOf(unique);
    }

    private static String stringEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private static int parseIntEnv(String key, int defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + key + " value: " + value + ", using default: " + defaultValue);
            return defaultValue;
        }
    }

    /**
     * Creates a new builder for MonitorConfig.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for MonitorConfig.
     */
    public static class Builder {
        private String databaseId = DEFAULT_DATABASE;
        private final List<String> symbols = new ArrayList<>();
        private int batchSize = DEFAULT_BATCH_SIZE;
        private boolean vizEnabled = false;
        private int vizPort = DEFAULT_VIZ_PORT;
        private String feedUrl = DEFAULT_FEED_URL;
        private String restUrl = DEFAULT_REST_URL;
        private int tradeHistoryCapacity = DEFAULT_TRADE_HISTORY;
        private int bookDepth = DEFAULT_BOOK_DEPTH;
        private long flushIntervalMs = DEFAULT_FLUSH_INTERVAL_MS;
        private int flushMaxAttempts = DEFAULT_FLUSH_MAX_ATTEMPTS;
        private long flushMaxBackoffMs = DEFAULT_FLUSH_MAX_BACKOFF_MS;
        private long reconnectInitialDelayMs = DEFAULT_RECONNECT_INITIAL_DELAY_MS;
        private long reconnectMaxDelayMs = DEFAULT_RECONNECT_MAX_DELAY_MS;
        private boolean resyncEnabled = true;

        public Builder databaseId(String databaseId) {
            this.databaseId = databaseId;
            return this;
        }

        public Builder symbols(List<String> symbols) {
            this.symbols.clear();
            this.symbols.addAll(symbols);
            return this;
        }

        public Builder addSymbol(String symbol) {
            this.symbols.add(symbol);
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder vizEnabled(boolean vizEnabled) {
            this.vizEnabled = vizEnabled;
            return this;
        }

        public Builder vizPort(int vizPort) {
            this.vizPort = vizPort;
            return this;
        }

        public Builder feedUrl(String feedUrl) {
            this.feedUrl = feedUrl;
            return this;
        }

        public Builder restUrl(String restUrl) {
            this.restUrl = restUrl;
            return this;
        }

        public Builder tradeHistoryCapacity(int tradeHistoryCapacity) {
            this.tradeHistoryCapacity = tradeHistoryCapacity;
            return this;
        }

        public Builder bookDepth(int bookDepth) {
            this.bookDepth = bookDepth;
            return this;
        }

        public Builder flushIntervalMs(long flushIntervalMs) {
            this.flushIntervalMs = flushIntervalMs;
            return this;
        }

        public Builder flushMaxAttempts(int flushMaxAttempts) {
            this.flushMaxAttempts = flushMaxAttempts;
            return this;
        }

        public Builder flushMaxBackoffMs(long flushMaxBackoffMs) {
            this.flushMaxBackoffMs = flushMaxBackoffMs;
            return this;
        }

        public Builder reconnectInitialDelayMs(long reconnectInitialDelayMs) {
            this.reconnectInitialDelayMs = reconnectInitialDelayMs;
            return this;
        }

        public Builder reconnectMaxDelayMs(long reconnectMaxDelayMs) {
            this.reconnectMaxDelayMs = reconnectMaxDelayMs;
            return this;
        }

        public Builder resyncEnabled(boolean resyncEnabled) {
            this.resyncEnabled = resyncEnabled;
            return this;
        }

        public MonitorConfig build() {
            if (symbols.isEmpty()) {
                throw new IllegalStateException("At least one symbol must be added");
            }
            return new MonitorConfig(
                databaseId,
                List.copyOf(symbols),
                batchSize,
                vizEnabled,
                vizPort,
                feedUrl,
                restUrl,
                tradeHistoryCapacity,
                bookDepth,
                flushIntervalMs,
                flushMaxAttempts,
                flushMaxBackoffMs,
                reconnectInitialDelayMs,
                reconnectMaxDelayMs,
                resyncEnabled
            );
        }
    }
}
