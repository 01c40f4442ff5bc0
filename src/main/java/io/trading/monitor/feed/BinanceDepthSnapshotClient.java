package io.trading.monitor.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.monitor.model.OrderBookLevel;
import io.trading.monitor.model.OrderBookUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches order book snapshots from the Binance REST API ({@code GET /api/v3/depth}).
 */
public class BinanceDepthSnapshotClient implements BookSnapshotSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(BinanceDepthSnapshotClient.class);

    private static final String DEPTH_PATH = "/api/v3/depth";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final int limit;
    private final Duration timeout;

    public BinanceDepthSnapshotClient(String baseUrl, int limit) {
        this(HttpClient.newBuilder().connectTimeout(DEFAULT_TIMEOUT).build(), new ObjectMapper(), baseUrl, limit, DEFAULT_TIMEOUT);
    }

    /**
     * @param httpClient   HTTP client
     * @param objectMapper JSON mapper
     * @param baseUrl      REST base URL, e.g. "https://api.binance.com"
     * @param limit        Number of levels per side
     * @param timeout      Request timeout
     */
    public BinanceDepthSnapshotClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl, int limit, Duration timeout) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl cannot be null or empty");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.limit = limit;
        this.timeout = timeout;
    }

    @Override
    public OrderBookUpdate fetchSnapshot(String symbol) throws IOException {
        URI uri = URI.create(baseUrl + DEPTH_PATH + "?symbol=" + symbol + "&limit=" + limit);
        HttpRequest request = HttpRequest.newBuilder(uri).timeout(timeout).GET().build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Depth snapshot request for " + symbol + " was interrupted");
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("Depth snapshot request for " + symbol + " failed with status " + response.statusCode());
        }

        OrderBookUpdate snapshot = parseSnapshot(symbol, response.body(), System.currentTimeMillis());
        LOGGER.debug("Fetched depth snapshot for {} (lastUpdateId={})", symbol, snapshot.sequence());
        return snapshot;
    }

    OrderBookUpdate parseSnapshot(String symbol, String body, long timestamp) throws IOException {
        JsonNode node = objectMapper.readTree(body);
        if (node == null || !node.hasNonNull("lastUpdateId")) {
            throw new IOException("Depth snapshot for " + symbol + " missing field: lastUpdateId");
        }
        try {
            return new OrderBookUpdate(
                symbol,
                node.get("lastUpdateId").asLong(),
                levels(node.get("bids")),
                levels(node.get("asks")),
                timestamp
            );
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid depth snapshot for " + symbol + ": " + e.getMessage(), e);
        }
    }

    private static List<OrderBookLevel> levels(JsonNode array) {
        if (array == null || !array.isArray()) {
            throw new IllegalArgumentException("levels must be an array");
        }
        List<OrderBookLevel> levels = new ArrayList<>(array.size());
        for (JsonNode level : array) {
            if (!level.isArray() || level.size() < 2) {
                throw new IllegalArgumentException("level must be [price, quantity]");
            }
            levels.add(OrderBookLevel.of(level.get(0).asText(), level.get(1).asText()));
        }
        return levels;
    }
}
