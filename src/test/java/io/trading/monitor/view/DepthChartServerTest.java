package io.trading.monitor.view;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prometheus.client.CollectorRegistry;
import io.trading.monitor.core.MonitorStatus;
import io.trading.monitor.metrics.MonitorMetrics;
import io.trading.monitor.model.ConnectionState;
import io.trading.monitor.model.OrderBookLevel;
import io.trading.monitor.model.OrderBookUpdate;
import io.trading.monitor.state.MarketState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DepthChartServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private final MarketState state = new MarketState(List.of("BTCUSDT", "ETHUSDT"), 10);
    private final MonitorMetrics metrics = new MonitorMetrics(new CollectorRegistry());

    private DepthChartServer server;

    @BeforeEach
    void setUp() {
        metrics.recordDecodeError();
        server = new DepthChartServer(0, state, metrics.getRegistry(),
            () -> new MonitorStatus(ConnectionState.CONNECTED, 12, 1, 0, 3, 40, 0, List.of()),
            60_000, 2);
        assertTrue(server.start());
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static OrderBookUpdate book(long sequence) {
        return new OrderBookUpdate("BTCUSDT", sequence,
            List.of(OrderBookLevel.of("100", "1"), OrderBookLevel.of("99", "2")),
            List.of(OrderBookLevel.of("101", "3")),
            1_704_067_200_000L);
    }

    @Test
    void testHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertEquals(200, response.statusCode());
        assertEquals("OK", response.body());
    }

    @Test
    void testStatusDocument() throws Exception {
        JsonNode status = mapper.readTree(get("/api/status").body());

        assertEquals("CONNECTED", status.get("connectionState").asText());
        assertEquals(12, status.get("messageCount").asLong());
        assertEquals(3, status.get("pendingRecords").asInt());
    }

    @Test
    void testMetricsExported() throws Exception {
        HttpResponse<String> response = get("/metrics");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("# TYPE"));
    }

    @Test
    void testSymbolParameterValidated() throws Exception {
        assertEquals(400, get("/api/book").statusCode());
        assertEquals(404, get("/api/book?symbol=DOGEUSDT").statusCode());
        assertEquals(404, get("/api/book?symbol=btcusdt").statusCode());
    }

    @Test
    void testBookAndTrades() throws Exception {
        state.replaceBook(book(5));

        HttpResponse<String> response = get("/api/book?symbol=btcusdt");
        assertEquals(200, response.statusCode());
        JsonNode book = mapper.readTree(response.body());
        assertEquals(5, book.get("sequence").asLong());
        assertEquals(2, book.get("bids").size());

        JsonNode trades = mapper.readTree(get("/api/trades?symbol=ETHUSDT").body());
        assertTrue(trades.isArray());
        assertEquals(0, trades.size());
    }

    @Test
    void testDepthHistoryIsBounded() throws Exception {
        server.refresh();
        assertTrue(server.depthHistory("BTCUSDT").isEmpty());

        state.replaceBook(book(1));
        server.refresh();
        state.replaceBook(book(2));
        server.refresh();
        state.replaceBook(book(3));
        server.refresh();

        List<DepthFrame> history = server.depthHistory("BTCUSDT");
        assertEquals(2, history.size());
        assertEquals(2, history.get(0).sequence());
        assertEquals(3, history.get(1).sequence());

        JsonNode frames = mapper.readTree(get("/api/depth?symbol=BTCUSDT").body());
        assertEquals(2, frames.size());
    }

    @Test
    void testQueryParamsDecoded() {
        Map<String, String> params = DepthChartServer.queryParams("symbol=BTC%20USDT&x=1&flag");

        assertEquals("BTC USDT", params.get("symbol"));
        assertEquals("1", params.get("x"));
        assertFalse(params.containsKey("flag"));
    }

    @Test
    void testStopAndRestart() throws Exception {
        server.stop();
        assertFalse(server.isRunning());

        assertTrue(server.start());
        assertEquals(200, get("/health").statusCode());
    }
}
