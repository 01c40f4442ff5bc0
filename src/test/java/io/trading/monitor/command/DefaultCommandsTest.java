package io.trading.monitor.command;

import io.prometheus.client.CollectorRegistry;
import io.trading.monitor.core.MonitorStatus;
import io.trading.monitor.feed.BinanceStreamParser;
import io.trading.monitor.feed.StreamIngestor;
import io.trading.monitor.metrics.MonitorMetrics;
import io.trading.monitor.model.MarketRecord;
import io.trading.monitor.model.OrderBookLevel;
import io.trading.monitor.model.OrderBookUpdate;
import io.trading.monitor.model.Side;
import io.trading.monitor.model.TradeRecord;
import io.trading.monitor.netty.FeedTransport;
import io.trading.monitor.state.MarketState;
import io.trading.monitor.storage.BatchWriter;
import io.trading.monitor.storage.RecordStore;
import io.trading.monitor.util.ExponentialBackoff;
import io.trading.monitor.view.MarketView;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DefaultCommandsTest {

    private final MonitorMetrics metrics = new MonitorMetrics(new CollectorRegistry());
    private final MarketState state = new MarketState(List.of("BTCUSDT", "ETHUSDT"), 100);
    private final List<MarketRecord> stored = new ArrayList<>();
    private final AtomicBoolean failWrites = new AtomicBoolean(false);
    private final AtomicInteger shutdownRequests = new AtomicInteger();
    private final FakeView view = new FakeView();
    private final RecordingConsole console = new RecordingConsole();

    private BatchWriter writer;
    private StreamIngestor ingestor;
    private CommandService service;

    @BeforeEach
    void setUp() {
        RecordStore store = new RecordStore() {
            @Override
            public synchronized void writeBatch(List<MarketRecord> records) {
                if (failWrites.get()) {
                    throw new IllegalStateException("disk full");
                }
                stored.addAll(records);
            }

            @Override
            public void close() {
            }
        };
        writer = new BatchWriter(store, 1000, 0, 1, new ExponentialBackoff(0, 0), metrics);

        // Never connected in these tests
        FeedTransport.Factory idle = (uri, listener) -> new FeedTransport() {
            @Override
            public void connect() {
            }

            @Override
            public void send(String message) {
            }

            @Override
            public boolean isConnected() {
                return false;
            }

            @Override
            public void close() {
            }
        };
        ingestor = new StreamIngestor(URI.create("wss://localhost/stream"), state.symbols(), 20, state, writer,
            new BinanceStreamParser(), null, metrics, idle, new ExponentialBackoff(10, 10));

        CommandRegistry registry = DefaultCommands.create(ingestor, writer, state, view,
            () -> MonitorStatus.capture(ingestor, writer, state), shutdownRequests::incrementAndGet);
        service = new CommandService(registry, console);
    }

    @AfterEach
    void tearDown() {
        ingestor.close();
        writer.close();
    }

    private static TradeRecord trade(String symbol, long id, String price) {
        return new TradeRecord(symbol, id, new BigDecimal(price), new BigDecimal("0.5"), Side.BUY, 1_704_067_200_000L + id,
            1_704_067_200_100L + id);
    }

    private static OrderBookUpdate book(String symbol, long sequence) {
        return new OrderBookUpdate(symbol, sequence,
            List.of(OrderBookLevel.of("100.5", "2"), OrderBookLevel.of("100.4", "3")),
            List.of(OrderBookLevel.of("100.6", "1"), OrderBookLevel.of("100.7", "4")),
            1_704_067_200_000L);
    }

    @Test
    void testHelpListsEveryCommand() {
        service.dispatch("help");

        for (String name : List.of("status", "reconnect", "help", "quit", "exit", "flush", "book", "trades", "viz")) {
            assertTrue(console.reports.stream().anyMatch(r -> r.trim().startsWith(name + " ")), "missing " + name);
        }
    }

    @Test
    void testStatusShowsPipelineAndSymbols() {
        state.replaceBook(book("BTCUSDT", 42));
        state.recordTrade(trade("BTCUSDT", 1, "100.55"));
        writer.enqueue(trade("BTCUSDT", 1, "100.55"));

        service.dispatch("status");

        assertTrue(console.reports.get(0).startsWith("Connection: DISCONNECTED"));
        assertTrue(console.reports.get(1).startsWith("Storage: 1 pending | 0 persisted"));
        assertTrue(console.anyReportContains("book seq: 42 | trades: 1 | bid: 100.5 | ask: 100.6 | last: 100.55"));
        assertTrue(console.anyReportContains("book seq: - | trades: 0 | bid: - | ask: - | last: -"));
    }

    @Test
    void testQuitAndExitRequestShutdown() {
        service.dispatch("quit");
        service.dispatch("EXIT");

        assertEquals(2, shutdownRequests.get());
        assertEquals("Shutting down...", console.lastReport());
    }

    @Test
    void testFlushReportsWrittenCount() {
        writer.enqueue(trade("BTCUSDT", 1, "100"));
        writer.enqueue(trade("BTCUSDT", 2, "101"));

        service.dispatch("flush");

        assertEquals("Flushed 2 records", console.lastReport());
        assertEquals(Severity.SUCCESS, console.lastSeverity());
        assertEquals(2, stored.size());
    }

    @Test
    void testFlushFailureReported() {
        writer.enqueue(trade("BTCUSDT", 1, "100"));
        failWrites.set(true);

        service.dispatch("flush");

        assertEquals(Severity.ERROR, console.lastSeverity());
        assertTrue(console.lastReport().startsWith("Flush failed, 1 records still pending"));
        assertEquals(1, writer.pendingCount());
        failWrites.set(false);
    }

    @Test
    void testBookShowsTopLevels() {
        state.replaceBook(book("ETHUSDT", 7));

        service.dispatch("book ethusdt");

        assertEquals("ETHUSDT order book (seq 7)", console.reports.get(0));
        assertEquals(List.of(
            "ETHUSDT order book (seq 7)",
            "  ASK 100.7 x 4",
            "  ASK 100.6 x 1",
            "  BID 100.5 x 2",
            "  BID 100.4 x 3"
        ), console.reports);
    }

    @Test
    void testBookWithoutDataWarns() {
        service.dispatch("book BTCUSDT");

        assertEquals("No order book yet for BTCUSDT", console.lastReport());
        assertEquals(Severity.WARNING, console.lastSeverity());
    }

    @Test
    void testSymbolArgumentValidated() {
        service.dispatch("book");
        assertEquals("Usage: book <SYMBOL>", console.lastReport());

        service.dispatch("trades DOGEUSDT");
        assertTrue(console.lastReport().startsWith("Symbol not tracked: DOGEUSDT"));
        assertEquals(Severity.ERROR, console.lastSeverity());
    }

    @Test
    void testTradesNewestFirst() {
        for (long id = 1; id <= 12; id++) {
            state.recordTrade(trade("BTCUSDT", id, "100." + id));
        }

        service.dispatch("trades BTCUSDT");

        assertEquals(1 + DefaultCommands.TRADES_SHOWN, console.reports.size());
        assertTrue(console.reports.get(1).contains("100.12 x 0.5"));
        assertTrue(console.reports.get(DefaultCommands.TRADES_SHOWN).contains("100.3 x 0.5"));
    }

    @Test
    void testVizStartAndStop() {
        service.dispatch("viz start");
        assertTrue(view.isRunning());
        assertEquals("Visualization started", console.lastReport());

        service.dispatch("viz start");
        assertEquals("Visualization already running", console.lastReport());

        service.dispatch("viz stop");
        assertFalse(view.isRunning());

        service.dispatch("viz");
        assertEquals("Usage: viz start|stop", console.lastReport());
    }

    @Test
    void testVizStartFailureReported() {
        view.failStart = true;

        service.dispatch("viz start");

        assertEquals("Failed to start visualization", console.lastReport());
        assertEquals(Severity.ERROR, console.lastSeverity());
    }

    private static final class FakeView implements MarketView {
        volatile boolean running;
        volatile boolean failStart;

        @Override
        public boolean start() {
            if (failStart) {
                return false;
            }
            running = true;
            return true;
        }

        @Override
        public void stop() {
            running = false;
        }

        @Override
        public boolean isRunning() {
            return running;
        }
    }
}
