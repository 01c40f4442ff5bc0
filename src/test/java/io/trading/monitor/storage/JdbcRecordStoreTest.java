package io.trading.monitor.storage;

import io.prometheus.client.CollectorRegistry;
import io.trading.monitor.metrics.MonitorMetrics;
import io.trading.monitor.model.MarketRecord;
import io.trading.monitor.model.OrderBookLevel;
import io.trading.monitor.model.OrderBookUpdate;
import io.trading.monitor.model.Side;
import io.trading.monitor.model.TradeRecord;
import io.trading.monitor.util.ExponentialBackoff;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests JdbcRecordStore against a SQLite file.
 */
class JdbcRecordStoreTest {

    @TempDir
    Path tempDir;

    private String jdbcUrl() {
        return "jdbc:sqlite:" + tempDir.resolve("monitor.db");
    }

    private static TradeRecord trade(long id, Side side) {
        return new TradeRecord("BTCUSDT", id, new BigDecimal("42000.10"), new BigDecimal("0.005"), side, 1704067200000L, 1704067200005L);
    }

    private static OrderBookUpdate book(long sequence) {
        return new OrderBookUpdate(
            "ETHUSDT",
            sequence,
            List.of(OrderBookLevel.of("2250.10", "1.5"), OrderBookLevel.of("2250.00", "3")),
            List.of(OrderBookLevel.of("2250.20", "0.75")),
            1704067200100L
        );
    }

    @Test
    void testWritesBothRecordKinds() throws SQLException {
        try (JdbcRecordStore store = JdbcRecordStore.open(jdbcUrl())) {
            store.writeBatch(List.of(trade(1, Side.BUY), book(100), trade(2, Side.SELL)));

            assertEquals(2, store.countTrades());
            assertEquals(1, store.countOrderBooks());
        }

        try (Connection conn = DriverManager.getConnection(jdbcUrl());
             Statement stmt = conn.createStatement()) {
            try (ResultSet rs = stmt.executeQuery("SELECT trade_id, price, side FROM trades ORDER BY trade_id")) {
                assertTrue(rs.next());
                assertEquals(1, rs.getLong("trade_id"));
                assertEquals("42000.10", rs.getString("price"));
                assertEquals("BUY", rs.getString("side"));
                assertTrue(rs.next());
                assertEquals("SELL", rs.getString("side"));
                assertFalse(rs.next());
            }
            try (ResultSet rs = stmt.executeQuery("SELECT sequence, bids, asks FROM order_books")) {
                assertTrue(rs.next());
                assertEquals(100, rs.getLong("sequence"));
                assertEquals("[[\"2250.10\",\"1.5\"],[\"2250.00\",\"3\"]]", rs.getString("bids"));
                assertEquals("[[\"2250.20\",\"0.75\"]]", rs.getString("asks"));
            }
        }
    }

    @Test
    void testSchemaSurvivesReopen() {
        try (JdbcRecordStore store = JdbcRecordStore.open(jdbcUrl())) {
            store.writeBatch(List.of(trade(1, Side.BUY)));
        }
        try (JdbcRecordStore store = JdbcRecordStore.open(jdbcUrl())) {
            store.writeBatch(List.of(trade(2, Side.BUY)));
            assertEquals(2, store.countTrades());
        }
    }

    @Test
    void testEmptyBatchIsNoOp() {
        try (JdbcRecordStore store = JdbcRecordStore.open(jdbcUrl())) {
            store.writeBatch(List.of());
            assertEquals(0, store.countTrades());
        }
    }

    @Test
    void testWriteAfterCloseFails() {
        JdbcRecordStore store = JdbcRecordStore.open(jdbcUrl());
        store.close();

        assertThrows(RuntimeException.class, () -> store.writeBatch(List.of(trade(1, Side.BUY))));
    }

    @Test
    void testBatchWriterPersistsEverythingOnClose() {
        JdbcRecordStore store = JdbcRecordStore.open(jdbcUrl());
        BatchWriter writer = new BatchWriter(store, 500, 0, 3, new ExponentialBackoff(0, 0),
            new MonitorMetrics(new CollectorRegistry()));

        for (long id = 1; id <= 1234; id++) {
            writer.enqueue(trade(id, Side.BUY));
        }
        MarketRecord snapshot = book(7);
        writer.enqueue(snapshot);
        writer.close();

        try (JdbcRecordStore reopened = JdbcRecordStore.open(jdbcUrl())) {
            assertEquals(1234, reopened.countTrades());
            assertEquals(1, reopened.countOrderBooks());
        }
    }
}
