package io.trading.monitor.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.trading.monitor.model.MarketRecord;
import io.trading.monitor.model.OrderBookLevel;
import io.trading.monitor.model.OrderBookUpdate;
import io.trading.monitor.model.TradeRecord;
import org.agrona.CloseHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of RecordStore. Each batch is written in one transaction.
 */
public class JdbcRecordStore implements RecordStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcRecordStore.class);

    private static final String[] SCHEMA = {
        "CREATE TABLE IF NOT EXISTS trades (" +
            "symbol VARCHAR(32) NOT NULL, " +
            "trade_id BIGINT NOT NULL, " +
            "price VARCHAR(64) NOT NULL, " +
            "quantity VARCHAR(64) NOT NULL, " +
            "side VARCHAR(4) NOT NULL, " +
            "trade_time BIGINT NOT NULL, " +
            "receipt_time BIGINT NOT NULL)",
        "CREATE INDEX IF NOT EXISTS idx_trades_symbol_time ON trades (symbol, trade_time)",
        "CREATE TABLE IF NOT EXISTS order_books (" +
            "symbol VARCHAR(32) NOT NULL, " +
            "sequence BIGINT NOT NULL, " +
            "bids TEXT NOT NULL, " +
            "asks TEXT NOT NULL, " +
            "book_time BIGINT NOT NULL)",
        "CREATE INDEX IF NOT EXISTS idx_order_books_symbol_seq ON order_books (symbol, sequence)"
    };

    private static final String INSERT_TRADE =
        "INSERT INTO trades (symbol, trade_id, price, quantity, side, trade_time, receipt_time) " +
        "VALUES (?, ?, ?, ?, ?, ?, ?)";

    private static final String INSERT_BOOK =
        "INSERT INTO order_books (symbol, sequence, bids, asks, book_time) VALUES (?, ?, ?, ?, ?)";

    private final HikariDataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcRecordStore(HikariDataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
        initSchema();
    }

    /**
     * Opens a pooled store for the given JDBC URL and creates the schema if needed.
     */
    public static JdbcRecordStore open(String jdbcUrl) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        // SQLite allows a single writer; one pooled connection keeps batches serialized
        config.setMaximumPoolSize(jdbcUrl.startsWith("jdbc:sqlite:") ? 1 : 4);
        config.setConnectionTimeout(5000);
        config.setPoolName("monitor-hikari");

        LOGGER.info("DB: url={}", jdbcUrl);
        HikariDataSource dataSource = new HikariDataSource(config);
        try {
            return new JdbcRecordStore(dataSource, new ObjectMapper());
        } catch (RuntimeException e) {
            CloseHelper.quietClose(dataSource);
            throw e;
        }
    }

    private void initSchema() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String ddl : SCHEMA) {
                stmt.execute(ddl);
            }
        } catch (SQLException e) {
            throw new StorageWriteException("Failed to initialize schema", e);
        }
    }

    @Override
    public void writeBatch(List<MarketRecord> records) {
        if (records.isEmpty()) {
            return;
        }

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement trades = conn.prepareStatement(INSERT_TRADE);
                 PreparedStatement books = conn.prepareStatement(INSERT_BOOK)) {

                int tradeCount = 0;
                int bookCount = 0;
                for (MarketRecord record : records) {
                    if (record instanceof TradeRecord trade) {
                        bindTrade(trades, trade);
                        trades.addBatch();
                        tradeCount++;
                    } else if (record instanceof OrderBookUpdate book) {
                        bindBook(books, book);
                        books.addBatch();
                        bookCount++;
                    }
                }

                if (tradeCount > 0) {
                    trades.executeBatch();
                }
                if (bookCount > 0) {
                    books.executeBatch();
                }
                conn.commit();
                LOGGER.debug("Stored batch: trades={}, books={}", tradeCount, bookCount);
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageWriteException("Failed to write batch of " + records.size() + " records", e);
        }
    }

    private void bindTrade(PreparedStatement stmt, TradeRecord trade) throws SQLException {
        stmt.setString(1, trade.symbol());
        stmt.setLong(2, trade.tradeId());
        stmt.setString(3, trade.price().toPlainString());
        stmt.setString(4, trade.quantity().toPlainString());
        stmt.setString(5, trade.side().name());
        stmt.setLong(6, trade.timestamp());
        stmt.setLong(7, trade.receiptTimestamp());
    }

    private void bindBook(PreparedStatement stmt, OrderBookUpdate book) throws SQLException {
        stmt.setString(1, book.symbol());
        stmt.setLong(2, book.sequence());
        stmt.setString(3, levelsToJson(book.bids()));
        stmt.setString(4, levelsToJson(book.asks()));
        stmt.setLong(5, book.timestamp());
    }

    /**
     * Encodes levels the way the feed sends them: [["price","quantity"], ...].
     */
    private String levelsToJson(List<OrderBookLevel> levels) {
        List<List<String>> rows = new ArrayList<>(levels.size());
        for (OrderBookLevel level : levels) {
            rows.add(List.of(level.price().toPlainString(), level.quantity().toPlainString()));
        }
        try {
            return objectMapper.writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new StorageWriteException("Failed to encode order book levels", e);
        }
    }

    private void rollbackQuietly(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            LOGGER.warn("Rollback failed", e);
        }
    }

    public long countTrades() {
        return count("SELECT COUNT(*) FROM trades");
    }

    public long countOrderBooks() {
        return count("SELECT COUNT(*) FROM order_books");
    }

    private long count(String sql) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            LOGGER.error("Error counting rows: {}", sql, e);
            throw new IllegalStateException("Database error", e);
        }
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            LOGGER.info("Record store closed");
        }
    }
}
