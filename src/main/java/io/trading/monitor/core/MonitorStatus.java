package io.trading.monitor.core;

import io.trading.monitor.feed.StreamIngestor;
import io.trading.monitor.model.ConnectionState;
import io.trading.monitor.model.OrderBookLevel;
import io.trading.monitor.model.TradeRecord;
import io.trading.monitor.state.MarketSnapshot;
import io.trading.monitor.state.MarketState;
import io.trading.monitor.storage.BatchWriter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Point-in-time summary of the pipeline, shown by the status command and the status endpoint.
 */
public record MonitorStatus(
    ConnectionState connectionState,
    long messageCount,
    long errorCount,
    long reconnectCount,
    int pendingRecords,
    long persistedRecords,
    long failedFlushes,
    List<SymbolStatus> symbols
) {
    public MonitorStatus {
        symbols = List.copyOf(symbols);
    }

    public static MonitorStatus capture(StreamIngestor ingestor, BatchWriter writer, MarketState state) {
        List<SymbolStatus> symbols = new ArrayList<>();
        for (MarketSnapshot snapshot : state.snapshots()) {
            symbols.add(SymbolStatus.of(snapshot));
        }
        return new MonitorStatus(
            ingestor.getConnectionState(),
            ingestor.getMessageCount(),
            ingestor.getErrorCount(),
            ingestor.getReconnectCount(),
            writer.pendingCount(),
            writer.persistedCount(),
            writer.failedFlushCount(),
            symbols
        );
    }

    /**
     * @param bookSequence Sequence of the stored book, -1 when there is none
     * @param tradeCount   Trades currently held in the history buffer
     * @param bestBid      Best bid price, null without a book
     * @param bestAsk      Best ask price, null without a book
     * @param lastPrice    Price of the most recent trade, null without trades
     */
    public record SymbolStatus(
        String symbol,
        long bookSequence,
        int tradeCount,
        BigDecimal bestBid,
        BigDecimal bestAsk,
        BigDecimal lastPrice
    ) {
        static SymbolStatus of(MarketSnapshot snapshot) {
            OrderBookLevel bid = snapshot.hasBook() ? snapshot.book().bestBid() : null;
            OrderBookLevel ask = snapshot.hasBook() ? snapshot.book().bestAsk() : null;
            TradeRecord last = snapshot.lastTrade();
            return new SymbolStatus(
                snapshot.symbol(),
                snapshot.bookSequence(),
                snapshot.recentTrades().size(),
                bid != null ? bid.price() : null,
                ask != null ? ask.price() : null,
                last != null ? last.price() : null
            );
        }
    }
}
