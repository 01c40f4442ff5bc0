package io.trading.monitor.state;

import io.trading.monitor.model.OrderBookUpdate;
import io.trading.monitor.model.TradeRecord;

import java.util.List;

/**
 * Read-only, internally consistent view of one symbol.
 *
 * @param symbol       The symbol
 * @param book         Latest order book, or null if none has been applied since startup or resync
 * @param recentTrades Most recent trades, oldest first
 */
public record MarketSnapshot(
    String symbol,
    OrderBookUpdate book,
    List<TradeRecord> recentTrades
) {
    public MarketSnapshot {
        recentTrades = List.copyOf(recentTrades);
    }

    public boolean hasBook() {
        return book != null;
    }

    /**
     * Sequence of the stored book, or -1 when there is none.
     */
    public long bookSequence() {
        return book == null ? -1 : book.sequence();
    }

    public TradeRecord lastTrade() {
        return recentTrades.isEmpty() ? null : recentTrades.get(recentTrades.size() - 1);
    }
}
