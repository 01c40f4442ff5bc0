package io.trading.monitor.model;

import java.util.List;

/**
 * Full top-of-book snapshot for one symbol.
 *
 * @param symbol    Trading pair symbol
 * @param sequence  Feed update id, non-decreasing per symbol while in sync
 * @param bids      Bid levels, best (highest) first
 * @param asks      Ask levels, best (lowest) first
 * @param timestamp Snapshot time in epoch milliseconds
 */
public record OrderBookUpdate(
    String symbol,
    long sequence,
    List<OrderBookLevel> bids,
    List<OrderBookLevel> asks,
    long timestamp
) implements MarketRecord {
    public OrderBookUpdate {
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
        if (bids == null) {
            throw new IllegalArgumentException("bids cannot be null");
        }
        if (asks == null) {
            throw new IllegalArgumentException("asks cannot be null");
        }
        bids = List.copyOf(bids);
        asks = List.copyOf(asks);
    }

    public OrderBookLevel bestBid() {
        return bids.isEmpty() ? null : bids.get(0);
    }

    public OrderBookLevel bestAsk() {
        return asks.isEmpty() ? null : asks.get(0);
    }
}
