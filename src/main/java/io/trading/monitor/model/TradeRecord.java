package io.trading.monitor.model;

import java.math.BigDecimal;

/**
 * A single executed trade.
 *
 * @param symbol           Trading pair symbol (e.g., "BTCUSDT")
 * @param tradeId          Feed-assigned trade id, 0 when the feed does not provide one
 * @param price            Trade price
 * @param quantity         Trade quantity
 * @param side             Aggressor side
 * @param timestamp        Exchange trade time in epoch milliseconds
 * @param receiptTimestamp Local receive time in epoch milliseconds
 */
public record TradeRecord(
    String symbol,
    long tradeId,
    BigDecimal price,
    BigDecimal quantity,
    Side side,
    long timestamp,
    long receiptTimestamp
) implements MarketRecord {
    public TradeRecord {
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
        if (price == null) {
            throw new IllegalArgumentException("price cannot be null");
        }
        if (quantity == null) {
            throw new IllegalArgumentException("quantity cannot be null");
        }
        if (side == null) {
            throw new IllegalArgumentException("side cannot be null");
        }
    }
}
