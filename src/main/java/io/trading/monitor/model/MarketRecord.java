package io.trading.monitor.model;

/**
 * A decoded feed record that flows into market state and storage.
 */
public sealed interface MarketRecord permits TradeRecord, OrderBookUpdate {

    /**
     * Upper-case symbol the record belongs to.
     */
    String symbol();

    /**
     * Exchange timestamp in epoch milliseconds.
     */
    long timestamp();
}
