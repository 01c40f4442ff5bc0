package io.trading.monitor.model;

/**
 * Trade side (buy or sell), from the taker's point of view.
 */
public enum Side {
    BUY,
    SELL;

    /**
     * Maps the Binance "buyer is maker" flag to the aggressor side.
     * A maker buyer means the taker sold.
     */
    public static Side fromBuyerMaker(boolean buyerMaker) {
        return buyerMaker ? SELL : BUY;
    }

    public static Side fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("side cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "buy", "b" -> BUY;
            case "sell", "s" -> SELL;
            default -> throw new IllegalArgumentException("Unknown side: " + value);
        };
    }
}
