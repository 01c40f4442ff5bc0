package io.trading.monitor.model;

import java.math.BigDecimal;

/**
 * Single price level in an order book.
 *
 * @param price    Price level
 * @param quantity Total quantity at this price level
 */
public record OrderBookLevel(
    BigDecimal price,
    BigDecimal quantity
) {
    public OrderBookLevel {
        if (price == null) {
            throw new IllegalArgumentException("price cannot be null");
        }
        if (quantity == null) {
            throw new IllegalArgumentException("quantity cannot be null");
        }
        if (price.signum() < 0) {
            throw new IllegalArgumentException("price cannot be negative");
        }
        if (quantity.signum() < 0) {
            throw new IllegalArgumentException("quantity cannot be negative");
        }
    }

    public static OrderBookLevel of(String price, String quantity) {
        return new OrderBookLevel(new BigDecimal(price), new BigDecimal(quantity));
    }
}
