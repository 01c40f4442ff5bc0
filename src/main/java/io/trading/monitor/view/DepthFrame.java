package io.trading.monitor.view;

import io.trading.monitor.model.OrderBookLevel;
import io.trading.monitor.model.OrderBookUpdate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Cumulative depth of one book sample: one time slice of the price x time x depth surface.
 *
 * @param timestamp Sample time in epoch milliseconds
 * @param sequence  Sequence of the sampled book
 * @param bids      Bid prices from best outwards, with quantity summed from the best bid
 * @param asks      Ask prices from best outwards, with quantity summed from the best ask
 */
public record DepthFrame(
    long timestamp,
    long sequence,
    List<DepthPoint> bids,
    List<DepthPoint> asks
) {
    public DepthFrame {
        bids = List.copyOf(bids);
        asks = List.copyOf(asks);
    }

    public static DepthFrame of(OrderBookUpdate book, long timestamp) {
        return new DepthFrame(timestamp, book.sequence(), cumulative(book.bids()), cumulative(book.asks()));
    }

    private static List<DepthPoint> cumulative(List<OrderBookLevel> levels) {
        List<DepthPoint> points = new ArrayList<>(levels.size());
        BigDecimal total = BigDecimal.ZERO;
        for (OrderBookLevel level : levels) {
            total = total.add(level.quantity());
            points.add(new DepthPoint(level.price(), total));
        }
        return points;
    }

    public record DepthPoint(BigDecimal price, BigDecimal cumulativeQuantity) {
    }
}
