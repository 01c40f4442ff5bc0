package io.trading.monitor.feed;

import io.trading.monitor.model.OrderBookUpdate;

import java.io.IOException;

/**
 * Supplies a full order book for a symbol, used to resynchronize after a desync.
 */
@FunctionalInterface
public interface BookSnapshotSource {

    /**
     * Fetches the current book. May block on network I/O.
     *
     * @throws IOException if the snapshot could not be retrieved
     */
    OrderBookUpdate fetchSnapshot(String symbol) throws IOException;
}
