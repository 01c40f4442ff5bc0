package io.trading.monitor.state;

import io.trading.monitor.model.OrderBookUpdate;
import io.trading.monitor.model.TradeRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory market state: latest order book and recent trades per tracked symbol.
 *
 * The symbol set is fixed at construction. Each symbol entry has its own monitor,
 * so a reader always sees a book and trade history that belong together, and a
 * writer on one symbol never waits on another.
 */
public class MarketState {

    private final Map<String, SymbolEntry> entries;
    private final int historyCapacity;

    public MarketState(Collection<String> symbols, int historyCapacity) {
        if (symbols == null || symbols.isEmpty()) {
            throw new IllegalArgumentException("symbols cannot be null or empty");
        }
        if (historyCapacity <= 0) {
            throw new IllegalArgumentException("historyCapacity must be positive");
        }
        this.historyCapacity = historyCapacity;
        Map<String, SymbolEntry> map = new LinkedHashMap<>();
        for (String symbol : symbols) {
            map.put(symbol, new SymbolEntry(historyCapacity));
        }
        this.entries = Collections.unmodifiableMap(map);
    }

    /**
     * Appends a trade to its symbol's history, evicting the oldest trade at capacity.
     *
     * @return false if the trade id was already recorded (duplicate after reconnect)
     * @throws UnknownSymbolException if the symbol is not tracked
     */
    public boolean recordTrade(TradeRecord trade) {
        return entry(trade.symbol()).append(trade);
    }

    /**
     * Replaces the symbol's book if the update's sequence is not below the stored one.
     *
     * @throws SequenceDesyncException if the sequence regressed; the stored book is unchanged
     * @throws UnknownSymbolException  if the symbol is not tracked
     */
    public void replaceBook(OrderBookUpdate update) {
        entry(update.symbol()).replace(update);
    }

    /**
     * Clears the stored book so the next update becomes the new baseline.
     */
    public void dropBook(String symbol) {
        entry(symbol).drop();
    }

    /**
     * Returns a consistent copy of the symbol's book and trade history.
     */
    public MarketSnapshot snapshot(String symbol) {
        return entry(symbol).snapshot(symbol);
    }

    /**
     * Snapshots of every tracked symbol, in configuration order.
     */
    public List<MarketSnapshot> snapshots() {
        List<MarketSnapshot> result = new ArrayList<>(entries.size());
        for (Map.Entry<String, SymbolEntry> e : entries.entrySet()) {
            result.add(e.getValue().snapshot(e.getKey()));
        }
        return result;
    }

    public int tradeCount(String symbol) {
        return entry(symbol).size();
    }

    public boolean isTracked(String symbol) {
        return entries.containsKey(symbol);
    }

    public List<String> symbols() {
        return List.copyOf(entries.keySet());
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    private SymbolEntry entry(String symbol) {
        SymbolEntry entry = entries.get(symbol);
        if (entry == null) {
            throw new UnknownSymbolException(symbol);
        }
        return entry;
    }

    private static final class SymbolEntry {
        private final int capacity;
        private final ArrayDeque<TradeRecord> trades;
        private OrderBookUpdate book;
        private long lastTradeId;

        SymbolEntry(int capacity) {
            this.capacity = capacity;
            this.trades = new ArrayDeque<>(capacity);
        }

        synchronized boolean append(TradeRecord trade) {
            if (trade.tradeId() > 0) {
                if (trade.tradeId() <= lastTradeId) {
                    return false;
                }
                lastTradeId = trade.tradeId();
            }
            if (trades.size() == capacity) {
                trades.pollFirst();
            }
            trades.addLast(trade);
            return true;
        }

        synchronized void replace(OrderBookUpdate update) {
            if (book != null && update.sequence() < book.sequence()) {
                throw new SequenceDesyncException(update.symbol(), book.sequence(), update.sequence());
            }
            book = update;
        }

        synchronized void drop() {
            book = null;
        }

        synchronized int size() {
            return trades.size();
        }

        synchronized MarketSnapshot snapshot(String symbol) {
            return new MarketSnapshot(symbol, book, new ArrayList<>(trades));
        }
    }
}
