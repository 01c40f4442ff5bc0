package io.trading.monitor.command;

import io.trading.monitor.core.MonitorStatus;
import io.trading.monitor.feed.StreamIngestor;
import io.trading.monitor.model.OrderBookLevel;
import io.trading.monitor.model.OrderBookUpdate;
import io.trading.monitor.model.TradeRecord;
import io.trading.monitor.state.MarketSnapshot;
import io.trading.monitor.state.MarketState;
import io.trading.monitor.storage.BatchWriter;
import io.trading.monitor.storage.StorageWriteException;
import io.trading.monitor.view.MarketView;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * The monitor's standard console commands.
 */
public final class DefaultCommands {

    static final int BOOK_LEVELS_SHOWN = 5;
    static final int TRADES_SHOWN = 10;

    private DefaultCommands() {
    }

    /**
     * Builds the default registry.
     *
     * @param ingestor         Feed ingestor (reconnect)
     * @param writer           Batch writer (flush)
     * @param state            Market state (book, trades)
     * @param view             Visualization, or null when none is configured
     * @param status           Source of the status report
     * @param shutdownRequest  Non-blocking shutdown signal (quit, exit)
     */
    public static CommandRegistry create(
        StreamIngestor ingestor,
        BatchWriter writer,
        MarketState state,
        MarketView view,
        Supplier<MonitorStatus> status,
        Runnable shutdownRequest
    ) {
        CommandRegistry registry = new CommandRegistry();

        registry.register("status", "Show connection, pipeline and per-symbol status",
            (args, console) -> reportStatus(status.get(), console));

        registry.register("reconnect", "Drop the feed connection and connect again", (args, console) -> {
            console.report("Reconnecting to the market data feed...", Severity.INFO);
            ingestor.reconnect();
        });

        registry.register("help", "List available commands", (args, console) -> {
            console.report("Available commands:", Severity.INFO);
            for (CommandRegistry.Command command : registry.commands()) {
                console.report(String.format("  %-10s %s", command.name(), command.description()), Severity.INFO);
            }
        });

        CommandRegistry.CommandHandler quit = (args, console) -> {
            console.reportPersistent("Shutting down...", Severity.INFO);
            shutdownRequest.run();
        };
        registry.register("quit", "Shut down the monitor", quit);
        registry.register("exit", "Shut down the monitor", quit);

        registry.register("flush", "Write all pending records to storage now", (args, console) -> {
            try {
                int written = writer.flush();
                console.report("Flushed " + written + " records", Severity.SUCCESS);
            } catch (StorageWriteException e) {
                console.report("Flush failed, " + e.getPendingRecords() + " records still pending: " + e.getMessage(),
                    Severity.ERROR);
            }
        });

        registry.register("book", "book <SYMBOL>: show the top of the latest order book", (args, console) -> {
            String symbol = symbolArgument(args, state, console, "book");
            if (symbol != null) {
                reportBook(state.snapshot(symbol), console);
            }
        });

        registry.register("trades", "trades <SYMBOL>: show the most recent trades", (args, console) -> {
            String symbol = symbolArgument(args, state, console, "trades");
            if (symbol != null) {
                reportTrades(state.snapshot(symbol), console);
            }
        });

        registry.register("viz", "viz start|stop: control the depth chart server", (args, console) -> {
            if (view == null) {
                console.report("Visualization is not available", Severity.WARNING);
                return;
            }
            String action = args.isEmpty() ? "" : args.get(0).toLowerCase(Locale.ROOT);
            switch (action) {
                case "start" -> {
                    if (view.isRunning()) {
                        console.report("Visualization already running", Severity.INFO);
                    } else if (view.start()) {
                        console.report("Visualization started", Severity.SUCCESS);
                    } else {
                        console.report("Failed to start visualization", Severity.ERROR);
                    }
                }
                case "stop" -> {
                    view.stop();
                    console.report("Visualization stopped", Severity.SUCCESS);
                }
                default -> console.report("Usage: viz start|stop", Severity.ERROR);
            }
        });

        return registry;
    }

    private static String symbolArgument(List<String> args, MarketState state, CommandConsole console, String command) {
        if (args.isEmpty()) {
            console.report("Usage: " + command + " <SYMBOL>", Severity.ERROR);
            return null;
        }
        String symbol = args.get(0).toUpperCase(Locale.ROOT);
        if (!state.isTracked(symbol)) {
            console.report("Symbol not tracked: " + symbol + " (tracked: " + String.join(", ", state.symbols()) + ")",
                Severity.ERROR);
            return null;
        }
        return symbol;
    }

    static void reportStatus(MonitorStatus status, CommandConsole console) {
        console.report(String.format("Connection: %s | messages: %d | errors: %d | reconnects: %d",
            status.connectionState(), status.messageCount(), status.errorCount(), status.reconnectCount()),
            Severity.INFO);
        console.report(String.format("Storage: %d pending | %d persisted | %d failed flushes",
            status.pendingRecords(), status.persistedRecords(), status.failedFlushes()),
            status.failedFlushes() > 0 ? Severity.WARNING : Severity.INFO);
        for (MonitorStatus.SymbolStatus symbol : status.symbols()) {
            console.report(String.format("  %-10s book seq: %s | trades: %d | bid: %s | ask: %s | last: %s",
                symbol.symbol(),
                symbol.bookSequence() < 0 ? "-" : Long.toString(symbol.bookSequence()),
                symbol.tradeCount(),
                orDash(symbol.bestBid()),
                orDash(symbol.bestAsk()),
                orDash(symbol.lastPrice())), Severity.INFO);
        }
    }

    private static void reportBook(MarketSnapshot snapshot, CommandConsole console) {
        if (!snapshot.hasBook()) {
            console.report("No order book yet for " + snapshot.symbol(), Severity.WARNING);
            return;
        }
        OrderBookUpdate book = snapshot.book();
        console.report(snapshot.symbol() + " order book (seq " + book.sequence() + ")", Severity.INFO);
        List<OrderBookLevel> asks = book.asks().subList(0, Math.min(BOOK_LEVELS_SHOWN, book.asks().size()));
        for (int i = asks.size() - 1; i >= 0; i--) {
            console.report(String.format("  ASK %s x %s", asks.get(i).price().toPlainString(),
                asks.get(i).quantity().toPlainString()), Severity.INFO);
        }
        List<OrderBookLevel> bids = book.bids().subList(0, Math.min(BOOK_LEVELS_SHOWN, book.bids().size()));
        for (OrderBookLevel bid : bids) {
            console.report(String.format("  BID %s x %s", bid.price().toPlainString(),
                bid.quantity().toPlainString()), Severity.INFO);
        }
    }

    private static void reportTrades(MarketSnapshot snapshot, CommandConsole console) {
        List<TradeRecord> trades = snapshot.recentTrades();
        if (trades.isEmpty()) {
            console.report("No trades yet for " + snapshot.symbol(), Severity.WARNING);
            return;
        }
        console.report(snapshot.symbol() + " recent trades", Severity.INFO);
        for (int i = trades.size() - 1; i >= Math.max(0, trades.size() - TRADES_SHOWN); i--) {
            TradeRecord trade = trades.get(i);
            console.report(String.format("  %s %-4s %s x %s",
                Instant.ofEpochMilli(trade.timestamp()),
                trade.side(),
                trade.price().toPlainString(),
                trade.quantity().toPlainString()), Severity.INFO);
        }
    }

    private static String orDash(BigDecimal value) {
        return value == null ? "-" : value.toPlainString();
    }
}
