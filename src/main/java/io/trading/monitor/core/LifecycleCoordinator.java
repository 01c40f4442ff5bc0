package io.trading.monitor.core;

import io.trading.monitor.command.CommandConsole;
import io.trading.monitor.command.CommandRegistry;
import io.trading.monitor.command.CommandService;
import io.trading.monitor.command.ConsoleCommandIO;
import io.trading.monitor.command.DefaultCommands;
import io.trading.monitor.command.Severity;
import io.trading.monitor.config.MonitorConfig;
import io.trading.monitor.feed.BinanceDepthSnapshotClient;
import io.trading.monitor.feed.BinanceStreamParser;
import io.trading.monitor.feed.BookSnapshotSource;
import io.trading.monitor.feed.StreamIngestor;
import io.trading.monitor.metrics.MonitorMetrics;
import io.trading.monitor.model.ConnectionState;
import io.trading.monitor.netty.WebSocketClient;
import io.trading.monitor.state.MarketState;
import io.trading.monitor.storage.BatchWriter;
import io.trading.monitor.storage.JdbcRecordStore;
import io.trading.monitor.storage.StorageWriteException;
import io.trading.monitor.util.ExponentialBackoff;
import io.trading.monitor.view.DepthChartServer;
import io.trading.monitor.view.MarketView;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Wires the monitor's components, starts them and owns the single shutdown path.
 *
 * Teardown runs exactly once, in a fixed order: command service, feed ingestor,
 * visualization, then storage (flush and close). A failing step is logged and
 * reported and the remaining steps still run.
 */
public class LifecycleCoordinator implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(LifecycleCoordinator.class);

    static final long FLUSH_RETRY_BASE_DELAY_MS = 100;

    private final List<Step> startSteps;
    private final List<Step> teardownSteps;
    private final List<String> banner;
    private final CommandConsole console;
    private final ShutdownSignalBarrier shutdownBarrier;

    private final AtomicBoolean shutdownStarted = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);

    /**
     * Assembles a coordinator around already constructed components.
     *
     * @param config          Configuration shown in the startup banner
     * @param state           Market state
     * @param writer          Batch writer
     * @param ingestor        Feed ingestor
     * @param view            Visualization, or null for none
     * @param commands        Command service
     * @param console         Console for operator reports
     * @param shutdownBarrier Barrier signalled by OS signals and the quit command
     */
    public LifecycleCoordinator(
        MonitorConfig config,
        MarketState state,
        BatchWriter writer,
        StreamIngestor ingestor,
        MarketView view,
        CommandService commands,
        CommandConsole console,
        ShutdownSignalBarrier shutdownBarrier
    ) {
        this(
            startSteps(config, ingestor, view, commands, console),
            teardownSteps(writer, ingestor, view, commands, console),
            banner(config, state),
            console,
            shutdownBarrier
        );

        writer.setFlushListener(error -> console.report(
            "Background flush failed, " + error.getPendingRecords() + " records kept pending: " + error.getMessage(),
            Severity.WARNING));
        ingestor.addConnectionStateListener((previous, current) -> {
            if (current == ConnectionState.CONNECTED) {
                console.report("Connected to market data feed", Severity.SUCCESS);
            } else if (current == ConnectionState.DISCONNECTED && previous == ConnectionState.CONNECTED) {
                console.report("Market data feed disconnected, reconnecting...", Severity.WARNING);
            }
        });
    }

    LifecycleCoordinator(
        List<Step> startSteps,
        List<Step> teardownSteps,
        List<String> banner,
        CommandConsole console,
        ShutdownSignalBarrier shutdownBarrier
    ) {
        this.startSteps = List.copyOf(startSteps);
        this.teardownSteps = List.copyOf(teardownSteps);
        this.banner = List.copyOf(banner);
        this.console = console;
        this.shutdownBarrier = shutdownBarrier;
    }

    /**
     * Builds every component from configuration.
     */
    public static LifecycleCoordinator create(MonitorConfig config) {
        MonitorMetrics metrics = MonitorMetrics.withDefaultRegistry();
        MarketState state = new MarketState(config.symbols(), config.tradeHistoryCapacity());

        BatchWriter writer = new BatchWriter(
            JdbcRecordStore.open(config.jdbcUrl()),
            config.batchSize(),
            config.flushIntervalMs(),
            config.flushMaxAttempts(),
            new ExponentialBackoff(FLUSH_RETRY_BASE_DELAY_MS, config.flushMaxBackoffMs()),
            metrics
        );

        BookSnapshotSource snapshotSource = config.resyncEnabled()
            ? new BinanceDepthSnapshotClient(config.restUrl(), config.bookDepth())
            : null;

        StreamIngestor ingestor = new StreamIngestor(
            URI.create(config.feedUrl()),
            config.symbols(),
            config.bookDepth(),
            state,
            writer,
            new BinanceStreamParser(),
            snapshotSource,
            metrics,
            WebSocketClient.factory("Feed"),
            new ExponentialBackoff(config.reconnectInitialDelayMs(), config.reconnectMaxDelayMs())
        );

        ShutdownSignalBarrier barrier = new ShutdownSignalBarrier();
        Supplier<MonitorStatus> status = () -> MonitorStatus.capture(ingestor, writer, state);
        MarketView view = new DepthChartServer(config.vizPort(), state, metrics.getRegistry(), status);

        CommandConsole console = new ConsoleCommandIO();
        CommandRegistry registry = DefaultCommands.create(ingestor, writer, state, view, status, barrier::signal);
        CommandService commands = new CommandService(registry, console);

        return new LifecycleCoordinator(config, state, writer, ingestor, view, commands, console, barrier);
    }

    /**
     * Starts the components and prints the startup banner.
     *
     * @throws IllegalStateException if a component failed to start
     */
    public void start() {
        for (String line : banner) {
            console.reportPersistent(line, Severity.INFO);
        }
        for (Step step : startSteps) {
            LOGGER.info("Starting {}", step.name());
            try {
                step.action().run();
            } catch (Exception e) {
                throw new IllegalStateException("Failed to start " + step.name(), e);
            }
        }
        console.reportPersistent(
            "Type 'help' for available commands, 'status' for connection info, or 'reconnect' to reset connection.",
            Severity.INFO);
    }

    /**
     * Signals the main thread to shut down. Never blocks.
     */
    public void requestShutdown() {
        shutdownBarrier.signal();
    }

    /**
     * Blocks until a shutdown is requested or the process is signalled.
     */
    public void awaitShutdownRequest() {
        LOGGER.info("Monitor running. Press Ctrl+C or type 'quit' to shut down.");
        shutdownBarrier.await();
        LOGGER.info("Shutdown signal received");
    }

    /**
     * Runs the teardown. Only the first caller does the work; later callers return
     * immediately (use {@link #awaitTermination(Duration)} to wait for it).
     */
    public void shutdown() {
        if (!shutdownStarted.compareAndSet(false, true)) {
            LOGGER.debug("Shutdown already in progress");
            return;
        }

        LOGGER.info("Shutting down Crypto Monitor...");
        console.reportPersistent("Cleaning up application resources...", Severity.INFO);
        try {
            for (Step step : teardownSteps) {
                try {
                    LOGGER.info("Stopping {}", step.name());
                    step.action().run();
                } catch (Exception e) {
                    LOGGER.error("Error stopping {}", step.name(), e);
                    console.reportPersistent("Error stopping " + step.name() + ": " + e.getMessage(), Severity.ERROR);
                }
            }
            console.reportPersistent("Application shutdown complete.", Severity.INFO);
            LOGGER.info("Crypto Monitor shutdown complete");
        } finally {
            terminated.countDown();
        }
    }

    /**
     * Waits for a teardown started by any caller to finish.
     *
     * @return true if teardown completed within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isShutdownStarted() {
        return shutdownStarted.get();
    }

    @Override
    public void close() {
        shutdown();
    }

    private static List<Step> startSteps(
        MonitorConfig config,
        StreamIngestor ingestor,
        MarketView view,
        CommandService commands,
        CommandConsole console
    ) {
        List<Step> steps = new ArrayList<>();
        steps.add(new Step("command service", commands::start));
        steps.add(new Step("stream ingestor", ingestor::connect));
        if (config.vizEnabled() && view != null) {
            steps.add(new Step("visualization", () -> {
                console.report("Starting visualization...", Severity.INFO);
                if (view.start()) {
                    console.report("Visualization started. Open http://127.0.0.1:" + config.vizPort()
                        + "/api/depth?symbol=" + config.symbols().get(0) + " in your browser.", Severity.SUCCESS);
                } else {
                    console.report("Failed to start visualization on port " + config.vizPort(), Severity.ERROR);
                }
            }));
        }
        return steps;
    }

    private static List<Step> teardownSteps(
        BatchWriter writer,
        StreamIngestor ingestor,
        MarketView view,
        CommandService commands,
        CommandConsole console
    ) {
        List<Step> steps = new ArrayList<>();
        steps.add(new Step("command service", commands::stop));
        steps.add(new Step("stream ingestor", ingestor::close));
        steps.add(new Step("visualization", () -> {
            if (view != null && view.isRunning()) {
                view.stop();
            }
        }));
        steps.add(new Step("storage", () -> {
            console.reportPersistent("Flushing remaining database records...", Severity.INFO);
            try {
                int written = writer.flush();
                LOGGER.info("Flushed {} records before close", written);
            } catch (StorageWriteException e) {
                LOGGER.error("Flush before close failed, retrying on close", e);
            } finally {
                writer.close();
            }
            console.reportPersistent("Database closed successfully.", Severity.SUCCESS);
        }));
        return steps;
    }

    private static List<String> banner(MonitorConfig config, MarketState state) {
        return List.of(
            "Starting Cryptocurrency Market Monitor with database: " + config.databaseId(),
            "Tracking symbols: " + String.join(", ", state.symbols())
        );
    }

    /**
     * A named start or teardown action.
     */
    record Step(String name, StepAction action) {
    }

    @FunctionalInterface
    interface StepAction {
        void run() throws Exception;
    }
}
