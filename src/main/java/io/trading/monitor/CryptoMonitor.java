package io.trading.monitor;

import io.trading.monitor.config.MonitorConfig;
import io.trading.monitor.core.LifecycleCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Main entry point for the Crypto Monitor application.
 */
public class CryptoMonitor {

    private static final Logger LOGGER = LoggerFactory.getLogger(CryptoMonitor.class);

    private static final Duration SHUTDOWN_HOOK_TIMEOUT = Duration.ofSeconds(30);

    public static void main(String[] args) {
        LOGGER.info("========================================");
        LOGGER.info("   Crypto Monitor Starting...");
        LOGGER.info("========================================");

        LifecycleCoordinator coordinator;
        try {
            MonitorConfig config = MonitorConfig.fromEnv();
            LOGGER.info("Configuration loaded:");
            LOGGER.info("  Database: {}", config.jdbcUrl());
            LOGGER.info("  Symbols: {}", config.symbols());
            LOGGER.info("  Batch size: {}", config.batchSize());
            LOGGER.info("  Feed: {}", config.feedUrl());

            coordinator = LifecycleCoordinator.create(config);
        } catch (Exception e) {
            LOGGER.error("Fatal error initializing Crypto Monitor", e);
            System.err.println("Failed to start: " + e.getMessage());
            System.exit(1);
            return;
        }

        // Covers exits that bypass the barrier; waits so the JVM does not halt mid-teardown
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutdown hook triggered");
            coordinator.requestShutdown();
            coordinator.shutdown();
            try {
                if (!coordinator.awaitTermination(SHUTDOWN_HOOK_TIMEOUT)) {
                    LOGGER.warn("Teardown did not complete within {}", SHUTDOWN_HOOK_TIMEOUT);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "shutdown-hook"));

        try {
            coordinator.start();
            coordinator.awaitShutdownRequest();
        } catch (Exception e) {
            LOGGER.error("Fatal error in Crypto Monitor", e);
        } finally {
            coordinator.shutdown();
        }

        LOGGER.info("Crypto Monitor exited");
    }
}
