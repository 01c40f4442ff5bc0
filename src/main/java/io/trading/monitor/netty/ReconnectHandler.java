package io.trading.monitor.netty;

import io.trading.monitor.util.ExponentialBackoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Schedules reconnection attempts with exponential backoff.
 * Retries are unlimited; at most one attempt is pending at a time.
 */
public class ReconnectHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconnectHandler.class);

    private final String name;
    private final ExponentialBackoff backoff;
    private final ScheduledExecutorService scheduler;
    private final Runnable connectAction;

    private ScheduledFuture<?> pending;
    private int retryCount = 0;
    private volatile boolean running = false;

    /**
     * Creates a new reconnect handler.
     *
     * @param name          Friendly name for logging
     * @param backoff       Delay policy between attempts
     * @param scheduler     Executor that runs the attempts
     * @param connectAction Action to perform when reconnecting
     */
    public ReconnectHandler(String name, ExponentialBackoff backoff, ScheduledExecutorService scheduler, Runnable connectAction) {
        this.name = name;
        this.backoff = backoff;
        this.scheduler = scheduler;
        this.connectAction = connectAction;
    }

    public synchronized void start() {
        running = true;
        LOGGER.debug("{}: Reconnect handler started", name);
    }

    /**
     * Stops the handler and cancels any pending attempt.
     */
    public synchronized void stop() {
        running = false;
        cancel();
        retryCount = 0;
        LOGGER.debug("{}: Reconnect handler stopped", name);
    }

    /**
     * Schedules a reconnection attempt unless one is already pending.
     *
     * @return the delay before the attempt, or null if nothing was scheduled
     */
    public synchronized Duration scheduleReconnect() {
        if (!running) {
            LOGGER.debug("{}: Reconnect handler not running", name);
            return null;
        }
        if (pending != null && !pending.isDone()) {
            return null;
        }

        retryCount++;
        Duration delay = backoff.delayForAttempt(retryCount);
        LOGGER.info("{}: Scheduling reconnect attempt {} in {} ms", name, retryCount, delay.toMillis());

        int attempt = retryCount;
        try {
            pending = scheduler.schedule(() -> {
                synchronized (this) {
                    pending = null;
                }
                if (running) {
                    LOGGER.info("{}: Attempting reconnection #{}", name, attempt);
                    connectAction.run();
                }
            }, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOGGER.debug("{}: Scheduler is shut down, reconnect not scheduled", name);
            return null;
        }
        return delay;
    }

    /**
     * Cancels the pending attempt, if any, without changing the retry count.
     */
    public synchronized void cancel() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    /**
     * Resets the backoff (called on successful connection).
     */
    public synchronized void reset() {
        retryCount = 0;
        LOGGER.debug("{}: Reconnect state reset", name);
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized int getRetryCount() {
        return retryCount;
    }

    public synchronized boolean isReconnectPending() {
        return pending != null && !pending.isDone();
    }
}
