package io.trading.monitor.netty;

import io.trading.monitor.util.ExponentialBackoff;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ReconnectHandlerTest {

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final AtomicInteger attempts = new AtomicInteger();

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private ReconnectHandler handler(long baseMs, long maxMs, CountDownLatch latch) {
        return new ReconnectHandler("Test", new ExponentialBackoff(baseMs, maxMs), scheduler, () -> {
            attempts.incrementAndGet();
            latch.countDown();
        });
    }

    @Test
    void testNothingScheduledBeforeStart() {
        ReconnectHandler handler = handler(10, 100, new CountDownLatch(1));

        assertNull(handler.scheduleReconnect());
        assertFalse(handler.isReconnectPending());
        assertEquals(0, handler.getRetryCount());
    }

    @Test
    void testScheduledAttemptRuns() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        ReconnectHandler handler = handler(10, 100, latch);
        handler.start();

        Duration delay = handler.scheduleReconnect();

        assertEquals(Duration.ofMillis(10), delay);
        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertEquals(1, attempts.get());
        assertEquals(1, handler.getRetryCount());
    }

    @Test
    void testOnlyOneAttemptPending() {
        ReconnectHandler handler = handler(60_000, 60_000, new CountDownLatch(1));
        handler.start();

        assertNotNull(handler.scheduleReconnect());
        assertNull(handler.scheduleReconnect());
        assertTrue(handler.isReconnectPending());
        assertEquals(1, handler.getRetryCount());
    }

    @Test
    void testDelayGrowsUntilReset() {
        ReconnectHandler handler = handler(1000, 4000, new CountDownLatch(1));
        handler.start();

        assertEquals(Duration.ofMillis(1000), handler.scheduleReconnect());
        handler.cancel();
        assertEquals(Duration.ofMillis(2000), handler.scheduleReconnect());
        handler.cancel();
        assertEquals(Duration.ofMillis(4000), handler.scheduleReconnect());
        handler.cancel();
        assertEquals(Duration.ofMillis(4000), handler.scheduleReconnect());
        handler.cancel();

        handler.reset();
        assertEquals(Duration.ofMillis(1000), handler.scheduleReconnect());
    }

    @Test
    void testStopCancelsPendingAttempt() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        ReconnectHandler handler = handler(200, 200, latch);
        handler.start();
        handler.scheduleReconnect();

        handler.stop();

        assertFalse(handler.isReconnectPending());
        assertFalse(latch.await(500, TimeUnit.MILLISECONDS));
        assertEquals(0, attempts.get());
        assertNull(handler.scheduleReconnect());
    }

    @Test
    void testShutDownSchedulerRejectsQuietly() {
        ReconnectHandler handler = handler(10, 10, new CountDownLatch(1));
        handler.start();
        scheduler.shutdown();

        assertNull(handler.scheduleReconnect());
        assertFalse(handler.isReconnectPending());
    }
}
