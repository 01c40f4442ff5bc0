package io.trading.monitor.util;

import java.time.Duration;

/**
 * Doubling backoff bounded by a maximum delay.
 * Attempt 1 waits the base delay, attempt n waits base * 2^(n-1), never more than the cap.
 */
public class ExponentialBackoff {

    private final long baseDelayMs;
    private final long maxDelayMs;

    public ExponentialBackoff(long baseDelayMs, long maxDelayMs) {
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
    }

    public Duration delayForAttempt(int attempt) {
        if (baseDelayMs == 0L) {
            return Duration.ZERO;
        }
        int exponent = Math.max(0, attempt - 1);
        double scaled = baseDelayMs * Math.pow(2.0d, exponent);
        return Duration.ofMillis((long) Math.min((double) maxDelayMs, scaled));
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
