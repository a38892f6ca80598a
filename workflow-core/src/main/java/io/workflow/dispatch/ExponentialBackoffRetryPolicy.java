package io.workflow.dispatch;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter.
 *
 * <p>The delay for attempt {@code n} is {@code baseDelayMs * 2^(n-1)} capped at
 * {@code maxDelayMs}, then multiplied by a random factor in [0.5, 1.5) and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private static final int MAX_SHIFT = 30;

    private final long baseDelayMs;
    private final long maxDelayMs;

    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    public long baseDelayMs() {
        return baseDelayMs;
    }

    public long maxDelayMs() {
        return maxDelayMs;
    }

    @Override
    public long computeDelayMs(int attempts) {
        if (attempts <= 0) {
            return 0L;
        }
        int shift = Math.min(attempts - 1, MAX_SHIFT);
        long multiplier = 1L << shift;
        long exponential = multiplier > maxDelayMs / baseDelayMs ? maxDelayMs : baseDelayMs * multiplier;
        long capped = Math.min(maxDelayMs, exponential);
        long jittered = (long) (capped * ThreadLocalRandom.current().nextDouble(0.5, 1.5));
        return Math.min(maxDelayMs, Math.max(0L, jittered));
    }
}
