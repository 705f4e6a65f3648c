package org.netpreserve.forumminer.fetch;

import java.time.Clock;
import java.time.Duration;

/**
 * Token bucket which refills continuously at a fixed rate up to its capacity. Starts full.
 */
public class TokenBucket {
    private static final long NANOS_PER_SECOND = 1_000_000_000L;
    private final Clock clock;
    private final double tokensPerSecond;
    private final int capacity;
    private double tokens;
    private long lastRefillNanos;

    public TokenBucket(double tokensPerSecond, int capacity, Clock clock) {
        if (tokensPerSecond <= 0) throw new IllegalArgumentException("tokensPerSecond must be positive");
        if (capacity < 1) throw new IllegalArgumentException("capacity must be at least 1");
        this.clock = clock;
        this.tokensPerSecond = tokensPerSecond;
        this.capacity = capacity;
        this.tokens = capacity;
        this.lastRefillNanos = nowNanos();
    }

    /**
     * Takes a token if one is available and returns zero, otherwise returns how long until one will be. Nothing is
     * consumed when a wait is returned.
     */
    public synchronized Duration tryAcquire() {
        refill();
        if (tokens >= 1) {
            tokens -= 1;
            return Duration.ZERO;
        }
        double secondsNeeded = (1 - tokens) / tokensPerSecond;
        return Duration.ofNanos((long) Math.ceil(secondsNeeded * NANOS_PER_SECOND));
    }

    public synchronized double available() {
        refill();
        return tokens;
    }

    public int capacity() {
        return capacity;
    }

    private void refill() {
        long now = nowNanos();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * tokensPerSecond / NANOS_PER_SECOND);
        }
        lastRefillNanos = now;
    }

    private long nowNanos() {
        var instant = clock.instant();
        return instant.getEpochSecond() * NANOS_PER_SECOND + instant.getNano();
    }
}
