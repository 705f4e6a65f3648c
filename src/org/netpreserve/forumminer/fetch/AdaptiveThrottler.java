package org.netpreserve.forumminer.fetch;

import org.netpreserve.forumminer.config.ThrottleConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Paces outbound requests. Normally a token bucket decides the pace. When the server signals overload (429 or 503)
 * the throttler enters a cool-off period during which every caller is told to wait until it ends. Repeated overload
 * signals lengthen the cool-off and successes shrink it back towards the initial value.
 */
public class AdaptiveThrottler {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveThrottler.class);
    private final TokenBucket bucket;
    private final Clock clock;
    private final DoubleSupplier random;
    private final double jitter;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private Duration currentBackoff;
    private boolean inCoolOff;
    private Instant coolOffUntil = Instant.EPOCH;

    public AdaptiveThrottler(ThrottleConfig config) {
        this(config, Clock.systemUTC(), () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of uniformly distributed values in [0, 1) used for jitter
     */
    public AdaptiveThrottler(ThrottleConfig config, Clock clock, DoubleSupplier random) {
        this.bucket = new TokenBucket(config.tokensPerSecond(), config.capacity(), clock);
        this.clock = clock;
        this.random = random;
        this.jitter = config.jitter();
        this.initialBackoff = config.initialBackoff();
        this.maxBackoff = config.maxBackoff();
        this.currentBackoff = initialBackoff;
    }

    /**
     * Returns how long the caller should wait before sending a request. A zero result means a token was taken and
     * the request may go ahead now.
     */
    public synchronized Duration acquire() {
        if (inCoolOff) {
            Instant now = clock.instant();
            if (now.isBefore(coolOffUntil)) {
                return withJitter(Duration.between(now, coolOffUntil));
            }
            endCoolOff();
        }
        return withJitter(bucket.tryAcquire());
    }

    /**
     * The server answered 429 Too Many Requests.
     */
    public synchronized void reportRateLimit() {
        startCoolOff(2.0);
    }

    /**
     * The server answered 503 Service Unavailable or another overload-like 5xx.
     */
    public synchronized void reportServiceUnavailable() {
        startCoolOff(1.5);
    }

    public synchronized void reportSuccess() {
        if (inCoolOff && !clock.instant().isBefore(coolOffUntil)) {
            endCoolOff();
        }
        if (!inCoolOff && currentBackoff.compareTo(initialBackoff) > 0) {
            currentBackoff = max(initialBackoff, multiply(currentBackoff, 0.9));
        }
    }

    public synchronized boolean inCoolOff() {
        return inCoolOff;
    }

    public synchronized Duration currentBackoff() {
        return currentBackoff;
    }

    private void startCoolOff(double factor) {
        inCoolOff = true;
        coolOffUntil = clock.instant().plus(currentBackoff);
        log.atWarn().addKeyValue("until", coolOffUntil).addKeyValue("backoff", currentBackoff)
                .log("Server overloaded, cooling off");
        currentBackoff = min(maxBackoff, multiply(currentBackoff, factor));
    }

    private void endCoolOff() {
        inCoolOff = false;
        currentBackoff = initialBackoff;
        log.debug("Cool-off ended");
    }

    private Duration withJitter(Duration base) {
        if (base.isZero() || jitter == 0) return base;
        double offset = base.toNanos() * jitter * (2 * random.getAsDouble() - 1);
        long nanos = base.toNanos() + (long) offset;
        return Duration.ofNanos(Math.max(0, nanos));
    }

    private static Duration multiply(Duration duration, double factor) {
        return Duration.ofNanos((long) (duration.toNanos() * factor));
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
