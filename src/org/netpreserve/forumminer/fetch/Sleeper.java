package org.netpreserve.forumminer.fetch;

import java.time.Duration;

/**
 * Blocks the calling thread. Swapped out in tests so waits can be observed instead of taken.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
