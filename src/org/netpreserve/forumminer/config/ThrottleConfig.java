package org.netpreserve.forumminer.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.forumminer.util.DurationDeserializer;

import java.time.Duration;

/**
 * Adaptive throttling.
 *
 * @param tokensPerSecond steady-state request rate
 * @param capacity        burst size
 * @param jitter          symmetric random variation applied to every wait (0.1 = ±10%)
 * @param initialBackoff  cool-off length after the first overload signal
 * @param maxBackoff      upper bound for the cool-off length
 */
public record ThrottleConfig(
        double tokensPerSecond,
        int capacity,
        double jitter,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration initialBackoff,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration maxBackoff
) {
}
