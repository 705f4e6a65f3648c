package org.netpreserve.forumminer.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.forumminer.util.ByteSizeDeserializer;
import org.netpreserve.forumminer.util.DurationDeserializer;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * HTTP request behaviour.
 *
 * @param userAgent         User-Agent string to identify as to the forum
 * @param headers           extra request headers sent with every request
 * @param maxConcurrent     maximum simultaneously in-flight requests (pages and downloads alike)
 * @param timeout           per-request timeout
 * @param connectTimeout    connection establishment timeout
 * @param maxAttempts       attempts per URL before giving up
 * @param initialBackoff    sleep before the first retry, doubled for each further retry
 * @param maxBackoff        upper bound for the retry sleep
 * @param retryableStatuses HTTP statuses that are retried
 * @param maxRedirects      redirect hops followed per request
 * @param maxDownloadSize   attachments larger than this are skipped
 */
public record FetchConfig(
        String userAgent,
        Map<String, String> headers,
        int maxConcurrent,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration timeout,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration connectTimeout,
        int maxAttempts,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration initialBackoff,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration maxBackoff,
        Set<Integer> retryableStatuses,
        int maxRedirects,
        @JsonDeserialize(using = ByteSizeDeserializer.class)
        Long maxDownloadSize
) {
    public FetchConfig {
        if (headers == null) headers = Map.of();
        if (retryableStatuses == null) retryableStatuses = Set.of(429, 500, 502, 503, 504);
    }
}
