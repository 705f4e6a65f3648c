package org.netpreserve.forumminer.config;

import org.jetbrains.annotations.Nullable;

/**
 * How a run is scheduled.
 *
 * @param workers        threads processed concurrently
 * @param refetchUpdated re-fetch already harvested threads whose board listing shows new replies
 * @param maxThreads     stop queueing after this many threads per run
 */
public record CrawlConfig(
        int workers,
        boolean refetchUpdated,
        @Nullable Integer maxThreads) {
}
