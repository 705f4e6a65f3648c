package org.netpreserve.forumminer.config;

/**
 * Root configuration for a harvest job.
 *
 * @param forum    what to harvest (board, allow-list, attachment types)
 * @param fetch    how requests are made (concurrency, retries, timeouts)
 * @param throttle how fast requests are made (token bucket, cool-off)
 * @param crawl    how the run is scheduled (workers, re-fetch policy, limits)
 * @param storage  where output and crawl state are written
 */
public record JobConfig(
        ForumConfig forum,
        FetchConfig fetch,
        ThrottleConfig throttle,
        CrawlConfig crawl,
        StorageConfig storage
) {
}
