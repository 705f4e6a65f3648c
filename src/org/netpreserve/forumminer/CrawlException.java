package org.netpreserve.forumminer;

/**
 * The crawl could not continue at all, e.g. the board's first page couldn't be fetched.
 */
public class CrawlException extends ForumMinerException {
    public CrawlException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reason() {
        return getCause() instanceof ForumMinerException e ? e.reason() : "Fatal";
    }
}
