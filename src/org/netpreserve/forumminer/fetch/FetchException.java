package org.netpreserve.forumminer.fetch;

import org.netpreserve.forumminer.ForumMinerException;
import org.netpreserve.forumminer.util.Url;

/**
 * A URL could not be fetched.
 */
public class FetchException extends ForumMinerException {
    public enum Kind {
        /**
         * The URL (or a redirect target) is not on the allow-list. No request was sent.
         */
        BLOCKED,
        /**
         * The server answered with a status that isn't retried.
         */
        HTTP,
        /**
         * All attempts failed with retryable statuses or network errors.
         */
        EXHAUSTED
    }

    private final Kind kind;
    private final Url url;
    private final int status;
    private final String reason;

    public FetchException(Kind kind, Url url, int status, String reason, Throwable cause) {
        super(kind + " " + reason + ": " + url, cause);
        this.kind = kind;
        this.url = url;
        this.status = status;
        this.reason = reason;
    }

    public static FetchException blocked(Url url) {
        return new FetchException(Kind.BLOCKED, url, 0, "Blocked", null);
    }

    public static FetchException http(Url url, int status) {
        return new FetchException(Kind.HTTP, url, status, "HTTP " + status, null);
    }

    public static FetchException exhausted(Url url, int status, String lastReason, Throwable cause) {
        return new FetchException(Kind.EXHAUSTED, url, status, lastReason, cause);
    }

    public Kind kind() {
        return kind;
    }

    public Url url() {
        return url;
    }

    /**
     * The last HTTP status received, or 0 if no response was received.
     */
    public int status() {
        return status;
    }

    @Override
    public String reason() {
        return reason;
    }
}
