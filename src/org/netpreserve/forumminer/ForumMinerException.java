package org.netpreserve.forumminer;

public abstract class ForumMinerException extends Exception {
    public ForumMinerException(String message) {
        super(message);
    }

    public ForumMinerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short label for the failure used in summaries and logs, e.g. {@code "HTTP 404"}.
     */
    public abstract String reason();
}
