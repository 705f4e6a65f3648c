package org.netpreserve.forumminer.fetch;

import org.netpreserve.forumminer.ForumMinerException;
import org.netpreserve.forumminer.util.Url;

/**
 * A download was aborted because it exceeded the configured size cap.
 */
public class DownloadTooLargeException extends ForumMinerException {
    private final Url url;
    private final long limit;

    public DownloadTooLargeException(Url url, long limit) {
        super("Download exceeds " + limit + " bytes: " + url);
        this.url = url;
        this.limit = limit;
    }

    public Url url() {
        return url;
    }

    public long limit() {
        return limit;
    }

    @Override
    public String reason() {
        return "Too large";
    }
}
