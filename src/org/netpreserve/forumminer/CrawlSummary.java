package org.netpreserve.forumminer;

import java.util.Map;

/**
 * Counts from a single run.
 *
 * @param discovered       distinct thread URLs found on the board (plus configured extras)
 * @param queued           threads selected for processing this run
 * @param succeeded        threads fully processed and recorded
 * @param failed           threads that failed, see {@code failureReasons}
 * @param postsNew         posts seen for the first time
 * @param postsEdited      previously seen posts whose content changed
 * @param assetsDownloaded attachments downloaded
 * @param assetsSkipped    known attachments whose validators showed no change
 * @param assetsFailed     attachments that couldn't be downloaded or were too large
 * @param failureReasons   thread failures by reason
 */
public record CrawlSummary(
        int discovered,
        int queued,
        int succeeded,
        int failed,
        int postsNew,
        int postsEdited,
        int assetsDownloaded,
        int assetsSkipped,
        int assetsFailed,
        Map<String, Integer> failureReasons
) {
    public CrawlSummary {
        failureReasons = Map.copyOf(failureReasons);
    }
}
