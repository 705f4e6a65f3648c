package org.netpreserve.forumminer.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.forumminer.util.Url;

import java.time.Instant;

/**
 * What was last seen of a thread.
 *
 * @param outputDir folder the thread's files were last written to, relative to the output root
 * @param migrated  imported from a legacy manifest and never seen on a board since, so the counts are unknown
 */
public record ThreadState(
        @JsonProperty("thread_id") String threadId,
        @JsonProperty("url") Url url,
        @JsonProperty("last_seen_at") Instant lastSeenAt,
        @JsonProperty("reply_count_seen") int replyCountSeen,
        @JsonProperty("views_seen") int viewsSeen,
        @JsonProperty("last_modified") @Nullable String lastModified,
        @JsonProperty("title") @Nullable String title,
        @JsonProperty("output_dir") @Nullable String outputDir,
        @JsonProperty("migrated") boolean migrated
) {
}
