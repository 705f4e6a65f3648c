package org.netpreserve.forumminer.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

public record PostState(
        @JsonProperty("post_id") String postId,
        @JsonProperty("thread_id") String threadId,
        @JsonProperty("post_number") int postNumber,
        @JsonProperty("content_hash") @Nullable String contentHash,
        @JsonProperty("observed_at") Instant observedAt,
        @JsonProperty("edited_at") @Nullable Instant editedAt
) {
}
