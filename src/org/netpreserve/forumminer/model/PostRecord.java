package org.netpreserve.forumminer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.forumminer.util.Fingerprints;

/**
 * One post of a thread. Post numbers are 1-based and run on across reply pages.
 */
public record PostRecord(
        @JsonProperty("author") String author,
        @JsonProperty("post_date") @Nullable String postDate,
        @JsonProperty("post_text") String postText,
        @JsonProperty("post_number") int postNumber,
        @JsonProperty("post_id") String postId,
        @JsonProperty("content_hash") @Nullable String contentHash
) {
    public static PostRecord of(String threadId, int postNumber, String author, @Nullable String postDate,
                                String postText) {
        return new PostRecord(author, postDate, postText, postNumber, postId(threadId, postNumber),
                Fingerprints.ofText(postText));
    }

    public static String postId(String threadId, int postNumber) {
        return threadId + "-" + postNumber;
    }
}
