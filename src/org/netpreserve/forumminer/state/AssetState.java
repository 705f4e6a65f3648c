package org.netpreserve.forumminer.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.forumminer.util.Url;

import java.time.Instant;

public record AssetState(
        @JsonProperty("url") Url url,
        @JsonProperty("filename") String filename,
        @JsonProperty("content_hash") @Nullable String contentHash,
        @JsonProperty("mime_type") @Nullable String mimeType,
        @JsonProperty("size") @Nullable Long size,
        @JsonProperty("downloaded_at") Instant downloadedAt,
        @JsonProperty("etag") @Nullable String etag,
        @JsonProperty("last_modified") @Nullable String lastModified
) {
}
