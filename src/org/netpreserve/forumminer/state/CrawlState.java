package org.netpreserve.forumminer.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Everything the crawler remembers between runs. Threads and posts are keyed by id, assets by URL.
 * Not thread-safe, access goes through {@link StateStore}.
 */
public class CrawlState {
    public static final String SCHEMA_VERSION = "1.0";

    @JsonProperty("schema_version")
    private String schemaVersion;
    @JsonProperty("last_updated")
    private @Nullable Instant lastUpdated;
    @JsonProperty("threads")
    private final Map<String, ThreadState> threads;
    @JsonProperty("posts")
    private final Map<String, PostState> posts;
    @JsonProperty("assets")
    private final Map<String, AssetState> assets;

    public CrawlState() {
        this(SCHEMA_VERSION, null, null, null, null);
    }

    @JsonCreator
    public CrawlState(@JsonProperty("schema_version") @Nullable String schemaVersion,
                      @JsonProperty("last_updated") @Nullable Instant lastUpdated,
                      @JsonProperty("threads") @Nullable Map<String, ThreadState> threads,
                      @JsonProperty("posts") @Nullable Map<String, PostState> posts,
                      @JsonProperty("assets") @Nullable Map<String, AssetState> assets) {
        this.schemaVersion = schemaVersion == null ? SCHEMA_VERSION : schemaVersion;
        this.lastUpdated = lastUpdated;
        this.threads = threads == null ? new HashMap<>() : new HashMap<>(threads);
        this.posts = posts == null ? new HashMap<>() : new HashMap<>(posts);
        this.assets = assets == null ? new HashMap<>() : new HashMap<>(assets);
    }

    public String schemaVersion() {
        return schemaVersion;
    }

    void schemaVersion(String schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    public @Nullable Instant lastUpdated() {
        return lastUpdated;
    }

    void lastUpdated(Instant lastUpdated) {
        this.lastUpdated = lastUpdated;
    }

    public Map<String, ThreadState> threads() {
        return threads;
    }

    public Map<String, PostState> posts() {
        return posts;
    }

    public Map<String, AssetState> assets() {
        return assets;
    }
}
