package org.netpreserve.forumminer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.forumminer.util.Url;

import java.time.Instant;
import java.util.List;
import java.util.TreeSet;

/**
 * Everything harvested from one thread, written out as its {@code metadata.json}.
 */
public record ThreadRecord(
        @JsonProperty("thread_id") String threadId,
        @JsonProperty("title") String title,
        @JsonProperty("url") Url url,
        @JsonProperty("author") String author,
        @JsonProperty("post_date") @Nullable String postDate,
        @JsonProperty("posts") List<PostRecord> posts,
        @JsonProperty("replies") int replies,
        @JsonProperty("views") int views,
        @JsonProperty("assets") List<AssetRecord> assets,
        @JsonProperty("schema_version") String schemaVersion,
        @JsonProperty("scraped_at") Instant scrapedAt
) {
    public static final String SCHEMA_VERSION = "1.0";
    public static final String NO_ASSETS = "no_assets";
    public static final String MIXED = "mixed";

    public ThreadRecord {
        posts = posts == null ? List.of() : List.copyOf(posts);
        assets = assets == null ? List.of() : List.copyOf(assets);
    }

    /**
     * Builds a record whose author and post date are taken from the first post.
     */
    public static ThreadRecord of(String threadId, String title, Url url, List<PostRecord> posts, int replies,
                                  int views, List<AssetRecord> assets, Instant scrapedAt) {
        String author = posts.isEmpty() ? "Unknown" : posts.get(0).author();
        String postDate = posts.isEmpty() ? null : posts.get(0).postDate();
        return new ThreadRecord(threadId, title, url, author, postDate, posts, replies, views, assets,
                SCHEMA_VERSION, scrapedAt);
    }

    /**
     * Sorted distinct file types of the assets, e.g. {@code [".xml", ".zip"]}.
     */
    @JsonProperty(value = "asset_types", access = JsonProperty.Access.READ_ONLY)
    public List<String> assetTypes() {
        var types = new TreeSet<String>();
        for (var asset : assets) {
            String type = asset.fileType();
            if (!type.isEmpty()) types.add(type);
        }
        return List.copyOf(types);
    }

    /**
     * {@code no_assets}, {@code mixed}, or the single asset type without its dot (e.g. {@code xml}).
     */
    @JsonProperty(value = "asset_type_category", access = JsonProperty.Access.READ_ONLY)
    public String assetTypeCategory() {
        var types = assetTypes();
        if (types.isEmpty()) return NO_ASSETS;
        if (types.size() > 1) return MIXED;
        return types.get(0).substring(1);
    }

    public ThreadRecord withAssets(List<AssetRecord> assets) {
        return new ThreadRecord(threadId, title, url, author, postDate, posts, replies, views, assets,
                schemaVersion, scrapedAt);
    }
}
