package org.netpreserve.forumminer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.forumminer.util.Url;

import java.util.Locale;

/**
 * A file attached to a post. Download fields are null until the file has been fetched.
 */
public record AssetRecord(
        @JsonProperty("filename") String filename,
        @JsonProperty("url") Url url,
        @JsonProperty("size") @Nullable Long size,
        @JsonProperty("download_count") @Nullable Integer downloadCount,
        @JsonProperty("checksum") @Nullable String checksum,
        @JsonProperty("post_number") @Nullable Integer postNumber,
        @JsonProperty("mime_type") @Nullable String mimeType,
        @JsonProperty("etag") @Nullable String etag,
        @JsonProperty("last_modified") @Nullable String lastModified
) {
    public AssetRecord(String filename, Url url, @Nullable Integer downloadCount, @Nullable Integer postNumber) {
        this(filename, url, null, downloadCount, null, postNumber, null, null, null);
    }

    /**
     * Lowercase extension including the dot, or an empty string when the filename has none.
     */
    @JsonProperty(value = "file_type", access = JsonProperty.Access.READ_ONLY)
    public String fileType() {
        return extension(filename);
    }

    public static String extension(String filename) {
        if (filename == null) return "";
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        int dot = filename.lastIndexOf('.');
        if (dot <= slash + 1 || dot == filename.length() - 1) return "";
        return filename.substring(dot).toLowerCase(Locale.ROOT);
    }

    public AssetRecord withFilename(String filename) {
        return new AssetRecord(filename, url, size, downloadCount, checksum, postNumber, mimeType, etag, lastModified);
    }

    public AssetRecord withContent(long size, String checksum, @Nullable String mimeType, @Nullable String etag,
                                   @Nullable String lastModified) {
        return new AssetRecord(filename, url, size, downloadCount, checksum, postNumber, mimeType, etag, lastModified);
    }
}
