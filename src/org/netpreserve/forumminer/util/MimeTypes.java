package org.netpreserve.forumminer.util;

import org.jetbrains.annotations.Nullable;

import java.net.URLConnection;
import java.util.Locale;
import java.util.Map;

public final class MimeTypes {
    public static final String DEFAULT = "application/octet-stream";
    private static final Map<String, String> EXTRA = Map.of(
            "xml", "application/xml",
            "zip", "application/zip",
            "gz", "application/gzip",
            "show", "application/octet-stream");

    private MimeTypes() {
    }

    /**
     * The server's media type if it sent a specific one, otherwise a guess from the filename extension.
     */
    public static String infer(String filename, @Nullable String serverType) {
        if (serverType != null && !serverType.isBlank() && !serverType.equalsIgnoreCase(DEFAULT)) {
            return serverType;
        }
        int dot = filename.lastIndexOf('.');
        if (dot != -1) {
            String known = EXTRA.get(filename.substring(dot + 1).toLowerCase(Locale.ROOT));
            if (known != null) return known;
        }
        String guessed = URLConnection.getFileNameMap().getContentTypeFor(filename);
        if (guessed != null) return guessed;
        return serverType != null && !serverType.isBlank() ? serverType : DEFAULT;
    }
}
