package org.netpreserve.forumminer.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * URL type which caches parsing.
 */
public class Url {
    private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");
    private static final Pattern PAGE_NO_PARAM = Pattern.compile("([?&])pageNo=\\d+&?");
    private final String url;
    private URI uri;

    @JsonCreator
    public Url(String url) {
        this.url = url;
    }

    public static Url orNull(String url) {
        if (url == null) return null;
        return new Url(url);
    }

    public synchronized URI toURI() throws URISyntaxException {
        if (uri == null) {
            uri = new URI(url);
        }
        return uri;
    }

    /**
     * Returns the lowercase host or null if the URL can't be parsed or has no host.
     */
    public @Nullable String host() {
        try {
            String host = toURI().getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    public @Nullable String scheme() {
        try {
            return toURI().getScheme();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    public String path() {
        try {
            String path = toURI().getPath();
            return path == null ? "" : path;
        } catch (URISyntaxException e) {
            return "";
        }
    }

    public static String reverseHost(String host) {
        if (host == null) return null;
        if (host.startsWith("[")) return host;
        if (IPV4.matcher(host).matches()) return host;
        var builder = new StringBuilder();
        String[] segments = host.split("\\.");
        for (int i = segments.length - 1; i >= 0; i--) {
            builder.append(segments[i]);
            builder.append(",");
        }
        return builder.toString();
    }

    private static boolean startsWithIgnoreCase(String str, String prefix) {
        return str.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    public boolean isHttp() {
        return startsWithIgnoreCase(url, "http:") ||
               startsWithIgnoreCase(url, "https:");
    }

    public Url withoutFragment() {
        int i = url.indexOf('#');
        if (i == -1) {
            return this;
        }
        return new Url(url.substring(0, i));
    }

    /**
     * Resolves a (possibly relative) link against this URL. Returns null for links that can't be parsed.
     */
    public @Nullable Url resolve(String href) {
        if (href == null || href.isBlank()) return null;
        try {
            return new Url(toURI().resolve(href.strip()).toString());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Returns this URL with its {@code pageNo} query parameter replaced by the given page number.
     */
    public Url withPageNo(int page) {
        String base = withoutFragment().url;
        Matcher matcher = PAGE_NO_PARAM.matcher(base);
        if (matcher.find()) {
            String separator = matcher.group(1);
            String rest = base.substring(matcher.end());
            base = base.substring(0, matcher.start()) + (rest.isEmpty() ? "" : separator + rest);
        }
        return new Url(base + (base.contains("?") ? "&" : "?") + "pageNo=" + page);
    }

    /**
     * Returns the last non-empty path segment, or an empty string.
     */
    public String lastPathSegment() {
        String path = path();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        int i = path.lastIndexOf('/');
        return i == -1 ? path : path.substring(i + 1);
    }

    @JsonValue
    public String toString() {
        return url;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Url url1 = (Url) o;
        return url.equals(url1.url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }
}
