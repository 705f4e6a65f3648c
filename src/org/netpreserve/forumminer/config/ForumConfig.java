package org.netpreserve.forumminer.config;

import org.netpreserve.forumminer.UrlMatcher;
import org.netpreserve.forumminer.util.Url;

import java.util.List;

/**
 * The forum being harvested.
 *
 * @param boardUrl             first page of the board whose threads are harvested
 * @param allowedHosts         hosts requests may be sent to, applied to every URL and redirect
 * @param attachmentExtensions attachment filename extensions worth downloading (empty means all)
 * @param probePages           pages to try when the board's page count can't be detected
 * @param extraThreads         thread URLs always included in discovery
 */
public record ForumConfig(
        Url boardUrl,
        List<UrlMatcher> allowedHosts,
        List<String> attachmentExtensions,
        int probePages,
        List<Url> extraThreads
) {
    public ForumConfig {
        if (allowedHosts == null) allowedHosts = List.of();
        if (attachmentExtensions == null) attachmentExtensions = List.of();
        if (extraThreads == null) extraThreads = List.of();
    }
}
