package org.netpreserve.forumminer.fetch;

import org.netpreserve.forumminer.UrlMatcher;
import org.netpreserve.forumminer.config.FetchConfig;
import org.netpreserve.forumminer.util.Fingerprints;
import org.netpreserve.forumminer.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.concurrent.Semaphore;

/**
 * Sends HTTP requests to the forum. A single semaphore bounds how many requests are in flight at once across all
 * callers, every attempt is paced by the {@link AdaptiveThrottler} and transient failures are retried with
 * exponential backoff. Redirects are followed here rather than by the HTTP client so that every hop is checked
 * against the allow-list.
 * <p>
 * The request slot is only held while a request is in flight. Throttle waits and retry backoff happen without it.
 */
public class Fetcher {
    private static final Logger log = LoggerFactory.getLogger(Fetcher.class);
    private final FetchConfig config;
    private final UrlMatcher allowList;
    private final AdaptiveThrottler throttler;
    private final ResponseTelemetry telemetry;
    private final Sleeper sleeper;
    private final HttpClient httpClient;
    private final Semaphore slots;

    public Fetcher(FetchConfig config, UrlMatcher allowList, AdaptiveThrottler throttler,
                   ResponseTelemetry telemetry, Sleeper sleeper) {
        this.config = config;
        this.allowList = allowList;
        this.throttler = throttler;
        this.telemetry = telemetry;
        this.sleeper = sleeper;
        this.httpClient = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(config.connectTimeout())
                .build();
        this.slots = new Semaphore(config.maxConcurrent(), true);
    }

    /**
     * GETs a URL and returns the whole response body.
     */
    public FetchResponse fetch(Url url) throws FetchException, InterruptedException {
        try {
            return execute(url, "GET", Long.MAX_VALUE);
        } catch (DownloadTooLargeException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * GETs a URL and decodes the body using the charset from its Content-Type (UTF-8 when absent).
     */
    public String fetchText(Url url) throws FetchException, InterruptedException {
        return fetch(url).text();
    }

    /**
     * GETs a URL, aborting once the body is known to exceed {@code maxBytes}. The partial body is discarded.
     */
    public FetchResponse download(Url url, long maxBytes) throws FetchException, DownloadTooLargeException,
            InterruptedException {
        return execute(url, "GET", maxBytes);
    }

    /**
     * Sends a HEAD request, used to read validators (ETag, Last-Modified) without transferring the body.
     */
    public FetchResponse head(Url url) throws FetchException, InterruptedException {
        try {
            return execute(url, "HEAD", Long.MAX_VALUE);
        } catch (DownloadTooLargeException e) {
            throw new IllegalStateException(e);
        }
    }

    public ResponseTelemetry telemetry() {
        return telemetry;
    }

    int availableSlots() {
        return slots.availablePermits();
    }

    private FetchResponse execute(Url url, String method, long maxBytes) throws FetchException,
            DownloadTooLargeException, InterruptedException {
        url = url.withoutFragment();
        if (!allowList.test(url)) {
            log.atWarn().addKeyValue("url", url).log("Blocked URL not on the allow-list");
            telemetry.recordFailure("Blocked");
            throw FetchException.blocked(url);
        }

        int maxAttempts = Math.max(1, config.maxAttempts());
        String lastReason = null;
        Exception lastError = null;
        int lastStatus = 0;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            for (Duration wait = throttler.acquire(); !wait.isZero(); wait = throttler.acquire()) {
                log.trace("Throttled for {}", wait);
                sleeper.sleep(wait);
            }

            Attempt result;
            slots.acquire();
            try {
                result = attempt(url, method, maxBytes);
            } catch (IOException e) {
                result = null;
                lastError = e;
                lastStatus = 0;
                lastReason = e.getClass().getSimpleName();
            } finally {
                slots.release();
            }

            if (result != null) {
                int status = result.status();
                if (status >= 200 && status < 300) {
                    throttler.reportSuccess();
                    return result.response();
                }
                if (!config.retryableStatuses().contains(status)) {
                    log.atWarn().addKeyValue("url", url).addKeyValue("status", status).log("Fetch failed");
                    telemetry.recordFailure("HTTP " + status);
                    throw FetchException.http(result.url(), status);
                }
                if (status == 429) {
                    throttler.reportRateLimit();
                } else if (status >= 500) {
                    throttler.reportServiceUnavailable();
                }
                lastError = null;
                lastStatus = status;
                lastReason = "HTTP " + status;
            }

            if (attempt < maxAttempts) {
                Duration backoff = backoff(attempt);
                log.atWarn().addKeyValue("url", url).addKeyValue("attempt", attempt)
                        .addKeyValue("reason", lastReason)
                        .log("Retrying in {}", backoff);
                sleeper.sleep(backoff);
            }
        }

        log.atError().addKeyValue("url", url).addKeyValue("attempts", maxAttempts)
                .addKeyValue("reason", lastReason).log("Giving up");
        telemetry.recordRetryExhausted(lastReason);
        throw FetchException.exhausted(url, lastStatus, lastReason, lastError);
    }

    /**
     * Retry sleep after the given (1-based) failed attempt: the initial backoff doubled per earlier retry, capped.
     */
    Duration backoff(int attempt) {
        Duration backoff = config.initialBackoff();
        for (int i = 1; i < attempt && backoff.compareTo(config.maxBackoff()) < 0; i++) {
            backoff = backoff.multipliedBy(2);
        }
        return backoff.compareTo(config.maxBackoff()) > 0 ? config.maxBackoff() : backoff;
    }

    private record Attempt(int status, Url url, FetchResponse response) {
    }

    /**
     * A single attempt including any redirect hops. A non-2xx result has no response.
     */
    private Attempt attempt(Url url, String method, long maxBytes) throws IOException, InterruptedException,
            FetchException, DownloadTooLargeException {
        Url current = url;
        for (int hop = 0; ; hop++) {
            HttpResponse<InputStream> response = send(current, method);
            int status = response.statusCode();
            telemetry.recordResponse(status);
            log.atDebug().addKeyValue("url", current).addKeyValue("status", status).log("{} {}", method, status);

            String location = response.headers().firstValue("Location").orElse(null);
            if (status >= 300 && status < 400 && location != null && status != 304) {
                response.body().close();
                if (hop >= config.maxRedirects()) {
                    return new Attempt(status, current, null);
                }
                Url target = current.resolve(location);
                if (target == null) {
                    return new Attempt(status, current, null);
                }
                target = target.withoutFragment();
                if (!allowList.test(target)) {
                    log.atWarn().addKeyValue("url", current).addKeyValue("location", target)
                            .log("Blocked redirect off the allow-list");
                    telemetry.recordFailure("Blocked");
                    throw FetchException.blocked(target);
                }
                current = target;
                continue;
            }

            if (status < 200 || status >= 300) {
                response.body().close();
                return new Attempt(status, current, null);
            }

            var digest = Fingerprints.newDigest();
            byte[] body = readBody(current, response, digest, maxBytes);
            var fetchResponse = new FetchResponse(status, current, response.headers(), body,
                    Fingerprints.format(digest));
            return new Attempt(status, current, fetchResponse);
        }
    }

    private HttpResponse<InputStream> send(Url url, String method) throws IOException, InterruptedException {
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder(url.toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new IOException("Invalid URL: " + url, e);
        }
        builder.timeout(config.timeout())
                .method(method, HttpRequest.BodyPublishers.noBody())
                .header("User-Agent", config.userAgent());
        config.headers().forEach(builder::header);
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
    }

    private static byte[] readBody(Url url, HttpResponse<InputStream> response, MessageDigest digest,
                                   long maxBytes) throws IOException, DownloadTooLargeException {
        try (InputStream stream = response.body()) {
            long declaredLength = response.headers().firstValueAsLong("Content-Length").orElse(-1);
            if (declaredLength > maxBytes) {
                throw new DownloadTooLargeException(url, maxBytes);
            }
            var buffer = new ByteArrayOutputStream(declaredLength > 0 && declaredLength < 1 << 20 ?
                    (int) declaredLength : 8192);
            byte[] chunk = new byte[8192];
            long total = 0;
            while (true) {
                int n = stream.read(chunk);
                if (n == -1) break;
                total += n;
                if (total > maxBytes) {
                    throw new DownloadTooLargeException(url, maxBytes);
                }
                digest.update(chunk, 0, n);
                buffer.write(chunk, 0, n);
            }
            return buffer.toByteArray();
        }
    }
}
