package org.netpreserve.forumminer.fetch;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.netpreserve.forumminer.UrlMatcher;
import org.netpreserve.forumminer.config.FetchConfig;
import org.netpreserve.forumminer.config.ThrottleConfig;
import org.netpreserve.forumminer.util.Fingerprints;
import org.netpreserve.forumminer.util.MutableClock;
import org.netpreserve.forumminer.util.Url;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FetcherTest {
    private final MutableClock clock = new MutableClock();
    private final List<Duration> sleeps = Collections.synchronizedList(new ArrayList<>());
    private final List<Boolean> coolOffDuringSleep = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger hits = new AtomicInteger();
    private HttpServer httpServer;
    private ExecutorService serverExecutor;
    private String base;
    private AdaptiveThrottler throttler;

    @BeforeEach
    public void startServer() throws IOException {
        httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverExecutor = Executors.newCachedThreadPool();
        httpServer.setExecutor(serverExecutor);
        httpServer.start();
        base = "http://127.0.0.1:" + httpServer.getAddress().getPort();
    }

    @AfterEach
    public void stopServer() {
        httpServer.stop(0);
        serverExecutor.shutdownNow();
    }

    private Fetcher fetcher(int maxAttempts, int maxConcurrent) {
        var fetchConfig = new FetchConfig("forumminer-test", Map.of("Accept-Language", "en"), maxConcurrent,
                Duration.ofSeconds(5), Duration.ofSeconds(2), maxAttempts, Duration.ofSeconds(2),
                Duration.ofSeconds(60), null, 5, null);
        var throttleConfig = new ThrottleConfig(1000.0, 8, 0.0, Duration.ofSeconds(2), Duration.ofSeconds(60));
        throttler = new AdaptiveThrottler(throttleConfig, clock, () -> 0.5);
        Sleeper sleeper = duration -> {
            sleeps.add(duration);
            coolOffDuringSleep.add(throttler.inCoolOff());
            clock.advance(duration);
        };
        var allowList = new UrlMatcher.Multi(List.of(new UrlMatcher.Host("127.0.0.1")));
        return new Fetcher(fetchConfig, allowList, throttler, new ResponseTelemetry(), sleeper);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "text/plain; charset=utf-8");
        if (exchange.getRequestMethod().equals("HEAD")) {
            exchange.sendResponseHeaders(status, -1);
        } else {
            exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
            exchange.getResponseBody().write(bytes);
        }
        exchange.close();
    }

    @Test
    public void retriesRateLimitWithIncreasingWaits() throws Exception {
        httpServer.createContext("/flaky", exchange -> {
            if (hits.incrementAndGet() <= 3) {
                respond(exchange, 429, "slow down");
            } else {
                respond(exchange, 200, "ok");
            }
        });
        var fetcher = fetcher(5, 2);

        FetchResponse response = fetcher.fetch(new Url(base + "/flaky"));

        assertEquals(200, response.status());
        assertEquals("ok", response.text());
        assertEquals(4, hits.get());
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8)), sleeps);
        assertEquals(List.of(true, true, true), coolOffDuringSleep);
        assertFalse(throttler.inCoolOff());
        assertEquals(3, fetcher.telemetry().statusCount(429));
        assertEquals(1, fetcher.telemetry().statusCount(200));
        assertEquals(0, fetcher.telemetry().retryExhausted());
        assertEquals(2, fetcher.availableSlots());
    }

    @Test
    public void givesUpAfterMaxAttempts() {
        httpServer.createContext("/down", exchange -> {
            hits.incrementAndGet();
            respond(exchange, 503, "maintenance");
        });
        var fetcher = fetcher(3, 2);

        var e = assertThrows(FetchException.class, () -> fetcher.fetch(new Url(base + "/down")));

        assertEquals(FetchException.Kind.EXHAUSTED, e.kind());
        assertEquals(503, e.status());
        assertEquals("HTTP 503", e.reason());
        assertEquals(3, hits.get());
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(4)), sleeps);
        assertEquals(1, fetcher.telemetry().retryExhausted());
        assertEquals(Map.of("HTTP 503", 1L), fetcher.telemetry().failureReasons());
    }

    @Test
    public void doesNotRetryClientErrors() {
        httpServer.createContext("/missing", exchange -> {
            hits.incrementAndGet();
            respond(exchange, 404, "not here");
        });
        var fetcher = fetcher(5, 2);

        var e = assertThrows(FetchException.class, () -> fetcher.fetch(new Url(base + "/missing")));

        assertEquals(FetchException.Kind.HTTP, e.kind());
        assertEquals(404, e.status());
        assertEquals(1, hits.get());
        assertTrue(sleeps.isEmpty());
        assertEquals(Map.of("HTTP 404", 1L), fetcher.telemetry().failureReasons());
    }

    @Test
    public void blocksUrlsOffTheAllowList() {
        var fetcher = fetcher(5, 2);

        var e = assertThrows(FetchException.class, () -> fetcher.fetch(new Url("http://localhost:1/")));

        assertEquals(FetchException.Kind.BLOCKED, e.kind());
        assertEquals(0, fetcher.telemetry().total());
        assertEquals(Map.of("Blocked", 1L), fetcher.telemetry().failureReasons());
    }

    @Test
    public void followsRedirectsOnTheAllowList() throws Exception {
        httpServer.createContext("/moved", exchange -> {
            exchange.getResponseHeaders().add("Location", "/target#frag");
            exchange.sendResponseHeaders(301, -1);
            exchange.close();
        });
        httpServer.createContext("/target", exchange -> respond(exchange, 200, "arrived"));
        var fetcher = fetcher(5, 2);

        FetchResponse response = fetcher.fetch(new Url(base + "/moved"));

        assertEquals("arrived", response.text());
        assertEquals(new Url(base + "/target"), response.url());
        assertEquals(1, fetcher.telemetry().count(ResponseTelemetry.Category.REDIRECT));
    }

    @Test
    public void blocksRedirectsOffTheAllowList() {
        httpServer.createContext("/away", exchange -> {
            exchange.getResponseHeaders().add("Location", "http://tracker.example.net/collect");
            exchange.sendResponseHeaders(302, -1);
            exchange.close();
        });
        var fetcher = fetcher(5, 2);

        var e = assertThrows(FetchException.class, () -> fetcher.fetch(new Url(base + "/away")));

        assertEquals(FetchException.Kind.BLOCKED, e.kind());
        assertEquals(new Url("http://tracker.example.net/collect"), e.url());
    }

    @Test
    public void downloadComputesChecksum() throws Exception {
        httpServer.createContext("/macro.xml", exchange -> {
            exchange.getResponseHeaders().add("ETag", "\"v1\"");
            exchange.getResponseHeaders().add("Content-Type", "application/xml");
            byte[] body = "<macro/>".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            exchange.getResponseBody().write(body);
            exchange.close();
        });
        var fetcher = fetcher(5, 2);

        FetchResponse response = fetcher.download(new Url(base + "/macro.xml"), 1024);

        assertArrayEquals("<macro/>".getBytes(StandardCharsets.UTF_8), response.body());
        assertEquals(Fingerprints.of("<macro/>".getBytes(StandardCharsets.UTF_8)), response.checksum());
        assertEquals("\"v1\"", response.header("ETag"));
        assertEquals("application/xml", response.mimeType());
    }

    @Test
    public void headReturnsValidatorsWithoutBody() throws Exception {
        httpServer.createContext("/file.zip", exchange -> {
            assertEquals("HEAD", exchange.getRequestMethod());
            exchange.getResponseHeaders().add("ETag", "\"abc\"");
            exchange.getResponseHeaders().add("Last-Modified", "Wed, 01 May 2024 10:00:00 GMT");
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        var fetcher = fetcher(5, 2);

        FetchResponse response = fetcher.head(new Url(base + "/file.zip"));

        assertEquals("\"abc\"", response.header("ETag"));
        assertEquals("Wed, 01 May 2024 10:00:00 GMT", response.header("Last-Modified"));
        assertEquals(0, response.body().length);
    }

    @Test
    public void fetchTextDecodesDeclaredCharset() throws Exception {
        httpServer.createContext("/latin1", exchange -> {
            byte[] bytes = "Grüße".getBytes(StandardCharsets.ISO_8859_1);
            exchange.getResponseHeaders().add("Content-Type", "text/html; charset=ISO-8859-1");
            exchange.sendResponseHeaders(200, bytes.length);
            exchange.getResponseBody().write(bytes);
            exchange.close();
        });
        httpServer.createContext("/utf8", exchange -> {
            byte[] bytes = "Grüße".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            exchange.getResponseBody().write(bytes);
            exchange.close();
        });
        var fetcher = fetcher(1, 2);

        assertEquals("Grüße", fetcher.fetchText(new Url(base + "/latin1")));
        assertEquals("Grüße", fetcher.fetchText(new Url(base + "/utf8")));
    }

    @Test
    public void refusesOversizedDownloads() {
        byte[] big = new byte[4096];
        httpServer.createContext("/declared", exchange -> {
            exchange.sendResponseHeaders(200, big.length);
            exchange.getResponseBody().write(big);
            exchange.close();
        });
        httpServer.createContext("/chunked", exchange -> {
            exchange.sendResponseHeaders(200, 0);
            exchange.getResponseBody().write(big);
            exchange.close();
        });
        var fetcher = fetcher(5, 2);

        var declared = assertThrows(DownloadTooLargeException.class,
                () -> fetcher.download(new Url(base + "/declared"), 1000));
        assertEquals(1000, declared.limit());
        assertEquals("Too large", declared.reason());
        assertThrows(DownloadTooLargeException.class, () -> fetcher.download(new Url(base + "/chunked"), 1000));
        assertEquals(2, fetcher.availableSlots());
    }

    @Test
    public void retriesConnectionFailures() throws IOException {
        var closed = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        int port = closed.getAddress().getPort();
        closed.stop(0);
        var fetcher = fetcher(2, 2);

        var e = assertThrows(FetchException.class, () -> fetcher.fetch(new Url("http://127.0.0.1:" + port + "/")));

        assertEquals(FetchException.Kind.EXHAUSTED, e.kind());
        assertEquals(0, e.status());
        assertInstanceOf(IOException.class, e.getCause());
        assertEquals(List.of(Duration.ofSeconds(2)), sleeps);
    }

    @Test
    public void boundsConcurrentRequests() throws Exception {
        var inFlight = new AtomicInteger();
        var maxInFlight = new AtomicInteger();
        httpServer.createContext("/slow", exchange -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inFlight.decrementAndGet();
            respond(exchange, 200, "done");
        });
        var fetcher = fetcher(5, 2);

        ExecutorService callers = Executors.newFixedThreadPool(6);
        try {
            var futures = new ArrayList<Future<FetchResponse>>();
            for (int i = 0; i < 6; i++) {
                Url url = new Url(base + "/slow?n=" + i);
                futures.add(callers.submit(() -> fetcher.fetch(url)));
            }
            for (var future : futures) {
                assertEquals("done", future.get().text());
            }
        } finally {
            callers.shutdownNow();
        }

        assertTrue(maxInFlight.get() <= 2, "at most 2 requests in flight, saw " + maxInFlight.get());
        assertEquals(2, fetcher.availableSlots());
    }

    @Test
    public void backoffDoublesUpToMax() {
        var fetcher = fetcher(10, 2);
        assertEquals(Duration.ofSeconds(2), fetcher.backoff(1));
        assertEquals(Duration.ofSeconds(4), fetcher.backoff(2));
        assertEquals(Duration.ofSeconds(32), fetcher.backoff(5));
        assertEquals(Duration.ofSeconds(60), fetcher.backoff(6));
        assertEquals(Duration.ofSeconds(60), fetcher.backoff(30));
    }
}
