package org.netpreserve.forumminer;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.forumminer.config.CrawlConfig;
import org.netpreserve.forumminer.config.FetchConfig;
import org.netpreserve.forumminer.config.ForumConfig;
import org.netpreserve.forumminer.config.JobConfig;
import org.netpreserve.forumminer.config.StorageConfig;
import org.netpreserve.forumminer.config.ThrottleConfig;
import org.netpreserve.forumminer.extract.ThreadLink;
import org.netpreserve.forumminer.fetch.Sleeper;
import org.netpreserve.forumminer.util.Fingerprints;
import org.netpreserve.forumminer.util.Url;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.netpreserve.forumminer.util.Json.JSON;

class CrawlTest {
    private static final byte[] MACRO = "<MA><Macro name=\"chase\"/></MA>".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path tempDir;

    private HttpServer httpServer;
    private ExecutorService serverExecutor;
    private String base;
    private volatile boolean updated;
    private volatile boolean paginated = true;
    private volatile boolean replyPageMissing;
    private final Map<String, AtomicInteger> requests = new ConcurrentHashMap<>();

    @BeforeEach
    public void startForum() throws IOException {
        httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverExecutor = Executors.newCachedThreadPool();
        httpServer.setExecutor(serverExecutor);
        httpServer.createContext("/", this::handle);
        httpServer.start();
        base = "http://127.0.0.1:" + httpServer.getAddress().getPort();
    }

    @AfterEach
    public void stopForum() {
        httpServer.stop(0);
        serverExecutor.shutdownNow();
    }

    private JobConfig config(Integer maxThreads) {
        return new JobConfig(
                new ForumConfig(new Url(base + "/forum/board/35-macros/"), List.of(new UrlMatcher.Host("127.0.0.1")),
                        List.of(".xml", ".zip"), 3, List.of()),
                new FetchConfig("forumminer-test", Map.of(), 4, Duration.ofSeconds(5), Duration.ofSeconds(2), 2,
                        Duration.ofMillis(1), Duration.ofMillis(5), null, 5, 1024L),
                new ThrottleConfig(1000.0, 100, 0.0, Duration.ofMillis(1), Duration.ofMillis(5)),
                new CrawlConfig(2, true, maxThreads),
                new StorageConfig(tempDir.resolve("threads"), tempDir.resolve("scraper_state.json"),
                        tempDir.resolve("manifest.json")));
    }

    private CrawlSummary run(JobConfig config) throws Exception {
        try (var crawl = new Crawl(config, Sleeper.SYSTEM, Clock.systemUTC())) {
            CrawlSummary summary = crawl.run();
            assertEquals(Crawl.Phase.DONE, crawl.phase());
            return summary;
        }
    }

    @Test
    public void harvestsIncrementally() throws Exception {
        CrawlSummary first = run(config(null));

        assertEquals(3, first.discovered());
        assertEquals(3, first.queued());
        assertEquals(2, first.succeeded());
        assertEquals(1, first.failed());
        assertEquals(Map.of("HTTP 404", 1), first.failureReasons());
        assertEquals(4, first.postsNew());
        assertEquals(1, first.assetsDownloaded());
        assertEquals(1, first.assetsFailed(), "big.zip is over the size limit");

        Path chaseDir = tempDir.resolve("threads/mixed/2023/2023-04-05/thread_101_Color_chase");
        assertArrayEquals(MACRO, Files.readAllBytes(chaseDir.resolve("chase.xml")));
        assertFalse(Files.exists(chaseDir.resolve("big.zip")));
        JsonNode metadata = JSON.readTree(chaseDir.resolve("metadata.json").toFile());
        assertEquals("101", metadata.get("thread_id").asText());
        assertEquals("Color chase", metadata.get("title").asText());
        assertEquals("alice", metadata.get("author").asText());
        assertEquals(2, metadata.get("replies").asInt());
        assertEquals(3, metadata.get("posts").size());
        assertEquals("101-3", metadata.get("posts").get(2).get("post_id").asText());
        assertEquals("carol", metadata.get("posts").get(2).get("author").asText());
        JsonNode xml = metadata.get("assets").get(0);
        assertEquals("chase.xml", xml.get("filename").asText());
        assertEquals(Fingerprints.of(MACRO), xml.get("checksum").asText());
        assertEquals("\"v1\"", xml.get("etag").asText());
        assertEquals(1, xml.get("post_number").asInt());
        JsonNode zip = metadata.get("assets").get(1);
        assertEquals("big.zip", zip.get("filename").asText());
        assertTrue(zip.get("checksum") == null || zip.get("checksum").isNull());
        assertEquals(3, zip.get("post_number").asInt());

        assertTrue(Files.exists(tempDir.resolve("threads/no_assets/2023/2023-05-01/thread_103_Empty_thread/metadata.json")));
        JsonNode index = JSON.readTree(tempDir.resolve("threads/asset_type_index.json").toFile());
        assertEquals("101", index.get("by_type").get(".xml").get(0).get("thread_id").asText());
        assertEquals("101", index.get("multi_type_threads").get(0).get("thread_id").asText());

        // nothing changed: only the thread that failed is tried again
        CrawlSummary second = run(config(null));
        assertEquals(3, second.discovered());
        assertEquals(1, second.queued());
        assertEquals(0, second.succeeded());
        assertEquals(1, second.failed());
        assertEquals(1, count("GET /forum/thread/101-color-chase/"));
        assertEquals(1, count("GET /files/chase.xml"));

        // a new reply and an edited post
        updated = true;
        CrawlSummary third = run(config(null));
        assertEquals(2, third.queued());
        assertEquals(1, third.succeeded());
        assertEquals(1, third.postsNew());
        assertEquals(1, third.postsEdited());
        assertEquals(1, third.assetsSkipped(), "chase.xml ETag unchanged");
        assertEquals(0, third.assetsDownloaded());
        assertEquals(1, count("GET /files/chase.xml"));
        assertEquals(1, count("HEAD /files/chase.xml"));

        metadata = JSON.readTree(chaseDir.resolve("metadata.json").toFile());
        assertEquals(4, metadata.get("posts").size());
        assertEquals(3, metadata.get("replies").asInt());
        assertEquals(Fingerprints.of(MACRO), metadata.get("assets").get(0).get("checksum").asText());

        JsonNode state = JSON.readTree(tempDir.resolve("scraper_state.json").toFile());
        assertEquals(3, state.get("threads").get("101").get("reply_count_seen").asInt());
        assertEquals("mixed/2023/2023-04-05/thread_101_Color_chase",
                state.get("threads").get("101").get("output_dir").asText());
        assertTrue(state.get("posts").get("101-1").hasNonNull("edited_at"));
        assertFalse(state.get("threads").has("102"));
    }

    @Test
    public void diffQueuesNewAndUpdatedThreads() throws Exception {
        try (var crawl = new Crawl(config(null), Sleeper.SYSTEM, Clock.systemUTC())) {
            crawl.run();
        }
        try (var crawl = new Crawl(config(null), Sleeper.SYSTEM, Clock.systemUTC())) {
            var chase = new Url(base + "/forum/thread/101-color-chase/");
            var fresh = new Url(base + "/forum/thread/555-brand-new/");
            List<ThreadLink> queue = crawl.diff(List.of(
                    new ThreadLink(chase, 2, 99),
                    new ThreadLink(new Url(chase + "#post3"), 2, 10),
                    new ThreadLink(new Url(base + "/forum/thread/103-renamed/"), 1, 3),
                    new ThreadLink(fresh),
                    new ThreadLink(fresh)));
            assertEquals(List.of(new Url(base + "/forum/thread/103-renamed/"), fresh),
                    queue.stream().map(ThreadLink::url).toList());
        }
    }

    @Test
    public void maxThreadsLimitsTheRun() throws Exception {
        CrawlSummary summary = run(config(1));
        assertEquals(3, summary.discovered());
        assertEquals(1, summary.queued());
    }

    @Test
    public void discoveryProbesWhenPaginationIsMissing() throws Exception {
        paginated = false;
        try (var crawl = new Crawl(config(null), Sleeper.SYSTEM, Clock.systemUTC())) {
            Set<Url> urls = Set.copyOf(crawl.discover().stream().map(ThreadLink::url).toList());
            assertEquals(Set.of(new Url(base + "/forum/thread/101-color-chase/"),
                    new Url(base + "/forum/thread/102-gone/"),
                    new Url(base + "/forum/thread/103-empty-thread/")), urls);
        }
        assertEquals(1, count("GET /forum/board/35-macros/?pageNo=3"), "probed up to probePages");
    }

    @Test
    public void failedReplyPageFailsTheWholeThread() throws Exception {
        replyPageMissing = true;
        CrawlSummary first = run(config(null));

        assertEquals(1, first.succeeded());
        assertEquals(2, first.failed());
        assertEquals(Map.of("HTTP 404", 2), first.failureReasons());
        assertFalse(Files.exists(tempDir.resolve("threads/mixed")), "no folder for the incomplete thread");
        assertEquals(0, count("GET /files/chase.xml"));
        JsonNode state = JSON.readTree(tempDir.resolve("scraper_state.json").toFile());
        assertFalse(state.get("threads").has("101"));
        assertFalse(state.get("posts").has("101-1"));

        replyPageMissing = false;
        CrawlSummary second = run(config(null));
        assertEquals(2, second.queued());
        assertEquals(1, second.succeeded());
        JsonNode metadata = JSON.readTree(tempDir.resolve(
                "threads/mixed/2023/2023-04-05/thread_101_Color_chase/metadata.json").toFile());
        assertEquals(3, metadata.get("posts").size());
        assertEquals("carol", metadata.get("posts").get(2).get("author").asText());
    }

    @Test
    public void migratedThreadsAreNotRefetched() throws Exception {
        Files.writeString(tempDir.resolve("manifest.json"), "[\"" + base + "/forum/thread/101-color-chase/\"]");

        CrawlSummary first = run(config(null));
        assertEquals(2, first.queued(), "only 102 and 103 are new");
        assertEquals(0, count("GET /forum/thread/101-color-chase/"));
        JsonNode state = JSON.readTree(tempDir.resolve("scraper_state.json").toFile());
        assertEquals(2, state.get("threads").get("101").get("reply_count_seen").asInt());
        assertFalse(state.get("threads").get("101").get("migrated").asBoolean());

        updated = true;
        CrawlSummary second = run(config(null));
        assertEquals(2, second.queued(), "101 has a new reply, 102 failed before");
        assertEquals(1, count("GET /forum/thread/101-color-chase/"));
    }

    @Test
    public void boardFailureAbortsTheRun() {
        var config = config(null);
        var broken = new JobConfig(new ForumConfig(new Url(base + "/forum/board/404-missing/"),
                config.forum().allowedHosts(), config.forum().attachmentExtensions(), 1, List.of()),
                config.fetch(), config.throttle(), config.crawl(), config.storage());
        try (var crawl = new Crawl(broken, Sleeper.SYSTEM, Clock.systemUTC())) {
            var e = assertThrows(CrawlException.class, crawl::run);
            assertEquals("HTTP 404", e.reason());
        }
    }

    private int count(String request) {
        AtomicInteger counter = requests.get(request);
        return counter == null ? 0 : counter.get();
    }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String query = exchange.getRequestURI().getQuery();
        String method = exchange.getRequestMethod();
        requests.computeIfAbsent(method + " " + path + (query == null ? "" : "?" + query),
                k -> new AtomicInteger()).incrementAndGet();
        boolean page2 = "pageNo=2".equals(query);

        switch (path) {
            case "/forum/board/35-macros/" -> {
                if (query == null) {
                    html(exchange, boardPage1());
                } else if (page2) {
                    html(exchange, """
                            <ul><li class="wbbThread"><a class="wbbTopicLink" href="/forum/thread/103-empty-thread/">Empty</a>
                            <div class="stats">0 Replies 3 Views</div></li></ul>
                            """);
                } else {
                    send(exchange, 404, "text/html", new byte[0]);
                }
            }
            case "/forum/thread/101-color-chase/" -> {
                if (page2 && replyPageMissing) {
                    send(exchange, 404, "text/html", new byte[0]);
                } else {
                    html(exchange, page2 ? chasePage2() : chasePage1());
                }
            }
            case "/forum/thread/103-empty-thread/" -> html(exchange, """
                    <h1 class="topic-title">Empty thread</h1>
                    <article class="message"><div class="username">erin</div>
                    <time datetime="2023-05-01T08:00:00Z"></time><div class="messageContent">Anyone?</div></article>
                    """);
            case "/files/chase.xml" -> {
                exchange.getResponseHeaders().add("ETag", "\"v1\"");
                send(exchange, 200, "application/xml", MACRO);
            }
            case "/files/big.zip" -> send(exchange, 200, "application/zip", new byte[2048]);
            default -> send(exchange, 404, "text/html", "<h1>Not found</h1>".getBytes(StandardCharsets.UTF_8));
        }
    }

    private String boardPage1() {
        return """
                <ul>
                <li class="wbbThread"><a class="wbbTopicLink" href="/forum/thread/101-color-chase/">Color chase</a>
                <div class="stats">%d Replies %d Views</div></li>
                <li class="wbbThread"><a class="wbbTopicLink" href="/forum/thread/102-gone/">Gone</a>
                <div class="stats">1 Replies 4 Views</div></li>
                </ul>
                %s
                """.formatted(updated ? 3 : 2, updated ? 15 : 10,
                paginated ? "<nav class=\"pageNavigation\"><a href=\"?pageNo=2\">2</a></nav>" : "");
    }

    private String chasePage1() {
        return """
                <h1 class="topic-title">Color chase</h1>
                <div class="stats"><dl><dt>Replies</dt><dd>%d</dd><dt>Views</dt><dd>%d</dd></dl></div>
                <article class="message"><div class="username">alice</div>
                <time datetime="2023-04-05T10:00:00+02:00"></time>
                <div class="messageContent">%s</div>
                <a class="messageAttachment" href="/files/chase.xml"><span class="messageAttachmentFilename">chase.xml</span></a>
                </article>
                <article class="message"><div class="username">bob</div>
                <time datetime="2023-04-05T11:00:00+02:00"></time><div class="messageContent">Nice</div></article>
                <nav class="pageNavigation"><a href="/forum/thread/101-color-chase/?pageNo=2">2</a></nav>
                """.formatted(updated ? 3 : 2, updated ? 15 : 10,
                updated ? "Macro attached (fixed timing)" : "Macro attached");
    }

    private String chasePage2() {
        String extra = updated ? """
                <article class="message"><div class="username">dave</div>
                <time datetime="2023-04-07T10:00:00+02:00"></time><div class="messageContent">Works great</div></article>
                """ : "";
        return """
                <h1 class="topic-title">Color chase</h1>
                <article class="message"><div class="username">carol</div>
                <time datetime="2023-04-06T10:00:00+02:00"></time>
                <div class="messageContent">Here is the whole show</div>
                <a class="messageAttachment" href="/files/big.zip"><span class="messageAttachmentFilename">big.zip</span></a>
                </article>
                %s
                <nav class="pageNavigation"><a href="/forum/thread/101-color-chase/?pageNo=2">2</a></nav>
                """.formatted(extra);
    }

    private static void html(HttpExchange exchange, String body) throws IOException {
        send(exchange, 200, "text/html; charset=utf-8",
                ("<!DOCTYPE html><html><body>" + body + "</body></html>").getBytes(StandardCharsets.UTF_8));
    }

    private static void send(HttpExchange exchange, int status, String contentType, byte[] body) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", contentType);
        if (exchange.getRequestMethod().equals("HEAD") || body.length == 0) {
            exchange.sendResponseHeaders(status, -1);
        } else {
            exchange.sendResponseHeaders(status, body.length);
            exchange.getResponseBody().write(body);
        }
        exchange.close();
    }
}
