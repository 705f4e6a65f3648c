package org.netpreserve.forumminer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.Test;
import org.netpreserve.forumminer.UrlMatcher;
import org.netpreserve.forumminer.util.Url;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class JobConfigTest {
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory()).findAndRegisterModules();

    @Test
    public void test() throws IOException {
        var jobConfig = mapper.readValue(getClass().getResource("example.yaml"), JobConfig.class);

        var forum = jobConfig.forum();
        assertEquals(new Url("https://forum.example.com/forum/board/7-macros/"), forum.boardUrl());
        assertEquals(List.of(new UrlMatcher.Host("forum.example.com"), new UrlMatcher.Domain("example-cdn.net")),
                forum.allowedHosts());
        assertEquals(List.of(".xml"), forum.attachmentExtensions());
        assertEquals(List.of(new Url("https://forum.example.com/forum/thread/42-pinned/")), forum.extraThreads());

        var fetch = jobConfig.fetch();
        assertEquals("test-agent", fetch.userAgent());
        assertEquals(Map.of(), fetch.headers());
        assertEquals(Duration.ofSeconds(5), fetch.timeout());
        assertEquals(Duration.ofMillis(1500), fetch.connectTimeout());
        assertEquals(Duration.ofMillis(1500), fetch.initialBackoff());
        assertEquals(Duration.ofMinutes(1), fetch.maxBackoff());
        assertEquals(Set.of(429, 500, 502, 503, 504), fetch.retryableStatuses());
        assertEquals(512 * 1024L, fetch.maxDownloadSize());

        assertEquals(Duration.ofSeconds(2), jobConfig.throttle().initialBackoff());
        assertEquals(0.0, jobConfig.throttle().jitter());
        assertEquals(10, jobConfig.crawl().maxThreads());
        assertFalse(jobConfig.crawl().refetchUpdated());
        assertEquals(Path.of("state.json"), jobConfig.storage().stateFile());
    }

    @Test
    public void testDefaults() throws IOException {
        var jobConfig = mapper.readValue(JobConfig.class.getResource("defaults.yaml"), JobConfig.class);
        assertEquals(8, jobConfig.fetch().maxConcurrent());
        assertEquals(5, jobConfig.fetch().maxAttempts());
        assertEquals(Duration.ofSeconds(2), jobConfig.fetch().initialBackoff());
        assertEquals(0.67, jobConfig.throttle().tokensPerSecond());
        assertEquals(List.of(".xml", ".zip", ".gz", ".show"), jobConfig.forum().attachmentExtensions());
        assertNull(jobConfig.crawl().maxThreads());
        assertEquals(50L * 1024 * 1024, jobConfig.fetch().maxDownloadSize());
    }
}
