package org.netpreserve.forumminer;

import org.jetbrains.annotations.Nullable;
import org.jsoup.nodes.Document;
import org.netpreserve.forumminer.config.JobConfig;
import org.netpreserve.forumminer.extract.ForumExtractor;
import org.netpreserve.forumminer.extract.PageStats;
import org.netpreserve.forumminer.extract.ThreadLink;
import org.netpreserve.forumminer.fetch.AdaptiveThrottler;
import org.netpreserve.forumminer.fetch.DownloadTooLargeException;
import org.netpreserve.forumminer.fetch.FetchException;
import org.netpreserve.forumminer.fetch.FetchResponse;
import org.netpreserve.forumminer.fetch.Fetcher;
import org.netpreserve.forumminer.fetch.ResponseTelemetry;
import org.netpreserve.forumminer.fetch.Sleeper;
import org.netpreserve.forumminer.model.AssetRecord;
import org.netpreserve.forumminer.model.PostRecord;
import org.netpreserve.forumminer.model.ThreadRecord;
import org.netpreserve.forumminer.output.AssetTypeIndex;
import org.netpreserve.forumminer.output.OutputWriter;
import org.netpreserve.forumminer.state.AssetState;
import org.netpreserve.forumminer.state.StateStore;
import org.netpreserve.forumminer.state.ThreadState;
import org.netpreserve.forumminer.util.MimeTypes;
import org.netpreserve.forumminer.util.NamedThreadFactory;
import org.netpreserve.forumminer.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * One harvesting run over the forum. Discovers the board's threads, works out which are new or have new replies,
 * processes those on a pool of workers, and finally rebuilds the asset type index.
 * <p>
 * Each thread is checkpointed to the state file as soon as it completes, so an interrupted run loses at most the
 * threads in progress and the next run picks up where it stopped.
 */
public class Crawl implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Crawl.class);
    private final JobConfig config;
    private final Clock clock;
    private final Fetcher fetcher;
    private final ForumExtractor extractor;
    private final StateStore store;
    private final OutputWriter output;
    private final ExecutorService workers;
    private final ExecutorService io;
    private volatile Phase phase = Phase.IDLE;

    public enum Phase {
        IDLE, DISCOVER, DIFF, PROCESS, FINALIZE, DONE
    }

    public Crawl(JobConfig config) {
        this(config, Sleeper.SYSTEM, Clock.systemUTC());
    }

    public Crawl(JobConfig config, Sleeper sleeper, Clock clock) {
        this.config = config;
        this.clock = clock;
        var allowList = new UrlMatcher.Multi(config.forum().allowedHosts());
        if (allowList.isEmpty()) {
            allowList.add(new UrlMatcher.Host(config.forum().boardUrl().host()));
        }
        this.fetcher = new Fetcher(config.fetch(), allowList, new AdaptiveThrottler(config.throttle(), clock,
                Math::random), new ResponseTelemetry(), sleeper);
        this.extractor = new ForumExtractor(config.forum().attachmentExtensions());
        this.store = StateStore.open(config.storage().stateFile(), config.storage().legacyManifest(), clock);
        this.output = new OutputWriter(config.storage().outputDir());
        this.workers = Executors.newFixedThreadPool(Math.max(1, config.crawl().workers()),
                new NamedThreadFactory("worker"));
        this.io = Executors.newCachedThreadPool(new NamedThreadFactory("fetch"));
    }

    public Phase phase() {
        return phase;
    }

    public StateStore store() {
        return store;
    }

    public Fetcher fetcher() {
        return fetcher;
    }

    public CrawlSummary run() throws CrawlException, InterruptedException {
        phase = Phase.DISCOVER;
        List<ThreadLink> discovered = discover();
        log.info("Discovered {} threads", discovered.size());

        phase = Phase.DIFF;
        List<ThreadLink> queue = diff(discovered);
        log.info("Queued {} threads ({} already harvested)", queue.size(), store.threadCount());

        phase = Phase.PROCESS;
        var futures = new ArrayList<Future<ThreadOutcome>>();
        for (ThreadLink link : queue) {
            futures.add(workers.submit(() -> processThread(link)));
        }
        var outcomes = new ArrayList<ThreadOutcome>();
        try {
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), queue.get(i)));
                if ((i + 1) % 10 == 0) log.info("Processed {}/{} threads", i + 1, futures.size());
            }
        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            throw e;
        }

        phase = Phase.FINALIZE;
        writeIndex(outcomes);
        CrawlSummary summary = summarize(discovered.size(), queue.size(), outcomes);
        log.info("Response telemetry:\n{}", fetcher.telemetry().summary());
        extractor.misses().forEach((chain, misses) -> {
            if (misses > 0) log.warn("Extraction chain {} fell back to its default {} times", chain, misses);
        });
        log.atInfo().addKeyValue("succeeded", summary.succeeded()).addKeyValue("failed", summary.failed())
                .addKeyValue("postsNew", summary.postsNew()).addKeyValue("postsEdited", summary.postsEdited())
                .addKeyValue("assetsDownloaded", summary.assetsDownloaded())
                .addKeyValue("assetsSkipped", summary.assetsSkipped())
                .addKeyValue("assetsFailed", summary.assetsFailed())
                .log("Crawl finished");
        phase = Phase.DONE;
        return summary;
    }

    /**
     * Thread links from every board page, deduplicated by URL with the first occurrence kept.
     */
    List<ThreadLink> discover() throws CrawlException, InterruptedException {
        Url board = config.forum().boardUrl();
        FetchResponse first;
        try {
            first = fetcher.fetch(board);
        } catch (FetchException e) {
            throw new CrawlException("Could not fetch board " + board, e);
        }
        Document doc = ForumExtractor.parse(first.text(), first.url());
        var links = new LinkedHashMap<Url, ThreadLink>();
        for (ThreadLink link : extractor.threadLinks(doc, first.url())) {
            links.putIfAbsent(link.url(), link);
        }

        int pages = extractor.pageCount(doc).orElseGet(() -> {
            log.info("No pagination found on the board, probing up to page {}", config.forum().probePages());
            return config.forum().probePages();
        });

        var futures = new ArrayList<Future<List<ThreadLink>>>();
        for (int page = 2; page <= pages; page++) {
            Url pageUrl = board.withPageNo(page);
            futures.add(io.submit(() -> fetchBoardPage(pageUrl)));
        }
        for (var future : futures) {
            for (ThreadLink link : get(future)) {
                links.putIfAbsent(link.url(), link);
            }
        }

        for (Url extra : config.forum().extraThreads()) {
            Url url = extra.withoutFragment();
            links.putIfAbsent(url, new ThreadLink(url));
        }
        return new ArrayList<>(links.values());
    }

    private List<ThreadLink> fetchBoardPage(Url pageUrl) throws InterruptedException {
        try {
            FetchResponse response = fetcher.fetch(pageUrl);
            List<ThreadLink> links = extractor.threadLinks(ForumExtractor.parse(response.text(), response.url()),
                    response.url());
            if (links.isEmpty()) {
                log.atInfo().addKeyValue("url", pageUrl).log("Board page has no threads");
            } else {
                log.atDebug().addKeyValue("url", pageUrl).log("Found {} threads", links.size());
            }
            return links;
        } catch (FetchException e) {
            log.atWarn().addKeyValue("url", pageUrl).addKeyValue("reason", e.reason()).log("Skipping board page");
            return List.of();
        }
    }

    /**
     * Threads never harvested before, plus (when enabled) harvested threads whose board row shows more replies
     * than were recorded.
     */
    List<ThreadLink> diff(List<ThreadLink> discovered) {
        Set<Url> visited = store.visitedUrls();
        var queued = new LinkedHashMap<String, ThreadLink>();
        var unidentified = new ArrayList<ThreadLink>();
        int seeded = 0;
        for (ThreadLink link : discovered) {
            String threadId = ForumExtractor.threadId(link.url());
            boolean known = visited.contains(link.url()) || (threadId != null && store.thread(threadId) != null);
            if (!known) {
                if (threadId == null) {
                    unidentified.add(link);
                } else {
                    queued.putIfAbsent(threadId, link);
                }
            } else if (threadId != null && link.replies() != null && store.seedMigratedBaseline(threadId,
                    link.replies(), link.views() == null ? 0 : link.views())) {
                seeded++;
            } else if (config.crawl().refetchUpdated() && threadId != null && link.replies() != null
                       && store.shouldRefetchThread(threadId, link.replies(),
                    link.views() == null ? 0 : link.views())) {
                log.atInfo().addKeyValue("threadId", threadId).addKeyValue("replies", link.replies())
                        .log("Thread has new replies");
                queued.putIfAbsent(threadId, link);
            }
        }
        if (seeded > 0) {
            log.info("Recorded board counts for {} threads migrated from the legacy manifest", seeded);
            store.save();
        }
        var queue = new ArrayList<>(queued.values());
        queue.addAll(unidentified);
        Integer maxThreads = config.crawl().maxThreads();
        if (maxThreads != null && queue.size() > maxThreads) {
            log.info("Limiting this run to {} of {} queued threads", maxThreads, queue.size());
            return new ArrayList<>(queue.subList(0, maxThreads));
        }
        return queue;
    }

    enum AssetStatus {
        DOWNLOADED, SKIPPED, FAILED
    }

    record AssetOutcome(AssetRecord asset, AssetStatus status) {
    }

    record ThreadOutcome(Url url, @Nullable ThreadRecord thread, @Nullable String failureReason, int postsNew,
                         int postsEdited, int assetsDownloaded, int assetsSkipped, int assetsFailed) {
        static ThreadOutcome failed(Url url, String reason) {
            return new ThreadOutcome(url, null, reason, 0, 0, 0, 0, 0);
        }
    }

    ThreadOutcome processThread(ThreadLink link) throws InterruptedException {
        Url url = link.url();
        String threadId = ForumExtractor.threadId(url);
        if (threadId == null) {
            log.atWarn().addKeyValue("url", url).log("Could not parse thread id");
            return ThreadOutcome.failed(url, "No thread id");
        }
        try {
            return harvestThread(threadId, link);
        } catch (ForumMinerException e) {
            log.atError().addKeyValue("threadId", threadId).addKeyValue("url", url)
                    .addKeyValue("reason", e.reason()).log("Thread failed");
            return ThreadOutcome.failed(url, e.reason());
        } catch (IOException | RuntimeException e) {
            log.atError().addKeyValue("threadId", threadId).addKeyValue("url", url).setCause(e)
                    .log("Thread failed");
            return ThreadOutcome.failed(url, e.getClass().getSimpleName());
        }
    }

    private ThreadOutcome harvestThread(String threadId, ThreadLink link) throws ForumMinerException, IOException,
            InterruptedException {
        Url url = link.url();
        log.atInfo().addKeyValue("threadId", threadId).addKeyValue("url", url).log("Processing thread");

        FetchResponse first = fetcher.fetch(url);
        Document doc = ForumExtractor.parse(first.text(), first.url());
        String title = extractor.title(doc);
        PageStats stats = extractor.stats(doc);
        var posts = new ArrayList<>(extractor.posts(doc, threadId, 1));
        var assets = new ArrayList<>(extractor.attachments(doc, first.url(), 1));

        int pages = extractor.pageCount(doc).orElse(1);
        if (pages > 1) {
            var futures = new ArrayList<Future<FetchResponse>>();
            for (int page = 2; page <= pages; page++) {
                Url pageUrl = url.withPageNo(page);
                futures.add(io.submit(() -> fetcher.fetch(pageUrl)));
            }
            for (var future : futures) {
                FetchResponse response;
                try {
                    response = getPage(future);
                } catch (FetchException e) {
                    futures.forEach(f -> f.cancel(true));
                    log.atWarn().addKeyValue("threadId", threadId).addKeyValue("url", e.url())
                            .addKeyValue("reason", e.reason()).log("Reply page failed, abandoning thread");
                    throw e;
                }
                Document pageDoc = ForumExtractor.parse(response.text(), response.url());
                int firstPostNumber = posts.size() + 1;
                posts.addAll(extractor.posts(pageDoc, threadId, firstPostNumber));
                assets.addAll(extractor.attachments(pageDoc, response.url(), firstPostNumber));
            }
        }

        var uniqueAssets = new LinkedHashMap<Url, AssetRecord>();
        for (AssetRecord asset : assets) {
            uniqueAssets.putIfAbsent(asset.url(), asset);
        }
        List<AssetRecord> namedAssets = OutputWriter.assignFilenames(new ArrayList<>(uniqueAssets.values()));

        int replies = Math.max(stats.replies(), Math.max(posts.size() - 1, 0));
        if (link.replies() != null) replies = Math.max(replies, link.replies());
        int views = stats.views();
        if (link.views() != null) views = Math.max(views, link.views());

        ThreadRecord draft = ThreadRecord.of(threadId, title, url, posts, replies, views, namedAssets,
                clock.instant());

        ThreadState previous = store.thread(threadId);
        Path dir = output.prepareThreadDir(draft, previous == null ? null : previous.outputDir());

        var assetFutures = new ArrayList<Future<AssetOutcome>>();
        for (AssetRecord asset : namedAssets) {
            assetFutures.add(io.submit(() -> processAsset(threadId, dir, asset)));
        }
        var finalAssets = new ArrayList<AssetRecord>();
        var downloaded = new ArrayList<AssetRecord>();
        int skipped = 0;
        int failed = 0;
        for (var future : assetFutures) {
            AssetOutcome outcome = get(future);
            finalAssets.add(outcome.asset());
            switch (outcome.status()) {
                case DOWNLOADED -> downloaded.add(outcome.asset());
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
        }

        ThreadRecord thread = draft.withAssets(finalAssets);
        output.writeMetadata(dir, thread);

        int postsNew = 0;
        int postsEdited = 0;
        for (PostRecord post : thread.posts()) {
            switch (store.recordPost(threadId, post)) {
                case NEW -> postsNew++;
                case EDITED -> postsEdited++;
                case UNCHANGED -> {
                }
            }
        }
        for (AssetRecord asset : downloaded) {
            store.recordAsset(asset);
        }
        store.recordThread(thread, first.header("Last-Modified"), output.relativize(dir));
        store.save();

        log.atInfo().addKeyValue("threadId", threadId).addKeyValue("posts", posts.size())
                .addKeyValue("assets", finalAssets.size()).addKeyValue("dir", output.relativize(dir))
                .log("Saved thread");
        return new ThreadOutcome(url, thread, null, postsNew, postsEdited, downloaded.size(), skipped, failed);
    }

    /**
     * Downloads an attachment unless a HEAD request shows the stored copy is still current.
     */
    AssetOutcome processAsset(String threadId, Path dir, AssetRecord asset) throws InterruptedException {
        Url url = asset.url();
        AssetState known = store.asset(url);
        if (known != null && Files.exists(dir.resolve(asset.filename()))) {
            try {
                FetchResponse head = fetcher.head(url);
                if (!store.shouldRedownloadAsset(url, head.header("ETag"), head.header("Last-Modified"))) {
                    log.atDebug().addKeyValue("url", url).log("Attachment unchanged");
                    return new AssetOutcome(asset.withContent(known.size() == null ? 0 : known.size(),
                            known.contentHash(), known.mimeType(), known.etag(), known.lastModified()),
                            AssetStatus.SKIPPED);
                }
            } catch (FetchException e) {
                log.atDebug().addKeyValue("url", url).addKeyValue("reason", e.reason())
                        .log("HEAD failed, downloading instead");
            }
        }

        try {
            Long limit = config.fetch().maxDownloadSize();
            FetchResponse response = fetcher.download(url, limit == null ? Long.MAX_VALUE : limit);
            output.writeAsset(dir, asset.filename(), response.body());
            return new AssetOutcome(asset.withContent(response.body().length, response.checksum(),
                    MimeTypes.infer(asset.filename(), response.mimeType()), response.header("ETag"),
                    response.header("Last-Modified")), AssetStatus.DOWNLOADED);
        } catch (DownloadTooLargeException e) {
            log.atWarn().addKeyValue("threadId", threadId).addKeyValue("url", url)
                    .addKeyValue("limit", e.limit()).log("Skipping oversized attachment");
        } catch (FetchException e) {
            log.atWarn().addKeyValue("threadId", threadId).addKeyValue("url", url)
                    .addKeyValue("reason", e.reason()).log("Attachment download failed");
        } catch (IOException e) {
            log.atError().addKeyValue("threadId", threadId).addKeyValue("url", url).setCause(e)
                    .log("Could not write attachment");
        }
        return new AssetOutcome(asset, AssetStatus.FAILED);
    }

    private void writeIndex(List<ThreadOutcome> outcomes) {
        Path indexFile = output.indexFile();
        AssetTypeIndex index = AssetTypeIndex.load(indexFile);
        for (ThreadOutcome outcome : outcomes) {
            if (outcome.thread() != null) index.add(outcome.thread());
        }
        try {
            index.write(indexFile);
        } catch (IOException e) {
            log.error("Failed to write asset type index {}", indexFile, e);
        }
    }

    private static CrawlSummary summarize(int discovered, int queued, List<ThreadOutcome> outcomes) {
        int succeeded = 0, failed = 0, postsNew = 0, postsEdited = 0;
        int assetsDownloaded = 0, assetsSkipped = 0, assetsFailed = 0;
        Map<String, Integer> reasons = new TreeMap<>();
        for (ThreadOutcome outcome : outcomes) {
            if (outcome.failureReason() != null) {
                failed++;
                reasons.merge(outcome.failureReason(), 1, Integer::sum);
                continue;
            }
            succeeded++;
            postsNew += outcome.postsNew();
            postsEdited += outcome.postsEdited();
            assetsDownloaded += outcome.assetsDownloaded();
            assetsSkipped += outcome.assetsSkipped();
            assetsFailed += outcome.assetsFailed();
        }
        return new CrawlSummary(discovered, queued, succeeded, failed, postsNew, postsEdited, assetsDownloaded,
                assetsSkipped, assetsFailed, reasons);
    }

    private static ThreadOutcome await(Future<ThreadOutcome> future, ThreadLink link) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.atError().addKeyValue("url", link.url()).setCause(e.getCause()).log("Thread task failed");
            return ThreadOutcome.failed(link.url(), e.getCause().getClass().getSimpleName());
        }
    }

    /**
     * Waits for a task whose body handles its own expected failures.
     */
    private static <T> T get(Future<T> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) throw runtimeException;
            if (e.getCause() instanceof InterruptedException interruptedException) throw interruptedException;
            throw new IllegalStateException(e.getCause());
        }
    }

    /**
     * Waits for a page fetch, surfacing its {@link FetchException}.
     */
    private static FetchResponse getPage(Future<FetchResponse> future) throws FetchException, InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof FetchException fetchException) throw fetchException;
            if (e.getCause() instanceof RuntimeException runtimeException) throw runtimeException;
            if (e.getCause() instanceof InterruptedException interruptedException) throw interruptedException;
            throw new IllegalStateException(e.getCause());
        }
    }

    @Override
    public void close() {
        workers.shutdownNow();
        io.shutdownNow();
    }
}
