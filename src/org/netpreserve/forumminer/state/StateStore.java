package org.netpreserve.forumminer.state;

import com.fasterxml.jackson.core.type.TypeReference;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.forumminer.extract.ForumExtractor;
import org.netpreserve.forumminer.model.AssetRecord;
import org.netpreserve.forumminer.model.PostRecord;
import org.netpreserve.forumminer.model.ThreadRecord;
import org.netpreserve.forumminer.util.Json;
import org.netpreserve.forumminer.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static org.netpreserve.forumminer.util.Json.JSON;

/**
 * The crawl ledger. Decides what needs (re)fetching by comparing what the forum shows now with what was seen on
 * earlier runs, and persists that knowledge to a JSON file after every change.
 */
public class StateStore {
    private static final Logger log = LoggerFactory.getLogger(StateStore.class);
    private final Path stateFile;
    private final Clock clock;
    private final CrawlState state;

    public enum PostChange {
        NEW, EDITED, UNCHANGED
    }

    StateStore(Path stateFile, CrawlState state, Clock clock) {
        this.stateFile = stateFile;
        this.state = state;
        this.clock = clock;
    }

    public static StateStore open(Path stateFile, @Nullable Path legacyManifest) {
        return open(stateFile, legacyManifest, Clock.systemUTC());
    }

    /**
     * Loads the state file. If there is none (or it can't be read) but a legacy manifest exists, the manifest's
     * URLs are migrated into a fresh ledger which is saved straight away, and the manifest is renamed to
     * {@code <name>.migrated}. Otherwise starts empty.
     */
    public static StateStore open(Path stateFile, @Nullable Path legacyManifest, Clock clock) {
        if (Files.exists(stateFile)) {
            try {
                CrawlState state = JSON.readValue(stateFile.toFile(), CrawlState.class);
                if (!CrawlState.SCHEMA_VERSION.equals(state.schemaVersion())) {
                    log.warn("State file {} has schema version {}, loading what is understood",
                            stateFile, state.schemaVersion());
                    state.schemaVersion(CrawlState.SCHEMA_VERSION);
                }
                log.info("Loaded state with {} threads, {} posts, {} assets from {}", state.threads().size(),
                        state.posts().size(), state.assets().size(), stateFile);
                return new StateStore(stateFile, state, clock);
            } catch (IOException e) {
                log.warn("Could not load state file {}", stateFile, e);
            }
        }

        if (legacyManifest != null && Files.exists(legacyManifest)) {
            try {
                List<String> urls = JSON.readValue(legacyManifest.toFile(), new TypeReference<>() {
                });
                var store = new StateStore(stateFile, new CrawlState(), clock);
                store.migrate(urls);
                if (store.save()) {
                    Path migrated = legacyManifest.resolveSibling(legacyManifest.getFileName() + ".migrated");
                    Files.move(legacyManifest, migrated, StandardCopyOption.REPLACE_EXISTING);
                    log.info("Migrated {} threads from {} (renamed to {})", store.state.threads().size(),
                            legacyManifest, migrated.getFileName());
                }
                return store;
            } catch (IOException e) {
                log.warn("Could not migrate legacy manifest {}", legacyManifest, e);
            }
        }

        log.info("No crawl state found, starting fresh");
        return new StateStore(stateFile, new CrawlState(), clock);
    }

    private void migrate(List<String> urls) {
        Instant now = clock.instant();
        for (String string : urls) {
            if (string == null) continue;
            Url url = new Url(string);
            String threadId = ForumExtractor.threadId(url);
            if (threadId == null) {
                log.debug("Skipping manifest entry without a thread id: {}", url);
                continue;
            }
            state.threads().put(threadId, new ThreadState(threadId, url, now, 0, 0, null, null, null, true));
        }
    }

    /**
     * True if the thread is unknown or the forum now shows more replies than last time. View counts alone never
     * trigger a re-fetch.
     */
    public synchronized boolean shouldRefetchThread(String threadId, int currentReplies, int currentViews) {
        ThreadState stored = state.threads().get(threadId);
        if (stored == null) return true;
        return currentReplies > stored.replyCountSeen();
    }

    /**
     * Adopts the board's counts as the baseline of a thread migrated from a legacy manifest, which was harvested
     * before but never had its counts recorded. Returns false for any other thread.
     */
    public synchronized boolean seedMigratedBaseline(String threadId, int currentReplies, int currentViews) {
        ThreadState stored = state.threads().get(threadId);
        if (stored == null || !stored.migrated()) return false;
        state.threads().put(threadId, new ThreadState(threadId, stored.url(), stored.lastSeenAt(), currentReplies,
                currentViews, stored.lastModified(), stored.title(), stored.outputDir(), false));
        return true;
    }

    /**
     * Compares the server's validators with the stored ones. ETags win when both sides have one, otherwise
     * Last-Modified is compared when both sides have it. With nothing to compare the stored copy is kept.
     * Unknown assets always need downloading.
     */
    public synchronized boolean shouldRedownloadAsset(Url url, @Nullable String serverEtag,
                                                      @Nullable String serverLastModified) {
        AssetState stored = state.assets().get(url.toString());
        if (stored == null) return true;
        if (stored.etag() != null && serverEtag != null) {
            return !stored.etag().equals(serverEtag);
        }
        if (stored.lastModified() != null && serverLastModified != null) {
            return !stored.lastModified().equals(serverLastModified);
        }
        return false;
    }

    public synchronized @Nullable ThreadState thread(String threadId) {
        return state.threads().get(threadId);
    }

    public synchronized @Nullable PostState post(String postId) {
        return state.posts().get(postId);
    }

    public synchronized @Nullable AssetState asset(Url url) {
        return state.assets().get(url.toString());
    }

    /**
     * @param lastModified the thread page's Last-Modified header, if sent
     * @param outputDir    where the thread's folder was written, relative to the output root
     */
    public synchronized void recordThread(ThreadRecord thread, @Nullable String lastModified,
                                          @Nullable String outputDir) {
        state.threads().put(thread.threadId(), new ThreadState(thread.threadId(), thread.url(), clock.instant(),
                thread.replies(), thread.views(), lastModified, thread.title(), outputDir, false));
    }

    /**
     * Records a post and reports whether it is new, edited (its content fingerprint changed) or unchanged. An
     * edit keeps the original observation time and sets {@code edited_at}.
     */
    public synchronized PostChange recordPost(String threadId, PostRecord post) {
        Instant now = clock.instant();
        PostState stored = state.posts().get(post.postId());
        if (stored == null) {
            state.posts().put(post.postId(), new PostState(post.postId(), threadId, post.postNumber(),
                    post.contentHash(), now, null));
            return PostChange.NEW;
        }
        if (Objects.equals(stored.contentHash(), post.contentHash())) {
            return PostChange.UNCHANGED;
        }
        state.posts().put(post.postId(), new PostState(post.postId(), threadId, post.postNumber(),
                post.contentHash(), stored.observedAt(), now));
        return PostChange.EDITED;
    }

    /**
     * Records a downloaded asset's fingerprint and validators.
     */
    public synchronized void recordAsset(AssetRecord asset) {
        state.assets().put(asset.url().toString(), new AssetState(asset.url(), asset.filename(), asset.checksum(),
                asset.mimeType(), asset.size(), clock.instant(), asset.etag(), asset.lastModified()));
    }

    /**
     * URLs of every thread in the ledger.
     */
    public synchronized Set<Url> visitedUrls() {
        var urls = new HashSet<Url>();
        for (ThreadState thread : state.threads().values()) {
            urls.add(thread.url());
        }
        return urls;
    }

    public synchronized int threadCount() {
        return state.threads().size();
    }

    public synchronized @Nullable Instant lastUpdated() {
        return state.lastUpdated();
    }

    public Path stateFile() {
        return stateFile;
    }

    /**
     * Writes the ledger atomically. A failure is logged and reported as false; the in-memory state is still
     * valid and the next save will try again.
     */
    public synchronized boolean save() {
        state.lastUpdated(clock.instant());
        try {
            Json.writeAtomically(stateFile, state);
            return true;
        } catch (IOException e) {
            log.error("Failed to save crawl state to {}", stateFile, e);
            return false;
        }
    }
}
