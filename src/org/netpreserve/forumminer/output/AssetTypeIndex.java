package org.netpreserve.forumminer.output;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.forumminer.model.AssetRecord;
import org.netpreserve.forumminer.model.ThreadRecord;
import org.netpreserve.forumminer.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Lists harvested threads by the types of file attached to them, so e.g. every thread sharing {@code .xml} macros
 * can be found without walking the output tree. Threads with more than one type are also listed separately.
 */
public class AssetTypeIndex {
    private static final Logger log = LoggerFactory.getLogger(AssetTypeIndex.class);
    private static final Comparator<String> THREAD_ID_ORDER = Comparator.comparingInt(String::length)
            .thenComparing(Comparator.naturalOrder());

    public record Entry(
            @JsonProperty("thread_id") String threadId,
            @JsonProperty("title") String title,
            @JsonProperty("url") String url,
            @JsonProperty("files") List<String> files) {
    }

    public record MultiTypeEntry(
            @JsonProperty("thread_id") String threadId,
            @JsonProperty("title") String title,
            @JsonProperty("url") String url,
            @JsonProperty("asset_types") List<String> assetTypes) {
    }

    @JsonProperty("by_type")
    private final Map<String, List<Entry>> byType;
    @JsonProperty("multi_type_threads")
    private final List<MultiTypeEntry> multiTypeThreads;

    public AssetTypeIndex() {
        this(null, null);
    }

    @JsonCreator
    AssetTypeIndex(@JsonProperty("by_type") @Nullable Map<String, List<Entry>> byType,
                   @JsonProperty("multi_type_threads") @Nullable List<MultiTypeEntry> multiTypeThreads) {
        this.byType = new TreeMap<>();
        if (byType != null) {
            byType.forEach((type, entries) -> this.byType.put(type, new ArrayList<>(entries)));
        }
        this.multiTypeThreads = multiTypeThreads == null ? new ArrayList<>() : new ArrayList<>(multiTypeThreads);
    }

    /**
     * Reads an existing index, or returns an empty one if the file is missing or unreadable.
     */
    public static AssetTypeIndex load(Path file) {
        if (!Files.exists(file)) return new AssetTypeIndex();
        try {
            return Json.JSON.readValue(file.toFile(), AssetTypeIndex.class);
        } catch (IOException e) {
            log.warn("Ignoring unreadable asset type index {}", file, e);
            return new AssetTypeIndex();
        }
    }

    /**
     * Adds a thread, replacing whatever was indexed for it before.
     */
    public void add(ThreadRecord thread) {
        remove(thread.threadId());
        List<String> types = thread.assetTypes();
        for (String type : types) {
            var files = new ArrayList<String>();
            for (AssetRecord asset : thread.assets()) {
                if (asset.fileType().equals(type)) files.add(asset.filename());
            }
            List<Entry> entries = byType.computeIfAbsent(type, k -> new ArrayList<>());
            entries.add(new Entry(thread.threadId(), thread.title(), thread.url().toString(), files));
            entries.sort(Comparator.comparing(Entry::threadId, THREAD_ID_ORDER));
        }
        if (types.size() > 1) {
            multiTypeThreads.add(new MultiTypeEntry(thread.threadId(), thread.title(), thread.url().toString(),
                    types));
            multiTypeThreads.sort(Comparator.comparing(MultiTypeEntry::threadId, THREAD_ID_ORDER));
        }
    }

    private void remove(String threadId) {
        byType.values().forEach(entries -> entries.removeIf(entry -> entry.threadId().equals(threadId)));
        byType.values().removeIf(List::isEmpty);
        multiTypeThreads.removeIf(entry -> entry.threadId().equals(threadId));
    }

    public Map<String, List<Entry>> byType() {
        return byType;
    }

    public List<MultiTypeEntry> multiTypeThreads() {
        return multiTypeThreads;
    }

    public void write(Path file) throws IOException {
        Json.writeAtomically(file, this);
    }
}
