package org.netpreserve.forumminer.output;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.forumminer.model.AssetRecord;
import org.netpreserve.forumminer.model.ThreadRecord;
import org.netpreserve.forumminer.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lays out harvested threads on disk:
 * {@code <root>/<category>/<year>/<yyyy-mm-dd>/thread_<id>_<slug>/metadata.json} plus the thread's attachments.
 */
public class OutputWriter {
    private static final Logger log = LoggerFactory.getLogger(OutputWriter.class);
    public static final String METADATA_FILE = "metadata.json";
    public static final String INDEX_FILE = "asset_type_index.json";
    private static final Pattern UNSAFE_IN_TITLE = Pattern.compile("[/\\\\:*?\"<>|]");
    private static final Pattern UNSAFE_IN_FILENAME = Pattern.compile("[/\\\\:*?\"<>|\\p{Cntrl}]");
    private static final Pattern LEADING_DOTS = Pattern.compile("^[.\\s]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ISO_DATE = Pattern.compile("^(\\d{4})-(\\d{2})-(\\d{2})");
    private static final Pattern EPOCH = Pattern.compile("^\\d{9,13}$");
    private static final int MAX_SLUG_LENGTH = 50;
    private static final int MAX_FILENAME_LENGTH = 200;

    private final Path root;

    public OutputWriter(Path root) {
        this.root = root;
    }

    public record DateFolder(String year, String day) {
        public static final DateFolder UNKNOWN = new DateFolder("unknown_year", "unknown_date");
    }

    /**
     * Folder for a thread relative to the output root.
     */
    public static Path relativeThreadDir(ThreadRecord thread) {
        DateFolder date = dateFolder(thread.postDate());
        return Path.of(thread.assetTypeCategory(), date.year(), date.day(),
                threadFolderName(thread.threadId(), thread.title()));
    }

    /**
     * Creates the thread's folder. If the thread was written to a different folder on an earlier run (its title,
     * date or asset mix changed) the old folder is moved here first so files aren't duplicated.
     *
     * @param previousDir folder recorded for this thread on the last run, relative to the output root
     */
    public Path prepareThreadDir(ThreadRecord thread, @Nullable String previousDir) throws IOException {
        Path relative = relativeThreadDir(thread);
        Path dir = root.resolve(relative);
        if (previousDir != null) {
            Path old = root.resolve(previousDir).normalize();
            if (!old.equals(dir.normalize()) && old.startsWith(root.normalize()) && Files.isDirectory(old)
                && !Files.exists(dir)) {
                Files.createDirectories(dir.getParent());
                Files.move(old, dir);
                log.atInfo().addKeyValue("threadId", thread.threadId()).addKeyValue("from", previousDir)
                        .addKeyValue("to", relative).log("Moved thread folder");
            }
        }
        Files.createDirectories(dir);
        return dir;
    }

    /**
     * The folder's path relative to the output root in the portable form stored in crawl state.
     */
    public String relativize(Path dir) {
        return root.relativize(dir).toString().replace('\\', '/');
    }

    /**
     * Gives every asset a sanitized filename that is unique within the thread, keeping the extension.
     */
    public static List<AssetRecord> assignFilenames(List<AssetRecord> assets) {
        var usedNames = new HashSet<String>();
        var result = new ArrayList<AssetRecord>(assets.size());
        for (AssetRecord asset : assets) {
            String name = uniqueName(sanitizeFilename(asset.filename()), usedNames);
            usedNames.add(name);
            result.add(asset.withFilename(name));
        }
        return result;
    }

    /**
     * Writes an attachment into the thread folder, replacing any file of the same name left by an earlier run.
     * The name must already be sanitized.
     */
    public Path writeAsset(Path threadDir, String filename, byte[] body) throws IOException {
        Path target = threadDir.resolve(filename).normalize();
        if (!threadDir.normalize().equals(target.getParent())) {
            throw new IllegalArgumentException("Filename escapes thread folder: " + filename);
        }
        Path tmp = Files.createTempFile(threadDir, ".download", ".tmp");
        try {
            Files.write(tmp, body);
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
        return target;
    }

    public void writeMetadata(Path threadDir, ThreadRecord thread) throws IOException {
        Json.writeAtomically(threadDir.resolve(METADATA_FILE), thread);
    }

    public Path indexFile() {
        return root.resolve(INDEX_FILE);
    }

    public static String threadFolderName(String threadId, String title) {
        String slug = slug(title);
        return slug.isEmpty() ? "thread_" + threadId : "thread_" + threadId + "_" + slug;
    }

    /**
     * Filesystem-safe version of a title: reserved characters removed, whitespace runs turned into a single
     * underscore, at most 50 characters without a trailing underscore.
     */
    public static String slug(String title) {
        if (title == null) return "";
        String clean = UNSAFE_IN_TITLE.matcher(title).replaceAll("");
        clean = WHITESPACE.matcher(clean).replaceAll(" ").strip().replace(' ', '_');
        if (clean.length() > MAX_SLUG_LENGTH) {
            clean = clean.substring(0, MAX_SLUG_LENGTH);
            while (clean.endsWith("_")) clean = clean.substring(0, clean.length() - 1);
        }
        return clean;
    }

    public static DateFolder dateFolder(@Nullable String postDate) {
        LocalDate date = parseDate(postDate);
        if (date == null) return DateFolder.UNKNOWN;
        return new DateFolder(String.format("%04d", date.getYear()), date.toString());
    }

    /**
     * Reads the calendar date from an ISO-8601 timestamp (as written, ignoring the offset) or from epoch seconds
     * or milliseconds.
     */
    static @Nullable LocalDate parseDate(@Nullable String text) {
        if (text == null) return null;
        String value = text.strip();
        try {
            Matcher matcher = ISO_DATE.matcher(value);
            if (matcher.find()) {
                return LocalDate.of(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)),
                        Integer.parseInt(matcher.group(3)));
            }
            if (EPOCH.matcher(value).matches()) {
                long epoch = Long.parseLong(value);
                Instant instant = value.length() > 10 ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch);
                return LocalDate.ofInstant(instant, ZoneOffset.UTC);
            }
        } catch (DateTimeException | NumberFormatException e) {
            log.debug("Unparseable post date {}", text);
        }
        return null;
    }

    /**
     * Strips any directory part and characters that are unsafe in filenames. Never returns a name that could
     * escape the folder it is written to.
     */
    public static String sanitizeFilename(String filename) {
        String name = filename == null ? "" : filename.strip();
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        name = name.substring(slash + 1);
        name = UNSAFE_IN_FILENAME.matcher(name).replaceAll("_").strip();
        name = LEADING_DOTS.matcher(name).replaceFirst("");
        if (name.length() > MAX_FILENAME_LENGTH) {
            int dot = name.lastIndexOf('.');
            String ext = dot > 0 && name.length() - dot <= 16 ? name.substring(dot) : "";
            name = name.substring(0, MAX_FILENAME_LENGTH - ext.length()) + ext;
        }
        if (name.isBlank()) return "attachment";
        return name;
    }

    /**
     * Returns {@code name} or, if taken, {@code name_1.ext}, {@code name_2.ext} and so on.
     */
    static String uniqueName(String name, Set<String> usedNames) {
        if (!usedNames.contains(name) && !name.equals(METADATA_FILE)) return name;
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : "";
        for (int i = 1; ; i++) {
            String candidate = base + "_" + i + ext;
            if (!usedNames.contains(candidate)) return candidate;
        }
    }
}
