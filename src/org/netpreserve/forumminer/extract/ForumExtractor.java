package org.netpreserve.forumminer.extract;

import org.jetbrains.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.netpreserve.forumminer.model.AssetRecord;
import org.netpreserve.forumminer.model.PostRecord;
import org.netpreserve.forumminer.util.Url;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns board and thread pages into records. Every field is read through an {@link ExtractionChain} so a change
 * in the forum's templates degrades individual fields to defaults instead of failing the page.
 * <p>
 * Chains remember which strategy last worked, so each crawl should use its own instance.
 */
public class ForumExtractor {
    private static final Pattern THREAD_ID = Pattern.compile("/thread/(\\d+)-");
    private static final Pattern PAGE_PATH = Pattern.compile("/page/(\\d+)/");
    private static final Pattern PAGE_PARAM = Pattern.compile("[?&]pageNo=(\\d+)");
    private static final Pattern PAGE_X_OF_Y = Pattern.compile("(?i)page\\s+\\d+\\s+of\\s+(\\d+)");
    private static final Pattern NUMBER = Pattern.compile("\\d[\\d.,]*");
    private static final String REPLY_WORDS = "replies|reply|antworten|antwort";
    private static final String VIEW_WORDS = "views|ansichten|zugriffe";
    private static final Pattern REPLY_LABEL = Pattern.compile("(?i)\\b(?:" + REPLY_WORDS + ")\\b");
    private static final Pattern VIEW_LABEL = Pattern.compile("(?i)\\b(?:" + VIEW_WORDS + ")\\b");
    private static final Pattern ANY_LABEL = Pattern.compile("(?i)\\b(?:" + REPLY_WORDS + "|" + VIEW_WORDS + ")\\b");
    private static final Pattern REPLIES_AFTER = Pattern.compile("(?i)(\\d[\\d.,]*)\\s*(?:" + REPLY_WORDS + ")\\b");
    private static final Pattern REPLIES_BEFORE = Pattern.compile("(?i)\\b(?:" + REPLY_WORDS + ")\\s*:?\\s*(\\d[\\d.,]*)");
    private static final Pattern VIEWS_AFTER = Pattern.compile("(?i)(\\d[\\d.,]*)\\s*(?:" + VIEW_WORDS + ")\\b");
    private static final Pattern VIEWS_BEFORE = Pattern.compile("(?i)\\b(?:" + VIEW_WORDS + ")\\s*:?\\s*(\\d[\\d.,]*)");

    private final List<String> attachmentExtensions;

    private final ExtractionChain<String> threadTitle = ExtractionChain.<String>builder("thread_title")
            .strategy("h1.topic-title", firstText("h1.topic-title"))
            .strategy(".contentTitle", firstText(".contentTitle"))
            .strategy("h1[itemprop=headline]", firstText("h1[itemprop=headline]"))
            .strategy(".topicHeader h1", firstText(".topicHeader h1"))
            .strategy("article.message:first-child h2", firstText("article.message:first-child h2"))
            .orElse("Unknown Title");

    private final ExtractionChain<List<Element>> postElements = ExtractionChain.<List<Element>>builder("post_elements")
            .strategy("article.message", all("article.message"))
            .strategy(".message", all(".message"))
            .strategy("[data-role=message]", all("[data-role=message]"))
            .strategy(".post", all(".post"))
            .strategy(".forumPost", all(".forumPost"))
            .orElse(List.of());

    private final ExtractionChain<String> postAuthor = ExtractionChain.<String>builder("post_author")
            .strategy(".username", firstText(".username"))
            .strategy(".author", firstText(".author"))
            .strategy("[itemprop=author]", firstText("[itemprop=author]"))
            .strategy(".postAuthor", firstText(".postAuthor"))
            .strategy(".userInfo h3", firstText(".userInfo h3"))
            .orElse("Unknown");

    private final ExtractionChain<String> postDate = ExtractionChain.<String>builder("post_date")
            .strategy("time[datetime]", firstDate("time[datetime]"))
            .strategy(".datetime", firstDate(".datetime"))
            .strategy("[data-timestamp]", firstDate("[data-timestamp]"))
            .strategy(".postDate", firstDate(".postDate"))
            .orElse(null);

    private final ExtractionChain<String> postContent = ExtractionChain.<String>builder("post_content")
            .strategy(".messageContent", firstText(".messageContent"))
            .strategy(".messageText", firstText(".messageText"))
            .strategy("[itemprop=text]", firstText("[itemprop=text]"))
            .strategy(".postContent", firstText(".postContent"))
            .strategy(".postBody", firstText(".postBody"))
            .orElse("");

    private final ExtractionChain<PageStats> threadStats = ExtractionChain.<PageStats>builder("thread_stats")
            .strategy(".stats", stats(".stats"))
            .strategy(".threadStats", stats(".threadStats"))
            .strategy("[data-stats]", stats("[data-stats]"))
            .strategy(".topicStats", stats(".topicStats"))
            .orElse(PageStats.NONE);

    private final ExtractionChain<List<Element>> threadLinks = ExtractionChain.<List<Element>>builder("thread_links")
            .strategy("a.wbbTopicLink", all("a.wbbTopicLink"))
            .strategy("a[href*=/forum/thread/]", all("a[href*=/forum/thread/]"))
            .strategy(".topicLink", all(".topicLink"))
            .strategy("a[data-topic-id]", all("a[data-topic-id]"))
            .orElse(List.of());

    private final ExtractionChain<List<Element>> attachmentLinks = ExtractionChain.<List<Element>>builder("attachments")
            .strategy("a.messageAttachment", all("a.messageAttachment"))
            .strategy("a.attachment", all("a.attachment"))
            .strategy("a[class*=attachment]", all("a[class*=attachment]"))
            .strategy("a[href*=file-download]", all("a[href*=file-download]"))
            .strategy("a[href*=/attachment/]", all("a[href*=/attachment/]"))
            .orElse(List.of());

    private final ExtractionChain<Integer> pageCount = ExtractionChain.<Integer>builder("page_count")
            .strategy("pagination links", root -> maxPageNumber(root.select(".pageNavigation a, .pagination a")))
            .strategy("page links", root -> maxPageNumber(samePageLinks(root)))
            .strategy("page X of Y text", ForumExtractor::pageOfText)
            .optional()
            .orElse(1);

    /**
     * @param attachmentExtensions lowercase extensions (with dot) of attachments worth keeping, empty for all
     */
    public ForumExtractor(List<String> attachmentExtensions) {
        var normalized = new ArrayList<String>();
        for (String extension : attachmentExtensions) {
            normalized.add(extension.toLowerCase(Locale.ROOT));
        }
        this.attachmentExtensions = List.copyOf(normalized);
    }

    public static Document parse(String html, Url baseUrl) {
        return Jsoup.parse(html, baseUrl.toString());
    }

    /**
     * Numeric thread id from a URL like {@code .../thread/30890-some-title/}, or null.
     */
    public static @Nullable String threadId(Url url) {
        Matcher matcher = THREAD_ID.matcher(url.toString());
        return matcher.find() ? matcher.group(1) : null;
    }

    public String title(Document doc) {
        return threadTitle.extract(doc);
    }

    public PageStats stats(Document doc) {
        return threadStats.extract(doc);
    }

    /**
     * Posts on this page, numbered consecutively starting at {@code firstPostNumber}.
     */
    public List<PostRecord> posts(Document doc, String threadId, int firstPostNumber) {
        var posts = new ArrayList<PostRecord>();
        int number = firstPostNumber;
        for (Element element : postElements.extract(doc)) {
            String author = postAuthor.extract(element);
            String date = postDate.extract(element);
            String text = postContent.extract(element);
            posts.add(PostRecord.of(threadId, number++, author, date, text));
        }
        return posts;
    }

    /**
     * Thread links on a board page, resolved against the page URL, fragments stripped, first occurrence kept.
     */
    public List<ThreadLink> threadLinks(Document doc, Url pageUrl) {
        var links = new LinkedHashMap<Url, ThreadLink>();
        for (Element element : threadLinks.extract(doc)) {
            Url url = pageUrl.resolve(element.attr("href"));
            if (url == null || !url.isHttp()) continue;
            url = url.withoutFragment();
            if (links.containsKey(url)) continue;
            Element row = row(element);
            Counts counts = row == null ? Counts.NONE : counts(rowStats(row));
            links.put(url, new ThreadLink(url, counts.replies(), counts.views()));
        }
        return new ArrayList<>(links.values());
    }

    /**
     * The number of pages the pagination controls advertise, if any.
     */
    public Optional<Integer> pageCount(Document doc) {
        return pageCount.tryExtract(doc);
    }

    /**
     * Attachments on this page whose filenames have one of the configured extensions. Each is attributed to the
     * post containing it, numbered from {@code firstPostNumber} like {@link #posts}.
     */
    public List<AssetRecord> attachments(Document doc, Url pageUrl, int firstPostNumber) {
        List<Element> posts = postElements.extract(doc);
        var assets = new ArrayList<AssetRecord>();
        for (Element link : attachmentLinks.extract(doc)) {
            String href = link.attr("href");
            if (href.isBlank()) continue;
            Url url = pageUrl.resolve(href);
            if (url == null) continue;
            url = url.withoutFragment();

            String filename = attachmentFilename(link, url);
            if (!hasWantedExtension(filename)) continue;

            Integer postNumber = null;
            for (int i = 0; i < posts.size(); i++) {
                Element post = posts.get(i);
                if (post == link || link.parents().contains(post)) {
                    postNumber = firstPostNumber + i;
                    break;
                }
            }

            assets.add(new AssetRecord(filename, url, downloadCount(link), postNumber));
        }
        return assets;
    }

    /**
     * Number of times each chain fell back to its default, keyed by chain name.
     */
    public Map<String, Long> misses() {
        var misses = new LinkedHashMap<String, Long>();
        for (var chain : List.of(threadTitle, postElements, postAuthor, postDate, postContent, threadStats,
                threadLinks, attachmentLinks, pageCount)) {
            misses.put(chain.name(), chain.misses());
        }
        return misses;
    }

    private boolean hasWantedExtension(String filename) {
        if (attachmentExtensions.isEmpty()) return true;
        String lower = filename.toLowerCase(Locale.ROOT);
        for (String extension : attachmentExtensions) {
            if (lower.endsWith(extension)) return true;
        }
        return false;
    }

    private static String attachmentFilename(Element link, Url url) {
        Element span = link.selectFirst("span.messageAttachmentFilename");
        if (span != null && !span.text().isBlank()) return span.text().strip();
        String text = link.text().strip();
        if (!text.isEmpty()) return text;
        return url.lastPathSegment();
    }

    /**
     * Reads the count from meta text like {@code "5.07 kB – 317 Downloads"}.
     */
    private static @Nullable Integer downloadCount(Element link) {
        Element meta = link.selectFirst("span.messageAttachmentMeta");
        if (meta == null) return null;
        String text = meta.text();
        int dash = text.indexOf('–');
        if (dash == -1 || !text.contains("Downloads")) return null;
        String[] words = text.substring(dash + 1).strip().split("\\s+");
        if (words.length == 0) return null;
        return parseNumber(words[0]);
    }

    private static @Nullable Element row(Element link) {
        for (Element parent : link.parents()) {
            if (parent.is("li, tr, .wbbThread, [data-thread-id]")) return parent;
        }
        return null;
    }

    private static Element rowStats(Element row) {
        Element stats = row.selectFirst(".stats, .columnStats, .statsDataList");
        return stats != null ? stats : row;
    }

    private record Counts(@Nullable Integer replies, @Nullable Integer views) {
        static final Counts NONE = new Counts(null, null);
    }

    /**
     * Reads reply and view counts from {@code <dt>Replies</dt><dd>5</dd>} pairs, or from text in either the
     * {@code "5 Replies"} or the {@code "Replies: 5"} form.
     */
    private static Counts counts(Element element) {
        Integer replies = null;
        Integer views = null;
        for (Element dt : element.select("dt")) {
            Element dd = dt.nextElementSibling();
            if (dd == null || !dd.is("dd")) continue;
            if (replies == null && REPLY_LABEL.matcher(dt.text()).find()) {
                replies = parseNumber(dd.text());
            } else if (views == null && VIEW_LABEL.matcher(dt.text()).find()) {
                views = parseNumber(dd.text());
            }
        }
        if (replies != null || views != null) return new Counts(replies, views);

        String text = element.text();
        Matcher label = ANY_LABEL.matcher(text);
        Matcher number = NUMBER.matcher(text);
        boolean labelFirst = label.find() && (!number.find() || label.start() < number.start());
        if (labelFirst) {
            return new Counts(firstGroup(REPLIES_BEFORE, text), firstGroup(VIEWS_BEFORE, text));
        }
        return new Counts(firstGroup(REPLIES_AFTER, text), firstGroup(VIEWS_AFTER, text));
    }

    private static @Nullable Integer firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? parseNumber(matcher.group(1)) : null;
    }

    /**
     * Parses counts like {@code 1,234} or {@code 1.234}, treating separators as thousands separators.
     */
    static @Nullable Integer parseNumber(String text) {
        Matcher matcher = NUMBER.matcher(text);
        if (!matcher.find()) return null;
        String digits = matcher.group().replace(",", "").replace(".", "");
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static @Nullable Integer maxPageNumber(Elements links) {
        int max = 0;
        for (Element link : links) {
            String href = link.attr("href");
            Matcher matcher = PAGE_PATH.matcher(href);
            if (!matcher.find()) {
                matcher = PAGE_PARAM.matcher(href);
                if (!matcher.find()) continue;
            }
            try {
                max = Math.max(max, Integer.parseInt(matcher.group(1)));
            } catch (NumberFormatException e) {
                // absurdly long page number, ignore the link
            }
        }
        return max > 0 ? max : null;
    }

    /**
     * Links that paginate the page being parsed, ignoring links into other threads or boards.
     */
    private static Elements samePageLinks(Element root) {
        String pagePath = pagelessPath(new Url(root.baseUri()).path());
        var links = new Elements();
        for (Element link : root.select("a[href]")) {
            String href = link.absUrl("href");
            if (!href.isEmpty() && pagelessPath(new Url(href).path()).equals(pagePath)) {
                links.add(link);
            }
        }
        return links;
    }

    private static String pagelessPath(String path) {
        String stripped = PAGE_PATH.matcher(path).replaceFirst("/");
        return stripped.endsWith("/") ? stripped : stripped + "/";
    }

    private static @Nullable Integer pageOfText(Element root) {
        Matcher matcher = PAGE_X_OF_Y.matcher(root.text());
        if (!matcher.find()) return null;
        return parseNumber(matcher.group(1));
    }

    private static ExtractionChain.Strategy<String> firstText(String selector) {
        return root -> {
            Element element = root.selectFirst(selector);
            return element == null ? null : element.text().strip();
        };
    }

    private static ExtractionChain.Strategy<String> firstDate(String selector) {
        return root -> {
            Element element = root.selectFirst(selector);
            if (element == null) return null;
            if (!element.attr("datetime").isBlank()) return element.attr("datetime");
            if (!element.attr("data-timestamp").isBlank()) return element.attr("data-timestamp");
            return element.text().strip();
        };
    }

    private static ExtractionChain.Strategy<List<Element>> all(String selector) {
        return root -> root.select(selector);
    }

    private static ExtractionChain.Strategy<PageStats> stats(String selector) {
        return root -> {
            Element element = root.selectFirst(selector);
            if (element == null) return null;
            Counts counts = counts(element);
            if (counts.replies() == null && counts.views() == null) return null;
            return new PageStats(counts.replies() == null ? 0 : counts.replies(),
                    counts.views() == null ? 0 : counts.views());
        };
    }
}
