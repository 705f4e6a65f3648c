package org.netpreserve.forumminer.fetch;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counts HTTP responses by status and category, and terminal failures by reason.
 */
public class ResponseTelemetry {
    public enum Category {
        SUCCESS("Success (2xx)"),
        REDIRECT("Redirect (3xx)"),
        CLIENT_ERROR("Client Error (4xx)"),
        SERVER_ERROR("Server Error (5xx)"),
        OTHER("Other");

        private final String label;

        Category(String label) {
            this.label = label;
        }

        public static Category of(int status) {
            if (status >= 200 && status < 300) return SUCCESS;
            if (status >= 300 && status < 400) return REDIRECT;
            if (status >= 400 && status < 500) return CLIENT_ERROR;
            if (status >= 500 && status < 600) return SERVER_ERROR;
            return OTHER;
        }
    }

    private final Map<Category, LongAdder> categories = new ConcurrentHashMap<>();
    private final Map<Integer, LongAdder> statuses = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> exhaustedReasons = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> failureReasons = new ConcurrentHashMap<>();
    private final LongAdder retryExhausted = new LongAdder();

    public void recordResponse(int status) {
        categories.computeIfAbsent(Category.of(status), k -> new LongAdder()).increment();
        statuses.computeIfAbsent(status, k -> new LongAdder()).increment();
    }

    /**
     * A URL was given up on after all attempts failed.
     */
    public void recordRetryExhausted(String reason) {
        retryExhausted.increment();
        exhaustedReasons.computeIfAbsent(reason, k -> new LongAdder()).increment();
        recordFailure(reason);
    }

    /**
     * A URL failed terminally, e.g. {@code "HTTP 404"} or {@code "Blocked"}.
     */
    public void recordFailure(String reason) {
        failureReasons.computeIfAbsent(reason, k -> new LongAdder()).increment();
    }

    public long count(Category category) {
        LongAdder adder = categories.get(category);
        return adder == null ? 0 : adder.sum();
    }

    public long statusCount(int status) {
        LongAdder adder = statuses.get(status);
        return adder == null ? 0 : adder.sum();
    }

    public long total() {
        long total = 0;
        for (var adder : categories.values()) total += adder.sum();
        return total;
    }

    public long retryExhausted() {
        return retryExhausted.sum();
    }

    public Map<Integer, Long> statusHistogram() {
        return snapshot(statuses);
    }

    public Map<String, Long> failureReasons() {
        return snapshot(failureReasons);
    }

    public Map<String, Long> exhaustedReasons() {
        return snapshot(exhaustedReasons);
    }

    private static <K> Map<K, Long> snapshot(Map<K, LongAdder> map) {
        var result = new TreeMap<K, Long>();
        map.forEach((key, adder) -> result.put(key, adder.sum()));
        return result;
    }

    /**
     * Multi-line human readable summary.
     */
    public String summary() {
        var sb = new StringBuilder();
        sb.append("Total Responses: ").append(total()).append('\n');
        for (Category category : Category.values()) {
            if (category == Category.OTHER && count(category) == 0) continue;
            sb.append("  ").append(category.label).append(": ").append(count(category)).append('\n');
        }
        if (statusCount(429) > 0) sb.append("  Rate Limited (429): ").append(statusCount(429)).append('\n');
        if (statusCount(503) > 0) sb.append("  Service Unavailable (503): ").append(statusCount(503)).append('\n');
        if (retryExhausted() > 0) {
            sb.append("Retries Exhausted: ").append(retryExhausted()).append('\n');
            exhaustedReasons().forEach((reason, count) ->
                    sb.append("  ").append(reason).append(": ").append(count).append('\n'));
        }
        var failures = failureReasons();
        if (!failures.isEmpty()) {
            sb.append("Failures:\n");
            failures.forEach((reason, count) -> sb.append("  ").append(reason).append(": ").append(count).append('\n'));
        }
        return sb.toString().stripTrailing();
    }
}
