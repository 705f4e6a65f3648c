package org.netpreserve.forumminer.extract;

import org.jetbrains.annotations.Nullable;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An ordered list of ways to pull one field out of a page. The strategy that last produced a value is tried first,
 * so once the markup changes the chain settles on whichever strategy still works. When none do the chain falls back
 * to its sentinel value instead of failing.
 *
 * @param <T> the extracted value type
 */
public class ExtractionChain<T> {
    private static final Logger log = LoggerFactory.getLogger(ExtractionChain.class);
    private final String name;
    private final List<Named<T>> strategies;
    private final T sentinel;
    private final boolean optional;
    private volatile int lastSuccessful = 0;
    private final AtomicLong misses = new AtomicLong();

    @FunctionalInterface
    public interface Strategy<T> {
        @Nullable T extract(Element root);
    }

    private record Named<T>(String name, Strategy<T> strategy) {
    }

    private ExtractionChain(String name, List<Named<T>> strategies, T sentinel, boolean optional) {
        if (strategies.isEmpty()) throw new IllegalArgumentException("chain " + name + " has no strategies");
        this.name = name;
        this.strategies = List.copyOf(strategies);
        this.sentinel = sentinel;
        this.optional = optional;
    }

    public static <T> Builder<T> builder(String name) {
        return new Builder<>(name);
    }

    /**
     * Returns the first non-empty value, or the sentinel if every strategy came up empty.
     */
    public T extract(Element root) {
        return tryExtract(root).orElse(sentinel);
    }

    /**
     * Like {@link #extract(Element)} but returns empty rather than the sentinel, for callers that need to tell a
     * real value from the fallback.
     */
    public Optional<T> tryExtract(Element root) {
        int preferred = lastSuccessful;
        T value = apply(preferred, root);
        if (!isEmpty(value)) return Optional.of(value);

        for (int i = 0; i < strategies.size(); i++) {
            if (i == preferred) continue;
            value = apply(i, root);
            if (!isEmpty(value)) {
                if (i != lastSuccessful) {
                    log.atInfo().addKeyValue("chain", name).addKeyValue("strategy", strategies.get(i).name())
                            .log("Switched extraction strategy");
                }
                lastSuccessful = i;
                return Optional.of(value);
            }
        }

        if (optional) {
            log.atDebug().addKeyValue("chain", name).log("No value found");
            return Optional.empty();
        }
        misses.incrementAndGet();
        log.atWarn().addKeyValue("chain", name).log("All extraction strategies failed");
        return Optional.empty();
    }

    private @Nullable T apply(int index, Element root) {
        var named = strategies.get(index);
        try {
            return named.strategy().extract(root);
        } catch (RuntimeException e) {
            log.atDebug().addKeyValue("chain", name).addKeyValue("strategy", named.name())
                    .setCause(e).log("Extraction strategy threw");
            return null;
        }
    }

    /**
     * Null, blank strings, empty collections and maps, and non-positive numbers all count as empty.
     */
    static boolean isEmpty(@Nullable Object value) {
        if (value == null) return true;
        if (value instanceof CharSequence s) return s.toString().isBlank();
        if (value instanceof Collection<?> c) return c.isEmpty();
        if (value instanceof Map<?, ?> m) return m.isEmpty();
        if (value instanceof Number n) return n.doubleValue() <= 0;
        return false;
    }

    public String name() {
        return name;
    }

    /**
     * Name of the strategy that will be tried first next time.
     */
    public String preferredStrategy() {
        return strategies.get(lastSuccessful).name();
    }

    public long misses() {
        return misses.get();
    }

    public static class Builder<T> {
        private final String name;
        private final List<Named<T>> strategies = new ArrayList<>();
        private boolean optional;

        private Builder(String name) {
            this.name = name;
        }

        public Builder<T> strategy(String name, Strategy<T> strategy) {
            strategies.add(new Named<>(name, strategy));
            return this;
        }

        /**
         * Marks the field as often legitimately absent. Finding nothing is then not counted as a miss.
         */
        public Builder<T> optional() {
            this.optional = true;
            return this;
        }

        public ExtractionChain<T> orElse(T sentinel) {
            return new ExtractionChain<>(name, strategies, sentinel, optional);
        }
    }
}
