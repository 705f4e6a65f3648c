package org.netpreserve.forumminer.extract;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.forumminer.util.Url;

/**
 * A thread listed on a board page, with the counters shown in its row when the board displays them.
 */
public record ThreadLink(Url url, @Nullable Integer replies, @Nullable Integer views) {
    public ThreadLink(Url url) {
        this(url, null, null);
    }
}
