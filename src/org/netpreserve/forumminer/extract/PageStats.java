package org.netpreserve.forumminer.extract;

/**
 * Reply and view counters shown on a thread page.
 */
public record PageStats(int replies, int views) {
    public static final PageStats NONE = new PageStats(0, 0);
}
