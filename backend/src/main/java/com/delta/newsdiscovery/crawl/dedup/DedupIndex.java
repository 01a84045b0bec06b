package com.delta.newsdiscovery.crawl.dedup;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Run-wide claim set: a read-only snapshot of already ingested URLs plus the URLs claimed during
 * this run. Uniqueness is global, so a URL listed under two categories is emitted once, by whichever
 * traversal claims it first. Safe for concurrent claims.
 */
public class DedupIndex {
    private final Set<String> persistedUrls;
    private final Set<String> seenThisRun = ConcurrentHashMap.newKeySet();
    private final AtomicInteger newlyClaimed = new AtomicInteger();

    public DedupIndex() {
        this(Set.of());
    }

    public DedupIndex(Collection<String> persistedUrls) {
        this.persistedUrls = persistedUrls == null ? Set.of() : Set.copyOf(persistedUrls);
    }

    public boolean contains(String url) {
        if (url == null) {
            return false;
        }
        return seenThisRun.contains(url) || persistedUrls.contains(url);
    }

    /**
     * Returns {@code true} iff the URL was not persisted and had not been claimed yet in this run.
     */
    public boolean claim(String url) {
        return tryClaim(url) == ClaimOutcome.CLAIMED;
    }

    /**
     * Claims the URL and reports why it was refused, if it was. The first sighting of a persisted URL
     * is {@link ClaimOutcome#ALREADY_PERSISTED}; every later sighting is {@link ClaimOutcome#ALREADY_CLAIMED}.
     */
    public ClaimOutcome tryClaim(String url) {
        if (url == null) {
            throw new IllegalArgumentException("url must not be null");
        }
        if (!seenThisRun.add(url)) {
            return ClaimOutcome.ALREADY_CLAIMED;
        }
        if (persistedUrls.contains(url)) {
            return ClaimOutcome.ALREADY_PERSISTED;
        }
        newlyClaimed.incrementAndGet();
        return ClaimOutcome.CLAIMED;
    }

    public int size() {
        return persistedUrls.size() + newlyClaimed.get();
    }

    public int persistedSize() {
        return persistedUrls.size();
    }

    public int claimedThisRun() {
        return newlyClaimed.get();
    }
}
