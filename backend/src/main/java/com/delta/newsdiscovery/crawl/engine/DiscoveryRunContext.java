package com.delta.newsdiscovery.crawl.engine;

import com.delta.newsdiscovery.crawl.dedup.DedupIndex;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Run-scoped collaborators shared by every source of one discovery run.
 */
public class DiscoveryRunContext {
    private final DedupIndex dedupIndex;
    private final CancellationSignal cancellation;
    private final TraversalListener listener;
    private final AtomicLong discoverySequence = new AtomicLong();

    public DiscoveryRunContext(DedupIndex dedupIndex, CancellationSignal cancellation, TraversalListener listener) {
        this.dedupIndex = Objects.requireNonNull(dedupIndex, "dedupIndex");
        this.cancellation = cancellation == null ? new CancellationSignal() : cancellation;
        this.listener = listener == null ? TraversalListener.NOOP : listener;
    }

    public static DiscoveryRunContext of(DedupIndex dedupIndex) {
        return new DiscoveryRunContext(dedupIndex, null, null);
    }

    public DedupIndex dedupIndex() {
        return dedupIndex;
    }

    public CancellationSignal cancellation() {
        return cancellation;
    }

    public TraversalListener listener() {
        return listener;
    }

    /**
     * Next value of the run-wide, strictly increasing discovery order. Starts at 1.
     */
    public long nextDiscoveryOrder() {
        return discoverySequence.incrementAndGet();
    }
}
