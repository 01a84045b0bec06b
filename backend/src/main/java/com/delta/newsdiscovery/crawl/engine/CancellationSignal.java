package com.delta.newsdiscovery.crawl.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag checked by traversals at page boundaries.
 */
public class CancellationSignal {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
