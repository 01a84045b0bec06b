package com.delta.newsdiscovery.crawl.port;

import com.delta.newsdiscovery.crawl.model.FetchOutcome;

/**
 * One synchronous, possibly blocking fetch attempt. Implementations may retry internally; callers see a
 * single success or failure and may call again for the same URL.
 */
@FunctionalInterface
public interface PageFetchPort {
    FetchOutcome fetch(String url);
}
