package com.delta.newsdiscovery.crawl.model;

import com.delta.newsdiscovery.crawl.policy.TerminationReason;

public record TraversalReport(
    String sourceName,
    String categorySlug,
    int pagesVisited,
    int emitted,
    int skippedExisting,
    int skippedDuplicate,
    int skippedInvalid,
    int extractionFailures,
    int fetchFailures,
    TerminationReason terminationReason
) {
    public boolean blocked() {
        return terminationReason == TerminationReason.FETCH_FAILURE;
    }
}
