package com.delta.newsdiscovery.crawl.policy;

/**
 * Why a category traversal stopped. {@link #outcome()} separates an exhausted archive (expected)
 * from a blocked source (actionable) and from a configured ceiling (tunable).
 */
public enum TerminationReason {
    FETCH_FAILURE(Outcome.BLOCKED),
    DUPLICATE_PAGINATION(Outcome.EXHAUSTED),
    EMPTY_PAGE_LIMIT(Outcome.EXHAUSTED),
    MAX_PAGES_REACHED(Outcome.CEILING),
    CATALOG_EXHAUSTED(Outcome.EXHAUSTED),
    CANCELLED(Outcome.CANCELLED);

    private final Outcome outcome;

    TerminationReason(Outcome outcome) {
        this.outcome = outcome;
    }

    public Outcome outcome() {
        return outcome;
    }

    public enum Outcome {
        EXHAUSTED,
        BLOCKED,
        CEILING,
        CANCELLED
    }
}
