package com.delta.newsdiscovery.crawl.dedup;

public enum ClaimOutcome {
    CLAIMED,
    ALREADY_PERSISTED,
    ALREADY_CLAIMED
}
