package com.delta.newsdiscovery.crawl.policy;

/**
 * Which count decides whether a page was empty. The two diverge on pages full of already-known URLs.
 */
public enum EmptyPageDefinition {
    POST_DEDUP_COUNT,
    RAW_EXTRACTED_COUNT
}
