package com.delta.newsdiscovery.crawl.model;

public enum SourceKind {
    CATEGORY_TIMELINE,
    LANDING_PAGE,
    BULK_FILE
}
