package com.delta.newsdiscovery.crawl.model;

public enum SourceType {
    CATEGORY,
    BULK
}
