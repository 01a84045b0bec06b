package com.delta.newsdiscovery.crawl.extract;

public enum ExtractorType {
    ANCHOR,
    JSON_HTML,
    JSON_API
}
