package com.delta.newsdiscovery.crawl.policy;

public enum HttpFailureMode {
    HALT,
    TOLERATE_AS_EMPTY
}
