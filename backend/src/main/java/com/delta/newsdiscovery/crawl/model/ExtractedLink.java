package com.delta.newsdiscovery.crawl.model;

import java.time.Instant;

public record ExtractedLink(String url, Instant lastModified) {

    public static ExtractedLink of(String url) {
        return new ExtractedLink(url, null);
    }
}
