package com.delta.newsdiscovery.crawl.model;

import java.time.Instant;

/**
 * A discovered article URL plus the provenance the downstream fetch-and-parse stage needs.
 * {@code url} is always absolute and normalized; it appears at most once in a run's output.
 */
public record JobRecord(
    String url,
    String originCategory,
    SourceKind sourceKind,
    Instant lastModified,
    long discoveryOrder,
    String sourceName,
    String sitemapUrl,
    String imageUrl
) {
    public static JobRecord fromCategory(
        String url,
        String originCategory,
        SourceKind sourceKind,
        Instant lastModified,
        long discoveryOrder,
        String sourceName
    ) {
        return new JobRecord(url, originCategory, sourceKind, lastModified, discoveryOrder, sourceName, null, null);
    }
}
