package com.delta.newsdiscovery.crawl.model;

import java.util.List;

/**
 * Counters of one source after it was drained. {@code failure} is set when the source ended early
 * because it threw.
 */
public record SourceSummary(
    String sourceName,
    SourceType type,
    int total,
    int emitted,
    int skippedExisting,
    int skippedDuplicate,
    int skippedInvalid,
    List<TraversalReport> categories,
    String failure
) {
    public SourceSummary {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    public static SourceSummary ofCategories(String sourceName, List<TraversalReport> reports) {
        int emitted = 0;
        int existing = 0;
        int duplicate = 0;
        int invalid = 0;
        for (TraversalReport report : reports) {
            emitted += report.emitted();
            existing += report.skippedExisting();
            duplicate += report.skippedDuplicate();
            invalid += report.skippedInvalid();
        }
        int total = emitted + existing + duplicate + invalid;
        return new SourceSummary(sourceName, SourceType.CATEGORY, total, emitted, existing, duplicate, invalid, reports, null);
    }

    public SourceSummary withFailure(String message) {
        return new SourceSummary(
            sourceName,
            type,
            total,
            emitted,
            skippedExisting,
            skippedDuplicate,
            skippedInvalid,
            categories,
            message
        );
    }

    public boolean failed() {
        return failure != null;
    }

    public boolean anyCategoryBlocked() {
        return categories.stream().anyMatch(TraversalReport::blocked);
    }
}
