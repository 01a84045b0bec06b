package com.delta.newsdiscovery.crawl.model;

import java.time.Instant;
import java.util.List;

public record DiscoveryRunSummary(
    long runId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    long emittedCount,
    List<SourceSummary> sources,
    int exitCode
) {}
