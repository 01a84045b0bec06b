package com.delta.newsdiscovery.crawl.model;

import java.util.List;

/**
 * A configured source with its effective policy. Policy fields are {@code null} for bulk sources and
 * for limits that are switched off.
 */
public record ConfiguredSourceView(
    String name,
    SourceType type,
    String site,
    String variant,
    List<String> categories,
    Integer maxPages,
    Integer maxEmptyPages,
    String httpFailureMode,
    Integer fingerprintSize,
    String emptyDefinition
) {}
