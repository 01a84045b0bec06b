package com.delta.newsdiscovery.crawl.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Default termination policies of the supported listing styles.
 *
 * <p>Page ceilings can be overridden per source. Duplicate-detection settings cannot, and
 * {@link #TIMELINE_LOOP_SENSITIVE} also keeps its empty-page guard fixed at 2.
 */
public enum SourceVariant {
    TIMELINE_STRICT(10, 2, true, HttpFailureMode.HALT, DuplicateDetection.disabled()),
    TIMELINE_LOOP_SENSITIVE(50, 2, false, HttpFailureMode.HALT, DuplicateDetection.fingerprintOf(3)),
    TIMELINE_TOLERANT(600, 3, true, HttpFailureMode.TOLERATE_AS_EMPTY, DuplicateDetection.disabled()),
    API_PAGED(null, 2, true, HttpFailureMode.HALT, DuplicateDetection.disabled()),
    TIMELINE_LOOP_STRICT(null, 1, true, HttpFailureMode.TOLERATE_AS_EMPTY, DuplicateDetection.fingerprintOf(5));

    private static final Logger log = LoggerFactory.getLogger(SourceVariant.class);

    private final Integer defaultMaxPages;
    private final Integer defaultMaxEmptyPages;
    private final boolean maxEmptyPagesOverridable;
    private final HttpFailureMode httpFailureMode;
    private final DuplicateDetection duplicateDetection;

    SourceVariant(
        Integer defaultMaxPages,
        Integer defaultMaxEmptyPages,
        boolean maxEmptyPagesOverridable,
        HttpFailureMode httpFailureMode,
        DuplicateDetection duplicateDetection
    ) {
        this.defaultMaxPages = defaultMaxPages;
        this.defaultMaxEmptyPages = defaultMaxEmptyPages;
        this.maxEmptyPagesOverridable = maxEmptyPagesOverridable;
        this.httpFailureMode = httpFailureMode;
        this.duplicateDetection = duplicateDetection;
    }

    public TerminationPolicy defaultPolicy() {
        return TerminationPolicy.builder()
            .maxPages(defaultMaxPages)
            .maxEmptyPages(defaultMaxEmptyPages)
            .httpFailureMode(httpFailureMode)
            .duplicateDetection(duplicateDetection)
            .emptyDefinition(EmptyPageDefinition.POST_DEDUP_COUNT)
            .build();
    }

    /**
     * Applies call-site overrides: {@code null} keeps the default, a negative value removes the limit,
     * anything else (zero included) is used as given.
     */
    public TerminationPolicy policy(Integer maxPagesOverride, Integer maxEmptyPagesOverride) {
        TerminationPolicy.Builder builder = defaultPolicy().toBuilder();
        if (maxPagesOverride != null) {
            builder.maxPages(maxPagesOverride < 0 ? null : maxPagesOverride);
        }
        if (maxEmptyPagesOverride != null) {
            if (maxEmptyPagesOverridable) {
                builder.maxEmptyPages(maxEmptyPagesOverride < 0 ? null : maxEmptyPagesOverride);
            } else {
                log.warn("Ignoring max-empty-pages={} for {}: guard is fixed at {}", maxEmptyPagesOverride, name(), defaultMaxEmptyPages);
            }
        }
        return builder.build();
    }

    /**
     * Parses a configured variant name; case and {@code -} versus {@code _} do not matter.
     */
    public static SourceVariant fromConfig(String value) {
        if (value == null || value.isBlank()) {
            throw new PolicyConfigurationException("variant is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (SourceVariant variant : values()) {
            if (variant.name().equals(normalized)) {
                return variant;
            }
        }
        throw new PolicyConfigurationException("Unknown variant '" + value + "'");
    }

    public boolean isMaxEmptyPagesOverridable() {
        return maxEmptyPagesOverridable;
    }
}
