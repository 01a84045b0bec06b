package com.delta.newsdiscovery.crawl.policy;

import java.util.Objects;

/**
 * Stop conditions for one category traversal.
 *
 * <p>A {@code null} {@code maxPages} means unbounded and a {@code null} {@code maxEmptyPages} disables
 * the empty-page guard. {@code maxPages = 0} is a real ceiling: the traversal stops after its first page.
 */
public final class TerminationPolicy {
    private final Integer maxPages;
    private final Integer maxEmptyPages;
    private final HttpFailureMode httpFailureMode;
    private final DuplicateDetection duplicateDetection;
    private final EmptyPageDefinition emptyDefinition;

    private TerminationPolicy(Builder builder) {
        this.maxPages = builder.maxPages;
        this.maxEmptyPages = builder.maxEmptyPages;
        this.httpFailureMode = Objects.requireNonNullElse(builder.httpFailureMode, HttpFailureMode.HALT);
        this.duplicateDetection = Objects.requireNonNullElse(builder.duplicateDetection, DuplicateDetection.disabled());
        this.emptyDefinition = Objects.requireNonNullElse(builder.emptyDefinition, EmptyPageDefinition.POST_DEDUP_COUNT);
        validate();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .maxPages(maxPages)
            .maxEmptyPages(maxEmptyPages)
            .httpFailureMode(httpFailureMode)
            .duplicateDetection(duplicateDetection)
            .emptyDefinition(emptyDefinition);
    }

    private void validate() {
        if (maxPages != null && maxPages < 0) {
            throw new PolicyConfigurationException("maxPages must be >= 0 when set, got " + maxPages);
        }
        if (maxEmptyPages != null && maxEmptyPages < 0) {
            throw new PolicyConfigurationException("maxEmptyPages must be >= 0 when set, got " + maxEmptyPages);
        }
        if (duplicateDetection.enabled() && duplicateDetection.fingerprintSize() <= 0) {
            throw new PolicyConfigurationException(
                "fingerprint size must be positive when duplicate detection is enabled, got "
                    + duplicateDetection.fingerprintSize()
            );
        }
    }

    public Integer maxPages() {
        return maxPages;
    }

    public Integer maxEmptyPages() {
        return maxEmptyPages;
    }

    public HttpFailureMode httpFailureMode() {
        return httpFailureMode;
    }

    public DuplicateDetection duplicateDetection() {
        return duplicateDetection;
    }

    public EmptyPageDefinition emptyDefinition() {
        return emptyDefinition;
    }

    public boolean hasPageCeiling() {
        return maxPages != null;
    }

    public boolean hasEmptyPageGuard() {
        return maxEmptyPages != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TerminationPolicy that)) {
            return false;
        }
        return Objects.equals(maxPages, that.maxPages)
            && Objects.equals(maxEmptyPages, that.maxEmptyPages)
            && httpFailureMode == that.httpFailureMode
            && duplicateDetection.equals(that.duplicateDetection)
            && emptyDefinition == that.emptyDefinition;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxPages, maxEmptyPages, httpFailureMode, duplicateDetection, emptyDefinition);
    }

    @Override
    public String toString() {
        return "TerminationPolicy{maxPages=" + (maxPages == null ? "unbounded" : maxPages)
            + ", maxEmptyPages=" + (maxEmptyPages == null ? "off" : maxEmptyPages)
            + ", httpFailureMode=" + httpFailureMode
            + ", duplicateDetection=" + (duplicateDetection.enabled() ? "size=" + duplicateDetection.fingerprintSize() : "off")
            + ", emptyDefinition=" + emptyDefinition + "}";
    }

    public static final class Builder {
        private Integer maxPages;
        private Integer maxEmptyPages;
        private HttpFailureMode httpFailureMode;
        private DuplicateDetection duplicateDetection;
        private EmptyPageDefinition emptyDefinition;

        private Builder() {
        }

        public Builder maxPages(Integer maxPages) {
            this.maxPages = maxPages;
            return this;
        }

        public Builder maxEmptyPages(Integer maxEmptyPages) {
            this.maxEmptyPages = maxEmptyPages;
            return this;
        }

        public Builder httpFailureMode(HttpFailureMode httpFailureMode) {
            this.httpFailureMode = httpFailureMode;
            return this;
        }

        public Builder duplicateDetection(DuplicateDetection duplicateDetection) {
            this.duplicateDetection = duplicateDetection;
            return this;
        }

        public Builder emptyDefinition(EmptyPageDefinition emptyDefinition) {
            this.emptyDefinition = emptyDefinition;
            return this;
        }

        public TerminationPolicy build() {
            return new TerminationPolicy(this);
        }
    }
}
