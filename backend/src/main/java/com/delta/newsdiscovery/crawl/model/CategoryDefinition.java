package com.delta.newsdiscovery.crawl.model;

/**
 * One entry of a site's category catalog.
 *
 * <p>{@code timelineUrlTemplate} may contain the placeholders {@code {categoryId}} and {@code {page}}.
 * A category without a landing URL starts its traversal directly on timeline page 1.
 */
public record CategoryDefinition(
    String slug,
    String displayName,
    Long categoryId,
    String landingUrl,
    String timelineUrlTemplate
) {
    public boolean hasLandingPage() {
        return landingUrl != null && !landingUrl.isBlank();
    }

    public String timelineUrl(int page) {
        if (timelineUrlTemplate == null || timelineUrlTemplate.isBlank()) {
            return null;
        }
        String categoryToken = categoryId == null ? "" : String.valueOf(categoryId);
        return timelineUrlTemplate
            .replace("{categoryId}", categoryToken)
            .replace("{page}", String.valueOf(page));
    }

    public CategoryDefinition withoutLandingPage() {
        return new CategoryDefinition(slug, displayName, categoryId, null, timelineUrlTemplate);
    }

    public CategoryDefinition withTimelineTemplate(String template) {
        return new CategoryDefinition(slug, displayName, categoryId, landingUrl, template);
    }
}
