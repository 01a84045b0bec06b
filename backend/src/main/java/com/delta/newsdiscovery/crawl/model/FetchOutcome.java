package com.delta.newsdiscovery.crawl.model;

/**
 * Result of one page fetch attempt: either a body or a failure kind with an optional HTTP status.
 */
public record FetchOutcome(
    String url,
    String body,
    String failureKind,
    Integer statusCode,
    String message
) {
    public static FetchOutcome content(String url, String body) {
        return new FetchOutcome(url, body == null ? "" : body, null, null, null);
    }

    public static FetchOutcome failure(String url, String failureKind, Integer statusCode, String message) {
        return new FetchOutcome(url, null, failureKind, statusCode, message);
    }

    public boolean isSuccessful() {
        return failureKind == null;
    }
}
