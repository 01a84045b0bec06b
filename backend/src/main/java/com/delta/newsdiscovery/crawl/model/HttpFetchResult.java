package com.delta.newsdiscovery.crawl.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    int attempts,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    public HttpFetchResult withAttempts(int attempts) {
        return new HttpFetchResult(
            requestedUrl,
            finalUri,
            statusCode,
            body,
            contentType,
            fetchedAt,
            duration,
            attempts,
            errorCode,
            errorMessage
        );
    }
}
