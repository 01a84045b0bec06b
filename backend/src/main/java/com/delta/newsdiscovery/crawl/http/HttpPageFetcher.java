package com.delta.newsdiscovery.crawl.http;

import com.delta.newsdiscovery.crawl.model.FetchOutcome;
import com.delta.newsdiscovery.crawl.model.HttpFetchResult;
import com.delta.newsdiscovery.crawl.port.PageFetchPort;
import com.delta.newsdiscovery.crawl.util.ReasonCodeClassifier;

/**
 * Listing fetches over {@link PoliteHttpClient}. Any non-2xx answer or transport error becomes a
 * failed {@link FetchOutcome} carrying a reason code.
 */
public class HttpPageFetcher implements PageFetchPort {
    static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/json;q=0.9,*/*;q=0.8";
    static final String JSON_ACCEPT = "application/json,text/plain;q=0.9,*/*;q=0.8";

    private final PoliteHttpClient httpClient;
    private final String acceptHeader;

    public HttpPageFetcher(PoliteHttpClient httpClient, String acceptHeader) {
        this.httpClient = httpClient;
        this.acceptHeader = acceptHeader;
    }

    public static HttpPageFetcher forHtml(PoliteHttpClient httpClient) {
        return new HttpPageFetcher(httpClient, HTML_ACCEPT);
    }

    public static HttpPageFetcher forJson(PoliteHttpClient httpClient) {
        return new HttpPageFetcher(httpClient, JSON_ACCEPT);
    }

    @Override
    public FetchOutcome fetch(String url) {
        HttpFetchResult result = httpClient.get(url, acceptHeader);
        if (result.isSuccessful()) {
            return FetchOutcome.content(result.finalUrlOrRequested(), result.body());
        }
        if (result.errorCode() != null) {
            return FetchOutcome.failure(
                url,
                ReasonCodeClassifier.fromErrorCode(result.errorCode(), result.errorMessage()),
                null,
                result.errorMessage()
            );
        }
        return FetchOutcome.failure(
            url,
            ReasonCodeClassifier.fromHttpStatus(result.statusCode()),
            result.statusCode(),
            "HTTP " + result.statusCode()
        );
    }
}
