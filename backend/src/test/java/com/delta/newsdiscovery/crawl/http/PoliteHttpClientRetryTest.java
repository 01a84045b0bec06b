package com.delta.newsdiscovery.crawl.http;

import com.delta.newsdiscovery.config.DiscoveryProperties;
import com.delta.newsdiscovery.crawl.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientRetryTest {
    private MockWebServer server;
    private ExecutorService executor;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private PoliteHttpClient newClient(int maxRetries) {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.setGlobalConcurrency(1);
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxRetries(maxRetries);
        properties.setRequestRetryBaseDelayMs(1);
        properties.setRequestRetryMaxDelayMs(5);
        properties.setUserAgent("news-discovery-test/1.0");
        executor = Executors.newFixedThreadPool(1);
        return new PoliteHttpClient(properties, executor);
    }

    @Test
    void retriesServerErrorsUntilSuccess() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>ok</html>"));
        server.start();

        HttpFetchResult result = newClient(2).get(server.url("/thoi-su.htm").toString(), "text/html");

        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("<html>ok</html>");
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void givesUpAfterConfiguredRetries() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(502));
        server.start();

        HttpFetchResult result = newClient(1).get(server.url("/trang-2.htm").toString(), "text/html");

        assertThat(result.statusCode()).isEqualTo(502);
        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void doesNotRetryClientErrors() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(404).setBody("not found"));
        server.start();

        HttpFetchResult result = newClient(2).get(server.url("/missing.htm").toString(), "text/html");

        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void sendsConfiguredHeaders() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));
        server.start();

        newClient(0).get(server.url("/api").toString(), "application/json");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("User-Agent")).isEqualTo("news-discovery-test/1.0");
        assertThat(request.getHeader("Accept")).isEqualTo("application/json");
    }

    @Test
    void nonHttpUrlIsRejectedWithoutRequest() {
        HttpFetchResult result = newClient(2).get("ftp://example.test/file", "text/html");

        assertThat(result.errorCode()).isEqualTo("invalid_url");
        assertThat(result.attempts()).isEqualTo(1);
    }
}
