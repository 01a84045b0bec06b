package com.delta.newsdiscovery.crawl.http;

import com.delta.newsdiscovery.config.DiscoveryProperties;
import com.delta.newsdiscovery.crawl.model.FetchOutcome;
import com.delta.newsdiscovery.crawl.util.ReasonCodeClassifier;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class HttpPageFetcherTest {
    private MockWebServer server;
    private ExecutorService executor;
    private PoliteHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxRetries(0);
        properties.setRequestRetryBaseDelayMs(0);
        executor = Executors.newFixedThreadPool(1);
        client = new PoliteHttpClient(properties, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void successfulFetchCarriesBody() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<a href=\"/a-1.htm\">a</a>"));

        FetchOutcome outcome = HttpPageFetcher.forHtml(client).fetch(server.url("/list/1").toString());

        assertThat(outcome.isSuccessful()).isTrue();
        assertThat(outcome.body()).contains("/a-1.htm");
        assertThat(server.takeRequest().getHeader("Accept")).isEqualTo(HttpPageFetcher.HTML_ACCEPT);
    }

    @Test
    void httpErrorBecomesClassifiedFailure() {
        server.enqueue(new MockResponse().setResponseCode(403));
        String url = server.url("/list/2").toString();

        FetchOutcome outcome = HttpPageFetcher.forJson(client).fetch(url);

        assertThat(outcome.isSuccessful()).isFalse();
        assertThat(outcome.url()).isEqualTo(url);
        assertThat(outcome.statusCode()).isEqualTo(403);
        assertThat(outcome.failureKind()).isEqualTo(ReasonCodeClassifier.HTTP_401_403);
    }

    @Test
    void invalidUrlBecomesFailureWithoutStatus() {
        FetchOutcome outcome = HttpPageFetcher.forHtml(client).fetch("not a url");

        assertThat(outcome.isSuccessful()).isFalse();
        assertThat(outcome.statusCode()).isNull();
        assertThat(outcome.failureKind()).isEqualTo(ReasonCodeClassifier.INVALID_URL);
    }
}
