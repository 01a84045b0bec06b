package com.delta.newsdiscovery.crawl;

import com.delta.newsdiscovery.config.DiscoveryProperties;
import com.delta.newsdiscovery.crawl.model.SourceType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiscoveryPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("delta-news-discovery/0.1"));
    }

    @Test
    void concurrencyDelayAndRetriesAreClamped() {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.setGlobalConcurrency(0);
        properties.setPerHostDelayMs(-10);
        properties.setRequestMaxRetries(-3);
        properties.setRequestTimeoutSeconds(0);
        assertEquals(1, properties.getGlobalConcurrency());
        assertEquals(1, properties.getPerHostDelayMs());
        assertEquals(0, properties.getRequestMaxRetries());
        assertEquals(1, properties.getRequestTimeoutSeconds());
    }

    @Test
    void sourceDefaults() {
        DiscoveryProperties.Source source = new DiscoveryProperties.Source();
        source.setName("thanhnien");
        source.setType(null);
        assertEquals(SourceType.CATEGORY, source.getType());
        assertEquals("thanhnien", source.getSite());
        assertEquals("ANCHOR", source.getExtractor());
        assertTrue(source.isIncludeLandingPage());
    }
}
