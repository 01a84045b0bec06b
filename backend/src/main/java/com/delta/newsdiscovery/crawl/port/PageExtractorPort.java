package com.delta.newsdiscovery.crawl.port;

import com.delta.newsdiscovery.crawl.model.ExtractedLink;

import java.util.List;

@FunctionalInterface
public interface PageExtractorPort {

    /**
     * Returns the candidate article links of a listing page in page order, before any dedup.
     *
     * @throws PageExtractionException when the body cannot be parsed at all
     */
    List<ExtractedLink> extract(String body, String pageUrl) throws PageExtractionException;
}
