package com.delta.newsdiscovery.crawl.extract;

import com.delta.newsdiscovery.crawl.model.ExtractedLink;
import com.delta.newsdiscovery.crawl.port.PageExtractionException;
import com.delta.newsdiscovery.crawl.port.PageExtractorPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Timeline endpoints that answer {@code {"html": "<li>...</li>"}} instead of a page. Plain HTML bodies
 * are passed to the anchor extractor unchanged.
 */
public class JsonHtmlFragmentExtractor implements PageExtractorPort {
    private final ObjectMapper objectMapper;
    private final AnchorLinkExtractor anchors;

    public JsonHtmlFragmentExtractor(ObjectMapper objectMapper, AnchorLinkExtractor anchors) {
        this.objectMapper = objectMapper;
        this.anchors = anchors;
    }

    @Override
    public List<ExtractedLink> extract(String body, String pageUrl) throws PageExtractionException {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        String trimmed = body.trim();
        if (!trimmed.startsWith("{")) {
            return anchors.extract(body, pageUrl);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            throw new PageExtractionException("Invalid JSON timeline response from " + pageUrl, e);
        }
        JsonNode html = root.get("html");
        if (html == null || html.isNull()) {
            throw new PageExtractionException("Timeline response from " + pageUrl + " has no html field");
        }
        return anchors.extract(html.asText(), pageUrl);
    }
}
