package com.delta.newsdiscovery.crawl.extract;

import com.delta.newsdiscovery.crawl.model.ExtractedLink;
import com.delta.newsdiscovery.crawl.port.PageExtractionException;
import com.delta.newsdiscovery.crawl.port.PageExtractorPort;
import com.delta.newsdiscovery.crawl.util.UrlNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Paged JSON API listing: {@code {"data": {"contents": [{"url": ..., "update_time": <epoch seconds>}]}}}.
 * A response without {@code data.contents} is an empty page. An {@code update_time} that is not a
 * representable epoch second leaves the link without a modification time.
 */
public class JsonApiContentsExtractor implements PageExtractorPort {
    private static final Logger log = LoggerFactory.getLogger(JsonApiContentsExtractor.class);

    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public JsonApiContentsExtractor(ObjectMapper objectMapper, String baseUrl) {
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
    }

    @Override
    public List<ExtractedLink> extract(String body, String pageUrl) throws PageExtractionException {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PageExtractionException("Invalid JSON API response from " + pageUrl, e);
        }
        JsonNode contents = root.path("data").path("contents");
        if (contents.isMissingNode() || contents.isNull()) {
            return List.of();
        }
        if (!contents.isArray()) {
            throw new PageExtractionException("data.contents from " + pageUrl + " is not an array");
        }
        String resolveAgainst = baseUrl == null || baseUrl.isBlank() ? pageUrl : baseUrl;
        List<ExtractedLink> links = new ArrayList<>(contents.size());
        for (JsonNode item : contents) {
            String rawUrl = item.path("url").asText(null);
            if (rawUrl == null || rawUrl.isBlank()) {
                continue;
            }
            String url = UrlNormalizer.resolve(resolveAgainst, rawUrl);
            links.add(new ExtractedLink(url == null ? rawUrl : url, epochSeconds(item.get("update_time"))));
        }
        return links;
    }

    private static Instant epochSeconds(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        try {
            if (value.canConvertToLong()) {
                return Instant.ofEpochSecond(value.asLong());
            }
            String text = value.asText("").trim();
            if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
                return Instant.ofEpochSecond(Long.parseLong(text));
            }
        } catch (NumberFormatException | DateTimeException e) {
            log.debug("Ignoring update_time {}: {}", value, e.getMessage());
        }
        return null;
    }
}
