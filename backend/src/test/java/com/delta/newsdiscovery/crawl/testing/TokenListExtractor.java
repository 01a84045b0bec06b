package com.delta.newsdiscovery.crawl.testing;

import com.delta.newsdiscovery.crawl.model.ExtractedLink;
import com.delta.newsdiscovery.crawl.port.PageExtractionException;
import com.delta.newsdiscovery.crawl.port.PageExtractorPort;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a body such as {@code "a,b,c"} as links {@code https://news.test/a} and so on.
 * A token starting with {@code !} is passed through raw. The body {@code boom} fails extraction and
 * the body {@code crash} throws an unchecked exception.
 */
public class TokenListExtractor implements PageExtractorPort {
    public static final String BASE = "https://news.test/";

    public static String url(String token) {
        return BASE + token;
    }

    @Override
    public List<ExtractedLink> extract(String body, String pageUrl) throws PageExtractionException {
        if ("boom".equals(body)) {
            throw new PageExtractionException("unparseable listing " + pageUrl);
        }
        if ("crash".equals(body)) {
            throw new IllegalStateException("extractor bug on " + pageUrl);
        }
        List<ExtractedLink> links = new ArrayList<>();
        if (body == null || body.isBlank()) {
            return links;
        }
        for (String token : body.split(",")) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            links.add(ExtractedLink.of(trimmed.startsWith("!") ? trimmed.substring(1) : url(trimmed)));
        }
        return links;
    }
}
