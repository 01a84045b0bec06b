package com.delta.newsdiscovery.crawl.extract;

import com.delta.newsdiscovery.crawl.model.ExtractedLink;
import com.delta.newsdiscovery.crawl.port.PageExtractorPort;
import com.delta.newsdiscovery.crawl.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extract article links from an HTML listing page.
 * Listing templates carry the article URL either in {@code href} or in one of the lazy-load data
 * attributes; the first usable attribute of each element wins. Links are kept in page order and
 * repeated links on the same page (thumbnail plus title) are collapsed.
 */
public class AnchorLinkExtractor implements PageExtractorPort {
    static final List<String> LINK_ATTRIBUTES = List.of(
        "href",
        "data-link",
        "data-url",
        "data-io-canonical-url",
        "data-utm-src",
        "data-utm-source"
    );
    private static final String SELECTOR =
        "a[href], [data-link], [data-url], [data-io-canonical-url], [data-utm-src], [data-utm-source]";

    private final String baseUrl;
    private final Pattern articleUrlPattern;

    /**
     * @param baseUrl           site root used to resolve relative links; the page URL is used when null
     * @param articleUrlPattern links not matching it are ignored; every http(s) link is kept when null
     */
    public AnchorLinkExtractor(String baseUrl, Pattern articleUrlPattern) {
        this.baseUrl = baseUrl;
        this.articleUrlPattern = articleUrlPattern;
    }

    @Override
    public List<ExtractedLink> extract(String body, String pageUrl) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        String resolveAgainst = baseUrl == null || baseUrl.isBlank() ? pageUrl : baseUrl;
        Document doc = Jsoup.parse(body, resolveAgainst == null ? "" : resolveAgainst);
        Set<String> urls = new LinkedHashSet<>();
        for (Element element : doc.select(SELECTOR)) {
            String url = firstUsableLink(element, resolveAgainst);
            if (url == null) {
                continue;
            }
            if (articleUrlPattern != null && !articleUrlPattern.matcher(url).find()) {
                continue;
            }
            urls.add(url);
        }
        List<ExtractedLink> links = new ArrayList<>(urls.size());
        for (String url : urls) {
            links.add(ExtractedLink.of(url));
        }
        return links;
    }

    private static String firstUsableLink(Element element, String resolveAgainst) {
        for (String attribute : LINK_ATTRIBUTES) {
            String value = element.attr(attribute);
            if (value == null || value.isBlank()) {
                continue;
            }
            String resolved = UrlNormalizer.resolve(resolveAgainst, value);
            if (resolved != null) {
                return resolved;
            }
        }
        return null;
    }
}
