package com.delta.newsdiscovery.crawl.extract;

import com.delta.newsdiscovery.crawl.model.ExtractedLink;
import com.delta.newsdiscovery.crawl.port.PageExtractionException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonHtmlFragmentExtractorTest {
    private final JsonHtmlFragmentExtractor extractor =
        new JsonHtmlFragmentExtractor(new ObjectMapper(), new AnchorLinkExtractor("https://znews.vn", null));

    @Test
    void readsLinksFromTheHtmlField() throws Exception {
        String body = "{\"html\": \"<article><a href=\\\"/bai-mot-post1500001.html\\\">1</a></article>"
            + "<article><a href=\\\"/bai-hai-post1500002.html\\\">2</a></article>\"}";

        List<ExtractedLink> links = extractor.extract(body, "https://znews.vn/xa-hoi/trang2.html");

        assertThat(links).extracting(ExtractedLink::url).containsExactly(
            "https://znews.vn/bai-mot-post1500001.html",
            "https://znews.vn/bai-hai-post1500002.html"
        );
    }

    @Test
    void plainHtmlBodyGoesStraightToTheAnchorExtractor() throws Exception {
        List<ExtractedLink> links = extractor.extract("<a href=\"/a-post1.html\">a</a>", "https://znews.vn/xa-hoi.html");

        assertThat(links).extracting(ExtractedLink::url).containsExactly("https://znews.vn/a-post1.html");
    }

    @Test
    void emptyFragmentIsAnEmptyPage() throws Exception {
        assertThat(extractor.extract("{\"html\": \"\"}", "https://znews.vn/xa-hoi/trang9.html")).isEmpty();
    }

    @Test
    void brokenJsonOrMissingHtmlFailsExtraction() {
        assertThatThrownBy(() -> extractor.extract("{\"html\": ", "https://znews.vn/x"))
            .isInstanceOf(PageExtractionException.class);
        assertThatThrownBy(() -> extractor.extract("{\"items\": []}", "https://znews.vn/x"))
            .isInstanceOf(PageExtractionException.class)
            .hasMessageContaining("no html field");
    }
}
