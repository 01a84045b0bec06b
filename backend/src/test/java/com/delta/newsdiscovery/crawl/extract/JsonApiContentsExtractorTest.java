package com.delta.newsdiscovery.crawl.extract;

import com.delta.newsdiscovery.crawl.model.ExtractedLink;
import com.delta.newsdiscovery.crawl.port.PageExtractionException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonApiContentsExtractorTest {
    private final JsonApiContentsExtractor extractor = new JsonApiContentsExtractor(new ObjectMapper(), "https://plo.vn");

    @Test
    void readsUrlsAndEpochUpdateTimes() throws Exception {
        String body = """
            {"data": {"contents": [
              {"url": "https://plo.vn/phap-luat/a-post800001.html", "update_time": 1728100000},
              {"url": "/phap-luat/b-post800002.html", "update_time": "1728200000"},
              {"url": "/phap-luat/c-post800003.html"},
              {"title": "no url"}
            ]}}
            """;

        List<ExtractedLink> links = extractor.extract(body, "https://api.plo.vn/api/v1/zone/12?page=2");

        assertThat(links).extracting(ExtractedLink::url).containsExactly(
            "https://plo.vn/phap-luat/a-post800001.html",
            "https://plo.vn/phap-luat/b-post800002.html",
            "https://plo.vn/phap-luat/c-post800003.html"
        );
        assertThat(links.get(0).lastModified()).isEqualTo(Instant.ofEpochSecond(1728100000L));
        assertThat(links.get(1).lastModified()).isEqualTo(Instant.ofEpochSecond(1728200000L));
        assertThat(links.get(2).lastModified()).isNull();
    }

    @Test
    void unrepresentableUpdateTimeLeavesLinkWithoutTimestamp() throws Exception {
        String body = """
            {"data": {"contents": [
              {"url": "/phap-luat/a-post800001.html", "update_time": "99999999999999999999"},
              {"url": "/phap-luat/b-post800002.html", "update_time": 9223372036854775807}
            ]}}
            """;

        List<ExtractedLink> links = extractor.extract(body, "https://api.plo.vn/api/v1/zone/12?page=1");

        assertThat(links).extracting(ExtractedLink::url).containsExactly(
            "https://plo.vn/phap-luat/a-post800001.html",
            "https://plo.vn/phap-luat/b-post800002.html"
        );
        assertThat(links).extracting(ExtractedLink::lastModified).containsOnlyNulls();
    }

    @Test
    void unresolvableUrlIsPassedThroughRaw() throws Exception {
        List<ExtractedLink> links = extractor.extract(
            "{\"data\": {\"contents\": [{\"url\": \"ftp://plo.vn/file\"}]}}",
            "https://api.plo.vn/page"
        );

        assertThat(links).extracting(ExtractedLink::url).containsExactly("ftp://plo.vn/file");
    }

    @Test
    void missingContentsIsAnEmptyPage() throws Exception {
        assertThat(extractor.extract("{\"data\": {}}", "https://api.plo.vn/page")).isEmpty();
        assertThat(extractor.extract("{\"error\": \"no data\"}", "https://api.plo.vn/page")).isEmpty();
    }

    @Test
    void malformedResponseFailsExtraction() {
        assertThatThrownBy(() -> extractor.extract("<html>", "https://api.plo.vn/page"))
            .isInstanceOf(PageExtractionException.class);
        assertThatThrownBy(() -> extractor.extract("{\"data\": {\"contents\": {}}}", "https://api.plo.vn/page"))
            .isInstanceOf(PageExtractionException.class)
            .hasMessageContaining("not an array");
    }
}
