package com.delta.newsdiscovery.crawl.source;

import com.delta.newsdiscovery.crawl.dedup.DedupIndex;
import com.delta.newsdiscovery.crawl.engine.DiscoveryRunContext;
import com.delta.newsdiscovery.crawl.model.JobRecord;
import com.delta.newsdiscovery.crawl.model.SourceKind;
import com.delta.newsdiscovery.crawl.model.SourceSummary;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BulkJobSourceTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private Path write(String... lines) throws Exception {
        Path file = tempDir.resolve("backfill.ndjson");
        Files.write(file, List.of(lines), StandardCharsets.UTF_8);
        return file;
    }

    private static List<JobRecord> drain(BulkJobSource source) {
        List<JobRecord> records = new ArrayList<>();
        source.open().forEachRemaining(records::add);
        return records;
    }

    @Test
    void readsNdjsonAndBareUrlLines() throws Exception {
        Path file = write(
            "{\"url\": \"https://nld.com.vn/thoi-su/a-202410050915.htm\", \"lastmod\": \"2024-10-05T09:15:00+07:00\","
                + " \"sitemap_url\": \"https://nld.com.vn/sitemap.xml\", \"image_url\": \"https://nld.com.vn/a.jpg\"}",
            "",
            "https://kenh14.vn/b-202410081230.chn",
            "{\"url\": \"https://plo.vn/c.html\", \"lastmod\": \"2024-10-09\"}"
        );
        BulkJobSource source = new BulkJobSource("backfill", file, DiscoveryRunContext.of(new DedupIndex()), objectMapper);

        List<JobRecord> records = drain(source);

        assertThat(records).extracting(JobRecord::url).containsExactly(
            "https://nld.com.vn/thoi-su/a-202410050915.htm",
            "https://kenh14.vn/b-202410081230.chn",
            "https://plo.vn/c.html"
        );
        JobRecord first = records.get(0);
        assertThat(first.sourceKind()).isEqualTo(SourceKind.BULK_FILE);
        assertThat(first.lastModified()).isEqualTo(Instant.parse("2024-10-05T02:15:00Z"));
        assertThat(first.sitemapUrl()).isEqualTo("https://nld.com.vn/sitemap.xml");
        assertThat(first.imageUrl()).isEqualTo("https://nld.com.vn/a.jpg");
        assertThat(first.sourceName()).isEqualTo("backfill");
        assertThat(records.get(1).lastModified()).isNull();
        assertThat(records.get(2).lastModified()).isEqualTo(Instant.parse("2024-10-09T00:00:00Z"));
        assertThat(source.summary().total()).isEqualTo(3);
    }

    @Test
    void malformedLinesAreSkippedAndCounted() throws Exception {
        Path file = write(
            "{\"url\": \"https://a.test/1\"",
            "{\"lastmod\": \"2024-10-05\"}",
            "{\"url\": \"   \"}",
            "relative/path.htm",
            "https://a.test/2"
        );
        BulkJobSource source = new BulkJobSource("bulk", file, DiscoveryRunContext.of(new DedupIndex()), objectMapper);

        List<JobRecord> records = drain(source);
        SourceSummary summary = source.summary();

        assertThat(records).extracting(JobRecord::url).containsExactly("https://a.test/2");
        assertThat(summary.total()).isEqualTo(5);
        assertThat(summary.skippedInvalid()).isEqualTo(4);
        assertThat(summary.emitted()).isEqualTo(1);
    }

    @Test
    void sharesTheDedupIndexWithOtherSources() throws Exception {
        Path file = write(
            "https://a.test/persisted",
            "https://a.test/seen",
            "https://a.test/new",
            "https://a.test/new",
            "https://a.test/persisted"
        );
        DedupIndex index = new DedupIndex(Set.of("https://a.test/persisted"));
        index.claim("https://a.test/seen");
        BulkJobSource source = new BulkJobSource("bulk", file, DiscoveryRunContext.of(index), objectMapper);

        List<JobRecord> records = drain(source);
        SourceSummary summary = source.summary();

        assertThat(records).extracting(JobRecord::url).containsExactly("https://a.test/new");
        assertThat(summary.skippedExisting()).isEqualTo(1);
        assertThat(summary.skippedDuplicate()).isEqualTo(3);
    }

    @Test
    void missingFileFailsOnOpen() {
        BulkJobSource source = new BulkJobSource(
            "bulk",
            tempDir.resolve("missing.ndjson"),
            DiscoveryRunContext.of(new DedupIndex()),
            objectMapper
        );

        assertThatThrownBy(source::open)
            .isInstanceOf(BulkSourceException.class)
            .hasMessageContaining("missing.ndjson");
    }

    @Test
    void canOnlyBeOpenedOnce() throws Exception {
        BulkJobSource source = new BulkJobSource("bulk", write("https://a.test/1"), DiscoveryRunContext.of(new DedupIndex()), objectMapper);
        source.open();

        assertThatThrownBy(source::open).isInstanceOf(IllegalStateException.class);
    }
}
