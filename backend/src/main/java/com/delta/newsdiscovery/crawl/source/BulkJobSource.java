package com.delta.newsdiscovery.crawl.source;

import com.delta.newsdiscovery.crawl.dedup.ClaimOutcome;
import com.delta.newsdiscovery.crawl.engine.DiscoveryRunContext;
import com.delta.newsdiscovery.crawl.model.JobRecord;
import com.delta.newsdiscovery.crawl.model.SourceKind;
import com.delta.newsdiscovery.crawl.model.SourceSummary;
import com.delta.newsdiscovery.crawl.model.SourceType;
import com.delta.newsdiscovery.crawl.util.UrlNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reads a line-oriented bulk file: NDJSON objects ({@code url}, {@code lastmod}, {@code sitemap_url},
 * {@code image_url}) or bare URLs, one per line. Malformed lines are skipped and logged by line number.
 */
public class BulkJobSource implements JobSource {
    private static final Logger log = LoggerFactory.getLogger(BulkJobSource.class);

    private final String name;
    private final Path file;
    private final DiscoveryRunContext context;
    private final ObjectMapper objectMapper;

    private final AtomicInteger total = new AtomicInteger();
    private final AtomicInteger emitted = new AtomicInteger();
    private final AtomicInteger skippedExisting = new AtomicInteger();
    private final AtomicInteger skippedDuplicate = new AtomicInteger();
    private final AtomicInteger skippedInvalid = new AtomicInteger();
    private boolean opened;

    public BulkJobSource(String name, Path file, DiscoveryRunContext context, ObjectMapper objectMapper) {
        this.name = name;
        this.file = file;
        this.context = context;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public synchronized Iterator<JobRecord> open() {
        if (opened) {
            throw new IllegalStateException("Source " + name + " was already opened");
        }
        opened = true;
        if (file == null || !Files.isRegularFile(file)) {
            throw new BulkSourceException("Bulk file not found: " + file);
        }
        try {
            BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
            log.info("Source {} reading bulk file {}", name, file);
            return new LineIterator(reader);
        } catch (IOException e) {
            throw new BulkSourceException("Unable to open bulk file " + file, e);
        }
    }

    @Override
    public SourceSummary summary() {
        return new SourceSummary(
            name,
            SourceType.BULK,
            total.get(),
            emitted.get(),
            skippedExisting.get(),
            skippedDuplicate.get(),
            skippedInvalid.get(),
            List.of(),
            null
        );
    }

    private JobRecord parseLine(String line, int lineNumber) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        total.incrementAndGet();

        String rawUrl;
        Instant lastModified = null;
        String sitemapUrl = null;
        String imageUrl = null;
        if (trimmed.startsWith("{")) {
            JsonNode node;
            try {
                node = objectMapper.readTree(trimmed);
            } catch (JsonProcessingException e) {
                skippedInvalid.incrementAndGet();
                log.warn("{}:{} skipped, invalid JSON: {}", file, lineNumber, e.getOriginalMessage());
                return null;
            }
            rawUrl = textOrNull(node, "url");
            lastModified = parseLastModified(textOrNull(node, "lastmod"));
            sitemapUrl = textOrNull(node, "sitemap_url");
            imageUrl = textOrNull(node, "image_url");
        } else {
            rawUrl = trimmed;
        }

        String url = UrlNormalizer.normalize(rawUrl);
        if (url == null) {
            skippedInvalid.incrementAndGet();
            log.warn("{}:{} skipped, missing or invalid url", file, lineNumber);
            return null;
        }
        ClaimOutcome claim = context.dedupIndex().tryClaim(url);
        if (claim == ClaimOutcome.ALREADY_PERSISTED) {
            skippedExisting.incrementAndGet();
            return null;
        }
        if (claim == ClaimOutcome.ALREADY_CLAIMED) {
            skippedDuplicate.incrementAndGet();
            return null;
        }
        emitted.incrementAndGet();
        return new JobRecord(
            url,
            null,
            SourceKind.BULK_FILE,
            lastModified,
            context.nextDiscoveryOrder(),
            name,
            sitemapUrl,
            imageUrl
        );
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }

    static Instant parseLastModified(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            if (trimmed.length() == 10) {
                return LocalDate.parse(trimmed).atStartOfDay().toInstant(ZoneOffset.UTC);
            }
            return OffsetDateTime.parse(trimmed).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable lastmod '{}'", value);
            return null;
        }
    }

    private final class LineIterator implements Iterator<JobRecord> {
        private final BufferedReader reader;
        private int lineNumber;
        private JobRecord next;
        private boolean finished;

        private LineIterator(BufferedReader reader) {
            this.reader = reader;
        }

        @Override
        public boolean hasNext() {
            while (next == null && !finished) {
                String line = readLine();
                if (line == null) {
                    finish();
                    break;
                }
                lineNumber++;
                next = parseLine(line, lineNumber);
            }
            return next != null;
        }

        @Override
        public JobRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Bulk file " + file + " is exhausted");
            }
            JobRecord record = next;
            next = null;
            return record;
        }

        private String readLine() {
            try {
                return reader.readLine();
            } catch (IOException e) {
                finish();
                throw new BulkSourceException("Failed reading " + file + " after line " + lineNumber, e);
            }
        }

        private void finish() {
            finished = true;
            try {
                reader.close();
            } catch (IOException e) {
                log.debug("Failed closing {}", file, e);
            }
            log.info(
                "Bulk source {} finished: total={}, emitted={}, skippedExisting={}, skippedDuplicate={}, skippedInvalid={}",
                name,
                total.get(),
                emitted.get(),
                skippedExisting.get(),
                skippedDuplicate.get(),
                skippedInvalid.get()
            );
        }
    }
}
