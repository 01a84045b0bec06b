package com.delta.newsdiscovery.crawl.output;

import com.delta.newsdiscovery.crawl.model.JobRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends one JSON object per record. {@code url}, {@code lastmod}, {@code sitemap_url} and
 * {@code image_url} use the names the bulk reader accepts, so a jobs file can be replayed as a bulk source.
 */
public class NdjsonJobRecordWriter implements JobRecordSink, Closeable {
    private final Path file;
    private final ObjectMapper objectMapper;
    private final BufferedWriter writer;
    private long written;

    public NdjsonJobRecordWriter(Path file, ObjectMapper objectMapper) throws IOException {
        this.file = file;
        this.objectMapper = objectMapper;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.writer = Files.newBufferedWriter(
            file,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND
        );
    }

    @Override
    public synchronized void accept(JobRecord record) {
        try {
            writer.write(objectMapper.writeValueAsString(toLine(record)));
            writer.newLine();
            written++;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize job record " + record.url(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write to " + file, e);
        }
    }

    public synchronized long written() {
        return written;
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }

    private static Map<String, Object> toLine(JobRecord record) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("url", record.url());
        line.put("lastmod", record.lastModified() == null ? null : record.lastModified().toString());
        line.put("sitemap_url", record.sitemapUrl());
        line.put("image_url", record.imageUrl());
        line.put("category", record.originCategory());
        line.put("source", record.sourceName());
        line.put("source_kind", record.sourceKind().name());
        line.put("discovery_order", record.discoveryOrder());
        return line;
    }
}
