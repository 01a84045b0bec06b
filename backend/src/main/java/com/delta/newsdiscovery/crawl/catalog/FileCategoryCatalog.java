package com.delta.newsdiscovery.crawl.catalog;

import com.delta.newsdiscovery.crawl.model.CategoryDefinition;
import com.delta.newsdiscovery.crawl.port.CatalogException;
import com.delta.newsdiscovery.crawl.port.CategoryCatalogPort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Category catalog stored as a JSON array or a CSV file with the same column names.
 * Recognised columns: {@code slug}, {@code name}, one of {@code category_id} / {@code zone_id} /
 * {@code timeline_id}, {@code landing_url}, {@code timeline_url_template}.
 */
public class FileCategoryCatalog implements CategoryCatalogPort {
    private static final String[] ID_COLUMNS = {"category_id", "zone_id", "timeline_id"};

    private final Path file;
    private final List<String> selectedSlugs;
    private final ObjectMapper objectMapper;

    /**
     * @param selectedSlugs slugs to keep, in catalog order; empty keeps the whole catalog
     */
    public FileCategoryCatalog(Path file, List<String> selectedSlugs, ObjectMapper objectMapper) {
        this.file = file;
        this.selectedSlugs = selectedSlugs == null ? List.of() : List.copyOf(selectedSlugs);
        this.objectMapper = objectMapper;
    }

    @Override
    public List<CategoryDefinition> load() {
        if (file == null || !Files.isRegularFile(file)) {
            throw new CatalogException("Category catalog not found: " + file);
        }
        List<CategoryDefinition> all = isCsv() ? readCsv() : readJson();
        return select(indexBySlug(all));
    }

    private boolean isCsv() {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv");
    }

    private List<CategoryDefinition> readJson() {
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new CatalogException("Unable to parse category catalog " + file, e);
        }
        if (root == null || !root.isArray()) {
            throw new CatalogException("Category catalog " + file + " must be a JSON array");
        }
        List<CategoryDefinition> categories = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            index++;
            Map<String, String> columns = new LinkedHashMap<>();
            node.fields().forEachRemaining(field -> {
                JsonNode value = field.getValue();
                if (value != null && !value.isNull()) {
                    columns.put(field.getKey().toLowerCase(Locale.ROOT), value.asText());
                }
            });
            categories.add(toCategory(columns, "entry " + index));
        }
        return categories;
    }

    private List<CategoryDefinition> readCsv() {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        List<CategoryDefinition> categories = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            for (CSVRecord record : parser) {
                Map<String, String> columns = new LinkedHashMap<>();
                for (Map.Entry<String, String> entry : record.toMap().entrySet()) {
                    if (entry.getKey() != null) {
                        columns.put(entry.getKey().trim().toLowerCase(Locale.ROOT), entry.getValue());
                    }
                }
                categories.add(toCategory(columns, "row " + record.getRecordNumber()));
            }
        } catch (IOException e) {
            throw new CatalogException("Unable to read category catalog " + file, e);
        }
        return categories;
    }

    private CategoryDefinition toCategory(Map<String, String> columns, String position) {
        String slug = text(columns.get("slug"));
        String landingUrl = text(columns.get("landing_url"));
        if (slug == null || landingUrl == null) {
            throw new CatalogException("Category catalog " + file + " " + position + " is missing slug or landing_url");
        }
        String name = text(columns.get("name"));
        return new CategoryDefinition(
            slug,
            name == null ? slug : name,
            categoryId(columns, position),
            landingUrl,
            text(columns.get("timeline_url_template"))
        );
    }

    private Long categoryId(Map<String, String> columns, String position) {
        for (String column : ID_COLUMNS) {
            String value = text(columns.get(column));
            if (value == null) {
                continue;
            }
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new CatalogException("Category catalog " + file + " " + position + " has non-numeric " + column + ": " + value);
            }
        }
        return null;
    }

    private Map<String, CategoryDefinition> indexBySlug(List<CategoryDefinition> categories) {
        Map<String, CategoryDefinition> bySlug = new LinkedHashMap<>();
        for (CategoryDefinition category : categories) {
            if (bySlug.putIfAbsent(category.slug(), category) != null) {
                throw new CatalogException("Category catalog " + file + " lists slug '" + category.slug() + "' twice");
            }
        }
        return bySlug;
    }

    private List<CategoryDefinition> select(Map<String, CategoryDefinition> bySlug) {
        if (selectedSlugs.isEmpty()) {
            return List.copyOf(bySlug.values());
        }
        for (String slug : selectedSlugs) {
            if (!bySlug.containsKey(slug)) {
                throw new CatalogException("Unknown category '" + slug + "' in " + file);
            }
        }
        List<CategoryDefinition> selected = new ArrayList<>();
        for (CategoryDefinition category : bySlug.values()) {
            if (selectedSlugs.contains(category.slug())) {
                selected.add(category);
            }
        }
        return selected;
    }

    private static String text(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
