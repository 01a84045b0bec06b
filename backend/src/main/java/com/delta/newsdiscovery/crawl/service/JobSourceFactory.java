package com.delta.newsdiscovery.crawl.service;

import com.delta.newsdiscovery.config.DiscoveryProperties;
import com.delta.newsdiscovery.crawl.catalog.FileCategoryCatalog;
import com.delta.newsdiscovery.crawl.engine.CategoryTraversalEngine;
import com.delta.newsdiscovery.crawl.engine.DiscoveryRunContext;
import com.delta.newsdiscovery.crawl.extract.AnchorLinkExtractor;
import com.delta.newsdiscovery.crawl.extract.ExtractorType;
import com.delta.newsdiscovery.crawl.extract.JsonApiContentsExtractor;
import com.delta.newsdiscovery.crawl.extract.JsonHtmlFragmentExtractor;
import com.delta.newsdiscovery.crawl.http.HttpPageFetcher;
import com.delta.newsdiscovery.crawl.http.PoliteHttpClient;
import com.delta.newsdiscovery.crawl.model.CategoryDefinition;
import com.delta.newsdiscovery.crawl.model.ConfiguredSourceView;
import com.delta.newsdiscovery.crawl.model.SourceType;
import com.delta.newsdiscovery.crawl.policy.PolicyConfigurationException;
import com.delta.newsdiscovery.crawl.policy.SourceVariant;
import com.delta.newsdiscovery.crawl.policy.TerminationPolicy;
import com.delta.newsdiscovery.crawl.port.CategoryCatalogPort;
import com.delta.newsdiscovery.crawl.port.PageExtractorPort;
import com.delta.newsdiscovery.crawl.source.BulkJobSource;
import com.delta.newsdiscovery.crawl.source.CategoryJobSource;
import com.delta.newsdiscovery.crawl.source.JobSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns {@code discovery.sources[]} entries into wired {@link JobSource}s for one run.
 */
@Service
public class JobSourceFactory {
    private final DiscoveryProperties properties;
    private final CategoryTraversalEngine engine;
    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public JobSourceFactory(
        DiscoveryProperties properties,
        CategoryTraversalEngine engine,
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.engine = engine;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Builds and validates every selected source before any of them is opened. Category catalogs are
     * loaded here, so a broken catalog fails the whole run with {@code CatalogException} before any fetch.
     *
     * @param selectedNames source names to build, in configuration order; empty builds every source
     */
    public List<JobSource> create(List<String> selectedNames, DiscoveryRunContext context) {
        List<DiscoveryProperties.Source> configured = selectSources(selectedNames);
        List<JobSource> sources = new ArrayList<>(configured.size());
        for (DiscoveryProperties.Source source : configured) {
            sources.add(create(source, context));
        }
        return sources;
    }

    public JobSource create(DiscoveryProperties.Source source, DiscoveryRunContext context) {
        requireName(source);
        if (source.getType() == SourceType.BULK) {
            if (source.getBulkFile() == null || source.getBulkFile().isBlank()) {
                throw new PolicyConfigurationException("Bulk source " + source.getName() + " needs bulk-file");
            }
            return new BulkJobSource(source.getName(), resolvePath(source.getBulkFile()), context, objectMapper);
        }
        if (source.getCatalogFile() == null || source.getCatalogFile().isBlank()) {
            throw new PolicyConfigurationException("Category source " + source.getName() + " needs catalog-file");
        }
        ExtractorType extractorType = extractorType(source);
        TerminationPolicy policy = policyFor(source);
        PageExtractorPort extractor = extractorFor(source, extractorType);
        List<CategoryDefinition> categories = catalogFor(source).load();
        HttpPageFetcher fetcher = extractorType == ExtractorType.JSON_API
            ? HttpPageFetcher.forJson(httpClient)
            : HttpPageFetcher.forHtml(httpClient);
        return new CategoryJobSource(source.getName(), categories, policy, fetcher, extractor, engine, context);
    }

    public TerminationPolicy policyFor(DiscoveryProperties.Source source) {
        if (source.getType() == SourceType.BULK) {
            return null;
        }
        return SourceVariant.fromConfig(source.getVariant()).policy(source.getMaxPages(), source.getMaxEmptyPages());
    }

    /**
     * Configured sources with their effective policy, in configuration order.
     */
    public List<ConfiguredSourceView> describeSources() {
        List<ConfiguredSourceView> described = new ArrayList<>();
        for (DiscoveryProperties.Source source : properties.getSources()) {
            requireName(source);
            described.add(view(source, policyFor(source)));
        }
        return described;
    }

    CategoryCatalogPort catalogFor(DiscoveryProperties.Source source) {
        FileCategoryCatalog catalog = new FileCategoryCatalog(
            resolvePath(source.getCatalogFile()),
            source.getCategories(),
            objectMapper
        );
        String defaultTemplate = source.getTimelineUrlTemplate();
        boolean includeLandingPage = source.isIncludeLandingPage();
        return () -> {
            List<CategoryDefinition> adjusted = new ArrayList<>();
            for (CategoryDefinition category : catalog.load()) {
                CategoryDefinition value = category;
                if (value.timelineUrlTemplate() == null && defaultTemplate != null && !defaultTemplate.isBlank()) {
                    value = value.withTimelineTemplate(defaultTemplate);
                }
                if (!includeLandingPage) {
                    value = value.withoutLandingPage();
                }
                adjusted.add(value);
            }
            return adjusted;
        };
    }

    PageExtractorPort extractorFor(DiscoveryProperties.Source source, ExtractorType type) {
        return switch (type) {
            case JSON_API -> new JsonApiContentsExtractor(objectMapper, source.getBaseUrl());
            case JSON_HTML -> new JsonHtmlFragmentExtractor(objectMapper, anchorExtractor(source));
            case ANCHOR -> anchorExtractor(source);
        };
    }

    private AnchorLinkExtractor anchorExtractor(DiscoveryProperties.Source source) {
        String pattern = source.getArticleUrlPattern();
        if (pattern == null || pattern.isBlank()) {
            return new AnchorLinkExtractor(source.getBaseUrl(), null);
        }
        try {
            return new AnchorLinkExtractor(source.getBaseUrl(), Pattern.compile(pattern));
        } catch (PatternSyntaxException e) {
            throw new PolicyConfigurationException(
                "Invalid article-url-pattern for source " + source.getName() + ": " + e.getDescription()
            );
        }
    }

    private ExtractorType extractorType(DiscoveryProperties.Source source) {
        String value = source.getExtractor();
        if (value == null || value.isBlank()) {
            return ExtractorType.ANCHOR;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ExtractorType type : ExtractorType.values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new PolicyConfigurationException("Unknown extractor '" + value + "' for source " + source.getName());
    }

    private List<DiscoveryProperties.Source> selectSources(List<String> selectedNames) {
        List<DiscoveryProperties.Source> all = properties.getSources();
        if (selectedNames == null || selectedNames.isEmpty()) {
            return all;
        }
        for (String name : selectedNames) {
            boolean known = all.stream().anyMatch(source -> name.equals(source.getName()));
            if (!known) {
                throw new PolicyConfigurationException("Unknown source '" + name + "'");
            }
        }
        return all.stream().filter(source -> selectedNames.contains(source.getName())).toList();
    }

    private static ConfiguredSourceView view(DiscoveryProperties.Source source, TerminationPolicy policy) {
        if (policy == null) {
            return new ConfiguredSourceView(source.getName(), source.getType(), source.getSite(), null, List.of(), null, null, null, null, null);
        }
        return new ConfiguredSourceView(
            source.getName(),
            source.getType(),
            source.getSite(),
            source.getVariant(),
            List.copyOf(source.getCategories()),
            policy.maxPages(),
            policy.maxEmptyPages(),
            policy.httpFailureMode().name(),
            policy.duplicateDetection().enabled() ? policy.duplicateDetection().fingerprintSize() : null,
            policy.emptyDefinition().name()
        );
    }

    private static void requireName(DiscoveryProperties.Source source) {
        if (source.getName() == null || source.getName().isBlank()) {
            throw new PolicyConfigurationException("Every configured source needs a name");
        }
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path;
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }
}
