package com.delta.newsdiscovery.crawl.service;

import com.delta.newsdiscovery.config.DiscoveryProperties;
import com.delta.newsdiscovery.crawl.model.DiscoveryRunSummary;
import com.delta.newsdiscovery.crawl.model.TraversalReport;
import com.delta.newsdiscovery.crawl.model.SourceSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
public class DiscoveryCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryCliRunner.class);

    private final DiscoveryProperties properties;
    private final DiscoveryRunService discoveryRunService;
    private final ConfigurableApplicationContext applicationContext;

    public DiscoveryCliRunner(
        DiscoveryProperties properties,
        DiscoveryRunService discoveryRunService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.discoveryRunService = discoveryRunService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        DiscoveryRunSummary summary = discoveryRunService.run(parseSources(properties.getCli().getSources()));
        log.info("Discovery run {} completed with status {}", summary.runId(), summary.status());
        for (SourceSummary source : summary.sources()) {
            for (TraversalReport category : source.categories()) {
                if (category.blocked()) {
                    log.warn("Source {} category {} was blocked after {} pages", source.sourceName(), category.categorySlug(), category.pagesVisited());
                }
            }
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, summary::exitCode);
            System.exit(exitCode);
        }
    }

    static List<String> parseSources(String value) {
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
    }
}
