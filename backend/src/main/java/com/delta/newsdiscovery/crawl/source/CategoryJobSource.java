package com.delta.newsdiscovery.crawl.source;

import com.delta.newsdiscovery.crawl.engine.CategoryTraversal;
import com.delta.newsdiscovery.crawl.engine.CategoryTraversalEngine;
import com.delta.newsdiscovery.crawl.engine.DiscoveryRunContext;
import com.delta.newsdiscovery.crawl.model.CategoryDefinition;
import com.delta.newsdiscovery.crawl.model.JobRecord;
import com.delta.newsdiscovery.crawl.model.SourceSummary;
import com.delta.newsdiscovery.crawl.model.TraversalReport;
import com.delta.newsdiscovery.crawl.policy.TerminationPolicy;
import com.delta.newsdiscovery.crawl.port.PageExtractorPort;
import com.delta.newsdiscovery.crawl.port.PageFetchPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Traverses every category of a site catalog, one after another, with the same policy and ports.
 * The catalog arrives already loaded so a broken one fails the run before any source is opened.
 * An error escaping one category ends that category only; the next one is still traversed.
 */
public class CategoryJobSource implements JobSource {
    private static final Logger log = LoggerFactory.getLogger(CategoryJobSource.class);

    private final String name;
    private final List<CategoryDefinition> categories;
    private final TerminationPolicy policy;
    private final PageFetchPort fetchPort;
    private final PageExtractorPort extractPort;
    private final CategoryTraversalEngine engine;
    private final DiscoveryRunContext context;
    private final List<TraversalReport> reports = Collections.synchronizedList(new ArrayList<>());
    private boolean opened;

    public CategoryJobSource(
        String name,
        List<CategoryDefinition> categories,
        TerminationPolicy policy,
        PageFetchPort fetchPort,
        PageExtractorPort extractPort,
        CategoryTraversalEngine engine,
        DiscoveryRunContext context
    ) {
        this.name = name;
        this.categories = List.copyOf(categories);
        this.policy = policy;
        this.fetchPort = fetchPort;
        this.extractPort = extractPort;
        this.engine = engine;
        this.context = context;
    }

    @Override
    public String name() {
        return name;
    }

    public TerminationPolicy policy() {
        return policy;
    }

    @Override
    public synchronized Iterator<JobRecord> open() {
        if (opened) {
            throw new IllegalStateException("Source " + name + " was already opened");
        }
        opened = true;
        log.info("Source {} traversing {} categories with {}", name, categories.size(), policy);
        return new CategoriesIterator(categories.iterator());
    }

    @Override
    public SourceSummary summary() {
        synchronized (reports) {
            return SourceSummary.ofCategories(name, new ArrayList<>(reports));
        }
    }

    private final class CategoriesIterator implements Iterator<JobRecord> {
        private final Iterator<CategoryDefinition> remaining;
        private CategoryTraversal current;

        private CategoriesIterator(Iterator<CategoryDefinition> remaining) {
            this.remaining = remaining;
        }

        @Override
        public boolean hasNext() {
            while (true) {
                if (current != null) {
                    if (advanceCurrent()) {
                        return true;
                    }
                    current = null;
                }
                if (!remaining.hasNext()) {
                    return false;
                }
                current = engine.run(name, remaining.next(), policy, fetchPort, extractPort, context);
            }
        }

        private boolean advanceCurrent() {
            try {
                if (current.hasNext()) {
                    return true;
                }
                reports.add(current.state().toReport(name, current.category().slug()));
            } catch (RuntimeException e) {
                reports.add(current.abandon(e));
            }
            return false;
        }

        @Override
        public JobRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Source " + name + " is exhausted");
            }
            return current.next();
        }
    }
}
