package com.delta.newsdiscovery.crawl.engine;

import com.delta.newsdiscovery.crawl.dedup.DedupIndex;
import com.delta.newsdiscovery.crawl.model.CategoryDefinition;
import com.delta.newsdiscovery.crawl.policy.TerminationPolicy;
import com.delta.newsdiscovery.crawl.port.PageExtractorPort;
import com.delta.newsdiscovery.crawl.port.PageFetchPort;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Paginates one category under a {@link TerminationPolicy}. Stateless; every call returns a fresh
 * {@link CategoryTraversal}.
 */
@Component
public class CategoryTraversalEngine {

    public CategoryTraversal run(
        CategoryDefinition category,
        TerminationPolicy policy,
        PageFetchPort fetchPort,
        PageExtractorPort extractPort,
        DedupIndex dedupIndex
    ) {
        return run(null, category, policy, fetchPort, extractPort, DiscoveryRunContext.of(dedupIndex));
    }

    public CategoryTraversal run(
        String sourceName,
        CategoryDefinition category,
        TerminationPolicy policy,
        PageFetchPort fetchPort,
        PageExtractorPort extractPort,
        DiscoveryRunContext context
    ) {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(fetchPort, "fetchPort");
        Objects.requireNonNull(extractPort, "extractPort");
        Objects.requireNonNull(context, "context");
        return new CategoryTraversal(sourceName, category, policy, fetchPort, extractPort, context);
    }
}
