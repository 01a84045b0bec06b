package com.delta.newsdiscovery.crawl.engine;

import com.delta.newsdiscovery.crawl.model.TraversalReport;

@FunctionalInterface
public interface TraversalListener {
    TraversalListener NOOP = report -> {
    };

    void onCategoryComplete(TraversalReport report);
}
