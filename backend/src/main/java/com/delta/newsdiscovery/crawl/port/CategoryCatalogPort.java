package com.delta.newsdiscovery.crawl.port;

import com.delta.newsdiscovery.crawl.model.CategoryDefinition;

import java.util.List;

@FunctionalInterface
public interface CategoryCatalogPort {

    /**
     * @throws CatalogException when the catalog is missing or contains an invalid definition
     */
    List<CategoryDefinition> load();
}
