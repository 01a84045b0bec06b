package com.delta.newsdiscovery.crawl.port;

import java.util.Set;

@FunctionalInterface
public interface PersistedUrlPort {
    Set<String> loadExisting();
}
