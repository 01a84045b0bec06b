package com.delta.newsdiscovery.crawl.api;

import java.util.List;

public record DiscoveryRunRequest(List<String> sources) {
}
