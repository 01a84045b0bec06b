package com.delta.newsdiscovery.crawl.testing;

import com.delta.newsdiscovery.crawl.model.FetchOutcome;
import com.delta.newsdiscovery.crawl.port.PageFetchPort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fetch port answering from a fixed map of URL to body. Unknown URLs answer an empty body and
 * URLs registered with {@link #crash(String)} throw.
 */
public class ScriptedFetchPort implements PageFetchPort {
    private final Map<String, FetchOutcome> pages = new HashMap<>();
    private final Set<String> crashing = new HashSet<>();
    private final List<String> fetched = Collections.synchronizedList(new ArrayList<>());

    public ScriptedFetchPort page(String url, String body) {
        pages.put(url, FetchOutcome.content(url, body));
        return this;
    }

    public ScriptedFetchPort failure(String url, int status) {
        pages.put(url, FetchOutcome.failure(url, "HTTP_5XX", status, "HTTP " + status));
        return this;
    }

    public ScriptedFetchPort crash(String url) {
        crashing.add(url);
        return this;
    }

    @Override
    public FetchOutcome fetch(String url) {
        fetched.add(url);
        if (crashing.contains(url)) {
            throw new IllegalStateException("connection pool closed while fetching " + url);
        }
        return pages.getOrDefault(url, FetchOutcome.content(url, ""));
    }

    public List<String> fetched() {
        return List.copyOf(fetched);
    }

    public int fetchCount() {
        return fetched.size();
    }
}
