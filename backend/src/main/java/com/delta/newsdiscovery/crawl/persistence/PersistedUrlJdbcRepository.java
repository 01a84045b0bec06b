package com.delta.newsdiscovery.crawl.persistence;

import com.delta.newsdiscovery.crawl.port.PersistedUrlPort;
import com.delta.newsdiscovery.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Read side of the article store used for resume: URLs that were already ingested by earlier runs.
 */
@Repository
public class PersistedUrlJdbcRepository implements PersistedUrlPort {
    private static final Logger log = LoggerFactory.getLogger(PersistedUrlJdbcRepository.class);

    private final NamedParameterJdbcTemplate jdbc;

    public PersistedUrlJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Set<String> loadExisting() {
        List<String> urls = jdbc.queryForList("SELECT url FROM articles", new MapSqlParameterSource(), String.class);
        return normalizeAll(urls);
    }

    private Set<String> normalizeAll(List<String> urls) {
        Set<String> normalized = new HashSet<>(urls.size() * 2);
        int unparseable = 0;
        for (String url : urls) {
            String value = UrlNormalizer.normalize(url);
            if (value == null) {
                unparseable++;
                continue;
            }
            normalized.add(value);
        }
        if (unparseable > 0) {
            log.warn("Ignored {} stored article URLs that are not absolute http(s) URLs", unparseable);
        }
        return normalized;
    }
}
