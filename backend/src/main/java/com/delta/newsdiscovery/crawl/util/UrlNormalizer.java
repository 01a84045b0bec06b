package com.delta.newsdiscovery.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    /**
     * Canonical form used for dedup: absolute http(s), lower-case scheme and host, no default port,
     * no fragment, {@code /} for an empty path. Returns {@code null} for anything else.
     */
    public static String normalize(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        URI uri = safeUri(candidate.trim());
        if (uri == null || !uri.isAbsolute() || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            return null;
        }
        StringBuilder out = new StringBuilder(candidate.length());
        out.append(scheme).append("://");
        if (uri.getRawUserInfo() != null) {
            out.append(uri.getRawUserInfo()).append('@');
        }
        out.append(uri.getHost().toLowerCase(Locale.ROOT));
        int port = uri.getPort();
        if (port != -1 && !isDefaultPort(scheme, port)) {
            out.append(':').append(port);
        }
        String path = uri.getRawPath();
        out.append(path == null || path.isEmpty() ? "/" : path);
        if (uri.getRawQuery() != null) {
            out.append('?').append(uri.getRawQuery());
        }
        return out.toString();
    }

    /**
     * Resolves a link found on a page against a base URL, then normalizes it.
     */
    public static String resolve(String baseUrl, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String trimmed = href.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("javascript:") || lower.startsWith("mailto:") || lower.startsWith("tel:") || lower.startsWith("#")) {
            return null;
        }
        if (trimmed.startsWith("//")) {
            return normalize("https:" + trimmed);
        }
        URI target = safeUri(trimmed);
        if (target == null) {
            return null;
        }
        if (target.isAbsolute()) {
            return normalize(trimmed);
        }
        URI base = baseUrl == null ? null : safeUri(baseUrl.trim());
        if (base == null || !base.isAbsolute()) {
            return null;
        }
        try {
            return normalize(base.resolve(target).toString());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static URI safeUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
    }
}
