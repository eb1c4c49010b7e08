package com.delta.jobharvest.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Canonical form used as the frontier's dedup key: lower-case scheme and host, default port
 * dropped, empty path as "/", query parameters sorted, fragment removed.
 */
public final class UrlNormalizer {
    private static final Comparator<String[]> PARAM_ORDER =
        Comparator.<String[], String>comparing(pair -> pair[0]).thenComparing(pair -> pair[1]);

    private UrlNormalizer() {
    }

    public static String normalize(String candidate) {
        URI uri = safeUri(candidate);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            return null;
        }
        StringBuilder out = new StringBuilder();
        out.append(scheme).append("://").append(uri.getHost().toLowerCase(Locale.ROOT));
        int port = uri.getPort();
        if (port > 0 && !isDefaultPort(scheme, port)) {
            out.append(':').append(port);
        }
        String path = uri.getRawPath();
        out.append(path == null || path.isEmpty() ? "/" : path);
        String query = sortedQuery(uri.getRawQuery());
        if (!query.isEmpty()) {
            out.append('?').append(query);
        }
        return out.toString();
    }

    public static URI safeUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim().replace(" ", "%20"));
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static String sortedQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return "";
        }
        List<String[]> pairs = new ArrayList<>();
        for (String part : rawQuery.split("&")) {
            if (part.isEmpty()) {
                continue;
            }
            int eq = part.indexOf('=');
            if (eq < 0) {
                pairs.add(new String[] {part, ""});
            } else {
                pairs.add(new String[] {part.substring(0, eq), part.substring(eq)});
            }
        }
        pairs.sort(PARAM_ORDER);
        StringBuilder out = new StringBuilder();
        for (String[] pair : pairs) {
            if (out.length() > 0) {
                out.append('&');
            }
            out.append(pair[0]).append(pair[1]);
        }
        return out.toString();
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
    }
}
