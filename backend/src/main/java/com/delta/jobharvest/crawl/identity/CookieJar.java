package com.delta.jobharvest.crawl.identity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.HttpCookie;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Pure cookie-jar operations. A jar is an immutable name to value map; every merge returns a new
 * jar.
 */
public final class CookieJar {
    private static final Logger log = LoggerFactory.getLogger(CookieJar.class);

    private CookieJar() {
    }

    /**
     * Applies {@code updates} on top of {@code existing}. Same-named cookies are overwritten and a
     * blank value removes the cookie.
     */
    public static Map<String, String> merge(Map<String, String> existing, Map<String, String> updates) {
        Map<String, String> merged = new LinkedHashMap<>(existing == null ? Map.of() : existing);
        if (updates != null) {
            for (Map.Entry<String, String> entry : updates.entrySet()) {
                String name = entry.getKey();
                if (name == null || name.isBlank()) {
                    continue;
                }
                String value = entry.getValue();
                if (value == null || value.isBlank()) {
                    merged.remove(name);
                } else {
                    merged.put(name, value);
                }
            }
        }
        return Collections.unmodifiableMap(merged);
    }

    /**
     * Reads raw Set-Cookie header values into name to value updates. An expired cookie
     * ({@code Max-Age=0}) is reported with an empty value so that {@link #merge} drops it.
     */
    public static Map<String, String> parseSetCookieHeaders(List<String> setCookieHeaders) {
        Map<String, String> updates = new LinkedHashMap<>();
        if (setCookieHeaders == null) {
            return updates;
        }
        for (String header : setCookieHeaders) {
            if (header == null || header.isBlank()) {
                continue;
            }
            List<HttpCookie> cookies;
            try {
                cookies = HttpCookie.parse(header);
            } catch (IllegalArgumentException e) {
                log.debug("Skipping malformed Set-Cookie header: {}", e.getMessage());
                continue;
            }
            for (HttpCookie cookie : cookies) {
                String value = cookie.getMaxAge() == 0 ? "" : cookie.getValue();
                updates.put(cookie.getName(), value == null ? "" : value);
            }
        }
        return updates;
    }

    public static String toHeaderValue(Map<String, String> jar) {
        if (jar == null || jar.isEmpty()) {
            return null;
        }
        return jar.entrySet().stream()
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .collect(Collectors.joining("; "));
    }
}
