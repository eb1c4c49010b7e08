package com.delta.jobharvest.crawl.model;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public record FetchResult(
    String requestedUrl,
    String finalUrl,
    int statusCode,
    String body,
    Map<String, List<String>> headers,
    Duration duration,
    String transportError,
    String transportErrorMessage
) {
    public FetchResult {
        headers = headers == null ? Map.of() : headers;
        body = body == null ? "" : body;
    }

    public static FetchResult ok(String url, int statusCode, String body, Map<String, List<String>> headers) {
        return new FetchResult(url, url, statusCode, body, headers, Duration.ZERO, null, null);
    }

    public static FetchResult error(String url, String code, String message, Duration duration) {
        return new FetchResult(url, null, 0, "", Map.of(), duration, code, message);
    }

    public boolean hasTransportError() {
        return transportError != null && !transportError.isBlank();
    }

    public String finalUrlOrRequested() {
        return finalUrl != null ? finalUrl : requestedUrl;
    }

    public List<String> setCookieHeaders() {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && "set-cookie".equals(entry.getKey().toLowerCase(Locale.ROOT))) {
                return entry.getValue() == null ? List.of() : entry.getValue();
            }
        }
        return List.of();
    }
}
