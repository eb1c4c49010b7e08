package com.delta.jobharvest.crawl.model;

import java.util.Map;

public record FetchRequest(
    String url,
    Map<String, String> headers,
    Map<String, String> cookies,
    String referer
) {
    public FetchRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        cookies = cookies == null ? Map.of() : Map.copyOf(cookies);
    }
}
