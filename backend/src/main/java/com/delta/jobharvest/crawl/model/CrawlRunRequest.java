package com.delta.jobharvest.crawl.model;

/**
 * Per-run overrides. Any null field falls back to the configured default.
 */
public record CrawlRunRequest(
    String searchTerm,
    String location,
    String startUrl,
    Integer maxItems,
    Integer maxPages,
    Integer maxConcurrency,
    Integer maxAttempts
) {
    public static CrawlRunRequest defaults() {
        return new CrawlRunRequest(null, null, null, null, null, null, null);
    }
}
