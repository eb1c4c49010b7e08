package com.delta.jobharvest.crawl.api;

import com.delta.jobharvest.crawl.model.CrawlRunRequest;

public record CrawlApiRunRequest(
    String searchTerm,
    String location,
    String startUrl,
    Integer maxItems,
    Integer maxPages,
    Integer maxConcurrency,
    Integer maxAttempts
) {
    public CrawlRunRequest toRunRequest() {
        return new CrawlRunRequest(searchTerm, location, startUrl, maxItems, maxPages, maxConcurrency, maxAttempts);
    }
}
