package com.delta.jobharvest.crawl.service;

import com.delta.jobharvest.config.HarvestProperties;
import com.delta.jobharvest.crawl.model.CrawlRunRequest;

/**
 * Effective limits of one run after request overrides are applied to the configured defaults.
 * {@code maxItems <= 0} means unlimited.
 */
public record CrawlRunSettings(
    int maxItems,
    int maxPages,
    int maxConcurrency,
    int maxAttempts,
    int pollIntervalMs
) {
    public static CrawlRunSettings resolve(CrawlRunRequest request, HarvestProperties properties) {
        CrawlRunRequest safe = request == null ? CrawlRunRequest.defaults() : request;
        int maxItems = safe.maxItems() == null ? properties.getMaxItems() : safe.maxItems();
        int maxPages = safe.maxPages() == null ? properties.getMaxPages() : Math.max(1, safe.maxPages());
        int maxConcurrency = safe.maxConcurrency() == null
            ? properties.getMaxConcurrency()
            : Math.max(1, safe.maxConcurrency());
        int maxAttempts = safe.maxAttempts() == null ? properties.getMaxAttempts() : Math.max(0, safe.maxAttempts());
        return new CrawlRunSettings(
            Math.max(0, maxItems),
            maxPages,
            maxConcurrency,
            maxAttempts,
            properties.getWorkerPollIntervalMs()
        );
    }
}
