package com.delta.jobharvest.crawl.model;

import java.util.Map;

/**
 * Health view for {@code GET /api/status}. {@code activeCrawlRunId} is null when the harvester is idle.
 */
public record StatusResponse(
    boolean dbConnectivity,
    Map<String, Long> tableCounts,
    Long activeCrawlRunId,
    CrawlRunStatusResponse latestCrawlRun
) {}
