package com.delta.jobharvest.crawl.model;

import java.time.Instant;

public record CrawlRunStatusResponse(
    long crawlRunId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    String notes,
    int itemsSaved,
    int pagesVisited,
    int abandonedTasks,
    int extractionFailures,
    boolean live) {}
