package com.delta.jobharvest.crawl.model;

import java.time.Instant;

public record CrawlRunSummary(
    long crawlRunId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    int itemsSaved,
    int pagesVisited,
    int detailTasksAccepted,
    int enqueueRejected,
    int extractionFailures,
    int abandonedTasks,
    int retriesScheduled,
    int identitiesRetired,
    int unprocessedTasks) {}
