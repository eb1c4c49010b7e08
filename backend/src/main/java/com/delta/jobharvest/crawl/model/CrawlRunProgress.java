package com.delta.jobharvest.crawl.model;

public record CrawlRunProgress(
    int itemsSaved,
    int itemsPlanned,
    int pagesVisited,
    int abandonedTasks,
    int extractionFailures) {}
