package com.delta.jobharvest.crawl.model;

import java.time.Instant;

public record JobRecordView(
    long id,
    long crawlRunId,
    String sourceUrl,
    String title,
    String company,
    String location,
    String compensation,
    String employmentType,
    String postedAt,
    String category,
    String descriptionText,
    String extractionTier,
    Instant scrapedAt,
    String contentHash) {}
