package com.delta.jobharvest.crawl.model;

import java.time.Instant;

public record JobRecord(
    String sourceUrl,
    String title,
    String company,
    String location,
    String compensation,
    String employmentType,
    String postedAt,
    String category,
    String descriptionText,
    String descriptionHtml,
    String listingUrl,
    int pageNumber,
    ExtractionTier extractionTier,
    Instant scrapedAt,
    String contentHash
) {
}
