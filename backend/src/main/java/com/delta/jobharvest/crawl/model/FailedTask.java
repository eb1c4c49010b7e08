package com.delta.jobharvest.crawl.model;

import java.time.Instant;

public record FailedTask(
    String url,
    TaskKind kind,
    int attempts,
    Classification lastClassification,
    Integer lastStatusCode,
    String reasonCode,
    String detail,
    Instant failedAt
) {
}
