package com.delta.jobharvest.crawl.model;

public enum ExtractionTier {
    STRUCTURED_DATA,
    HEURISTIC,
    MIXED
}
