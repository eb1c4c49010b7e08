package com.delta.jobharvest.crawl.model;

public enum TaskKind {
    LISTING,
    DETAIL
}
