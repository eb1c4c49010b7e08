package com.delta.jobharvest.crawl.model;

public enum Classification {
    OK,
    SOFT_BLOCK,
    HARD_BLOCK,
    TRANSPORT_ERROR;

    public boolean isBlock() {
        return this == SOFT_BLOCK || this == HARD_BLOCK;
    }
}
