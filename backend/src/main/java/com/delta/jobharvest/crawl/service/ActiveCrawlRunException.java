package com.delta.jobharvest.crawl.service;

import java.time.Instant;

/**
 * Raised when a run is requested while another one still owns the harvester.
 */
public class ActiveCrawlRunException extends RuntimeException {
    private final long activeRunId;

    public ActiveCrawlRunException(long activeRunId, Instant startedAt) {
        super("Active crawl run in progress (id=" + activeRunId + ", startedAt=" + startedAt + ")");
        this.activeRunId = activeRunId;
    }

    public long getActiveRunId() {
        return activeRunId;
    }
}
