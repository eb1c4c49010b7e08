package com.delta.jobharvest.crawl.sink;

import com.delta.jobharvest.crawl.model.FailedTask;
import com.delta.jobharvest.crawl.model.JobRecord;

/**
 * Append-only destination for one run's output. Called concurrently by crawl workers.
 */
public interface RecordSink extends AutoCloseable {
    void emit(JobRecord record);

    void recordFailure(FailedTask failedTask);

    @Override
    default void close() {
    }
}
