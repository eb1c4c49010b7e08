package com.delta.jobharvest.crawl.sink;

import com.delta.jobharvest.crawl.model.FailedTask;
import com.delta.jobharvest.crawl.model.JobRecord;
import com.delta.jobharvest.crawl.persistence.HarvestJdbcRepository;

public class JdbcRecordSink implements RecordSink {
    private final HarvestJdbcRepository repository;
    private final long crawlRunId;

    public JdbcRecordSink(HarvestJdbcRepository repository, long crawlRunId) {
        this.repository = repository;
        this.crawlRunId = crawlRunId;
    }

    @Override
    public void emit(JobRecord record) {
        repository.upsertJobRecord(crawlRunId, record);
    }

    @Override
    public void recordFailure(FailedTask failedTask) {
        repository.insertFailedTask(crawlRunId, failedTask);
    }
}
