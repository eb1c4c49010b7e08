package com.delta.jobharvest.crawl.sink;

import com.delta.jobharvest.crawl.model.FailedTask;
import com.delta.jobharvest.crawl.model.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class CompositeRecordSink implements RecordSink {
    private static final Logger log = LoggerFactory.getLogger(CompositeRecordSink.class);

    private final List<RecordSink> delegates;

    public CompositeRecordSink(List<RecordSink> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void emit(JobRecord record) {
        for (RecordSink delegate : delegates) {
            delegate.emit(record);
        }
    }

    @Override
    public void recordFailure(FailedTask failedTask) {
        for (RecordSink delegate : delegates) {
            delegate.recordFailure(failedTask);
        }
    }

    @Override
    public void close() {
        for (RecordSink delegate : delegates) {
            try {
                delegate.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close sink {}", delegate.getClass().getSimpleName(), e);
            }
        }
    }
}
