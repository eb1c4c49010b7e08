package com.delta.jobharvest.crawl.sink;

import com.delta.jobharvest.config.HarvestProperties;
import com.delta.jobharvest.crawl.persistence.HarvestJdbcRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Opens the configured sinks for one crawl run.
 */
@Component
public class RecordSinkFactory {
    private static final Logger log = LoggerFactory.getLogger(RecordSinkFactory.class);

    private final HarvestProperties properties;
    private final HarvestJdbcRepository repository;
    private final ObjectMapper objectMapper;

    public RecordSinkFactory(HarvestProperties properties, HarvestJdbcRepository repository, ObjectMapper objectMapper) {
        this.properties = properties;
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    public RecordSink openSink(long crawlRunId) {
        List<RecordSink> sinks = new ArrayList<>();
        if (properties.getOutput().isJdbcEnabled()) {
            sinks.add(new JdbcRecordSink(repository, crawlRunId));
        }
        String jsonlPath = properties.getOutput().getJsonlPath();
        if (jsonlPath != null && !jsonlPath.isBlank()) {
            Path path = Path.of(jsonlPath.trim());
            try {
                sinks.add(new JsonLinesRecordSink(objectMapper, path));
                log.info("Crawl run {} appending records to {}", crawlRunId, path.toAbsolutePath());
            } catch (IOException e) {
                sinks.forEach(RecordSink::close);
                throw new UncheckedIOException("Unable to open dataset file " + path, e);
            }
        }
        if (sinks.isEmpty()) {
            log.warn("Crawl run {} has no output sink enabled; records will be discarded", crawlRunId);
        }
        return sinks.size() == 1 ? sinks.get(0) : new CompositeRecordSink(sinks);
    }
}
