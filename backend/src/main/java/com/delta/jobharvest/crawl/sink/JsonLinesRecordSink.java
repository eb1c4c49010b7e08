package com.delta.jobharvest.crawl.sink;

import com.delta.jobharvest.crawl.model.FailedTask;
import com.delta.jobharvest.crawl.model.JobRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends one JSON object per record to a dataset file. Failures are only logged; the database
 * keeps the authoritative failure list.
 */
public class JsonLinesRecordSink implements RecordSink {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesRecordSink.class);

    private final ObjectMapper objectMapper;
    private final Path path;
    private final BufferedWriter writer;

    public JsonLinesRecordSink(ObjectMapper objectMapper, Path path) throws IOException {
        this.objectMapper = objectMapper;
        this.path = path;
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.writer = Files.newBufferedWriter(
            path,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND
        );
    }

    @Override
    public synchronized void emit(JobRecord record) {
        try {
            writer.write(objectMapper.writeValueAsString(record));
            writer.newLine();
            writer.flush();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize record " + record.sourceUrl(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to append to " + path, e);
        }
    }

    @Override
    public void recordFailure(FailedTask failedTask) {
        log.debug("Not writing failed task {} to {}", failedTask.url(), path);
    }

    @Override
    public synchronized void close() {
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("Failed to close dataset file {}", path, e);
        }
    }
}
