package com.delta.jobharvest.crawl.service;

import com.delta.jobharvest.crawl.model.ListingSeed;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads listing seeds from a CSV file with a header row. A row either names a {@code url}
 * ({@code start_url} is accepted too) or a {@code search_term} with an optional {@code location}.
 */
@Component
public class SeedCsvReader {
    private static final Logger log = LoggerFactory.getLogger(SeedCsvReader.class);

    public List<ListingSeed> read(String configuredPath) {
        Path path = resolvePath(configuredPath);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read seeds CSV at " + path, e);
        }
    }

    public List<ListingSeed> read(Reader reader) throws IOException {
        List<ListingSeed> seeds = new ArrayList<>();
        try (CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                String url = getColumn(record, "url", "start_url", "startUrl");
                String searchTerm = getColumn(record, "search_term", "searchTerm", "keyword", "ukw");
                String location = getColumn(record, "location", "region", "rgns");
                if (url != null) {
                    seeds.add(ListingSeed.ofStartUrl(url));
                } else if (searchTerm != null) {
                    seeds.add(ListingSeed.ofSearch(searchTerm, location));
                } else {
                    log.warn("Skipping seeds CSV row {}: neither url nor search term", record.getRecordNumber());
                }
            }
        }
        return seeds;
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (String header : record.toMap().keySet()) {
                if (header == null) {
                    continue;
                }
                if (header.trim().equalsIgnoreCase(name)) {
                    String value = record.get(header).trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }
}
