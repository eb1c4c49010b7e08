package com.delta.jobharvest.crawl.service;

import com.delta.jobharvest.crawl.model.ListingSeed;
import org.junit.jupiter.api.Test;

import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeedCsvReaderTest {
    private final SeedCsvReader reader = new SeedCsvReader();

    @Test
    void readsSeedsFromClasspathFixture() throws Exception {
        try (Reader csv = new InputStreamReader(
            getClass().getResourceAsStream("/seeds-sample.csv"),
            StandardCharsets.UTF_8
        )) {
            List<ListingSeed> seeds = reader.read(csv);
            assertThat(seeds).containsExactly(
                ListingSeed.ofSearch("java developer", "Berlin"),
                ListingSeed.ofSearch("data engineer", null)
            );
        }
    }

    @Test
    void headerAliasesAndBlankRowsAreHandled() throws Exception {
        String csv = """
            Start_URL , ukw , rgns
            https://jobs.example.test/s?ukw=x , ,
            , ,
            , cook , Lyon
            """;
        List<ListingSeed> seeds = reader.read(new StringReader(csv));
        assertThat(seeds).containsExactly(
            ListingSeed.ofStartUrl("https://jobs.example.test/s?ukw=x"),
            ListingSeed.ofSearch("cook", "Lyon")
        );
    }

    @Test
    void missingFileIsReported() {
        assertThatThrownBy(() -> reader.read("does/not/exist.csv"))
            .isInstanceOf(UncheckedIOException.class)
            .hasMessageContaining("exist.csv");
    }
}
