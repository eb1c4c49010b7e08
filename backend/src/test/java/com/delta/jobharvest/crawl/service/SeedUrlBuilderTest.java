package com.delta.jobharvest.crawl.service;

import com.delta.jobharvest.config.HarvestProperties;
import com.delta.jobharvest.crawl.model.CrawlRunRequest;
import com.delta.jobharvest.crawl.model.ListingSeed;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeedUrlBuilderTest {
    private final HarvestProperties properties = new HarvestProperties();
    private final SeedUrlBuilder builder = new SeedUrlBuilder(properties, new SeedCsvReader());

    @Test
    void searchSeedBuildsEncodedListingUrls() {
        ListingSeed seed = ListingSeed.ofSearch("java developer", "Berlin & Umland");

        assertThat(builder.pageUrl(seed, 1))
            .isEqualTo("https://jooble.org/SearchResult?ukw=java+developer&rgns=Berlin+%26+Umland");
        assertThat(builder.pageUrl(seed, 3))
            .isEqualTo("https://jooble.org/SearchResult?ukw=java+developer&rgns=Berlin+%26+Umland&p=3");
    }

    @Test
    void blankLocationIsOmitted() {
        assertThat(builder.pageUrl(ListingSeed.ofSearch("nurse", " "), 2))
            .isEqualTo("https://jooble.org/SearchResult?ukw=nurse&p=2");
    }

    @Test
    void startUrlKeepsItsQueryAndReplacesThePage() {
        ListingSeed seed = ListingSeed.ofStartUrl("https://jobs.example.test/search?ukw=java&p=4&sort=date");

        assertThat(builder.pageUrl(seed, 1)).isEqualTo("https://jobs.example.test/search?ukw=java&sort=date");
        assertThat(builder.pageUrl(seed, 2)).isEqualTo("https://jobs.example.test/search?ukw=java&sort=date&p=2");
    }

    @Test
    void requestStartUrlWinsOverEverythingElse() {
        properties.getSearch().setSearchTerm("configured");
        CrawlRunRequest request = new CrawlRunRequest("requested", null, "https://jobs.example.test/s", null, null, null, null);

        List<ListingSeed> seeds = builder.resolveSeeds(request);

        assertThat(seeds).containsExactly(ListingSeed.ofStartUrl("https://jobs.example.test/s"));
    }

    @Test
    void requestSearchTermFallsBackToConfiguredLocation() {
        properties.getSearch().setLocation("Remote");
        CrawlRunRequest request = new CrawlRunRequest(" data engineer ", null, null, null, null, null, null);

        assertThat(builder.resolveSeeds(request)).containsExactly(ListingSeed.ofSearch("data engineer", "Remote"));
    }

    @Test
    void configuredSeedsCsvIsUsedWhenNothingElseIsGiven(@TempDir Path tempDir) throws Exception {
        Path csv = tempDir.resolve("seeds.csv");
        Files.writeString(csv, "url,search_term,location\nhttps://jobs.example.test/a,,\n,welder,Ohio\n");
        properties.getSearch().setSeedsCsv(csv.toString());

        assertThat(builder.resolveSeeds(CrawlRunRequest.defaults())).containsExactly(
            ListingSeed.ofStartUrl("https://jobs.example.test/a"),
            ListingSeed.ofSearch("welder", "Ohio")
        );
    }

    @Test
    void missingSeedIsRejected() {
        assertThatThrownBy(() -> builder.resolveSeeds(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("startUrl or searchTerm");
    }
}
