package com.delta.jobharvest.crawl.persistence;

import com.delta.jobharvest.crawl.model.Classification;
import com.delta.jobharvest.crawl.model.CrawlRunProgress;
import com.delta.jobharvest.crawl.model.CrawlRunStatusResponse;
import com.delta.jobharvest.crawl.model.ExtractionTier;
import com.delta.jobharvest.crawl.model.FailedTask;
import com.delta.jobharvest.crawl.model.JobRecord;
import com.delta.jobharvest.crawl.model.JobRecordView;
import com.delta.jobharvest.crawl.model.TaskKind;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
class HarvestJdbcRepositoryTest {

    @Autowired
    private HarvestJdbcRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void upsertKeepsOneRowPerRunAndSourceUrl() {
        long runId = repository.insertCrawlRun(Instant.now(), "RUNNING", "seed " + UUID.randomUUID());
        String url = "https://jobs.example.test/desc/" + UUID.randomUUID();

        repository.upsertJobRecord(runId, record(url, "Backend Engineer", "hash-1"));
        repository.upsertJobRecord(runId, record(url, "Senior Backend Engineer", "hash-2"));

        Long rows = jdbc.queryForObject(
            "SELECT COUNT(*) FROM job_records WHERE crawl_run_id = :runId AND source_url = :url",
            new MapSqlParameterSource().addValue("runId", runId).addValue("url", url),
            Long.class
        );
        assertEquals(1L, rows);

        List<JobRecordView> views = repository.findRecords(runId, 10);
        assertEquals(1, views.size());
        assertEquals("Senior Backend Engineer", views.get(0).title());
        assertEquals("hash-2", views.get(0).contentHash());
        assertEquals("HEURISTIC", views.get(0).extractionTier());
    }

    @Test
    void overlongSourceUrlIsCutToTheColumnWidth() {
        long runId = repository.insertCrawlRun(Instant.now(), "RUNNING", "seed " + UUID.randomUUID());
        String url = "https://jobs.example.test/desc/" + UUID.randomUUID() + "?ref=" + "x".repeat(3000);

        repository.upsertJobRecord(runId, record(url, "Platform Engineer", "hash-long"));

        List<JobRecordView> views = repository.findRecords(runId, 10);
        assertEquals(1, views.size());
        assertEquals(2048, views.get(0).sourceUrl().length());
        assertTrue(url.startsWith(views.get(0).sourceUrl()));
    }

    @Test
    void sameUrlInAnotherRunIsAnotherRow() {
        String url = "https://jobs.example.test/desc/" + UUID.randomUUID();
        long firstRun = repository.insertCrawlRun(Instant.now().minusSeconds(60), "RUNNING", "first");
        long secondRun = repository.insertCrawlRun(Instant.now(), "RUNNING", "second");

        repository.upsertJobRecord(firstRun, record(url, "Engineer", "h"));
        repository.upsertJobRecord(secondRun, record(url, "Engineer", "h"));

        assertEquals(1, repository.findRecords(firstRun, 10).size());
        assertEquals(1, repository.findRecords(secondRun, 10).size());
    }

    @Test
    void completingRunStoresCountersAndStatus() {
        Instant startedAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        long runId = repository.insertCrawlRun(startedAt, "RUNNING", "complete me");
        repository.updateCrawlRunProgress(runId, new CrawlRunProgress(1, 2, 1, 0, 0), Instant.now());
        repository.completeCrawlRun(
            runId,
            startedAt.plusSeconds(5),
            "COMPLETED_WITH_ERRORS",
            "reason=frontier_exhausted",
            new CrawlRunProgress(3, 0, 2, 1, 1)
        );

        CrawlRunStatusResponse run = repository.findCrawlRun(runId);
        assertNotNull(run);
        assertEquals("COMPLETED_WITH_ERRORS", run.status());
        assertEquals(3, run.itemsSaved());
        assertEquals(2, run.pagesVisited());
        assertEquals(1, run.abandonedTasks());
        assertEquals(1, run.extractionFailures());
        assertEquals(startedAt, run.startedAt());
        assertEquals(startedAt.plusSeconds(5), run.finishedAt());
        assertFalse(run.live());
    }

    @Test
    void failedTasksAreCountedByReason() {
        long runId = repository.insertCrawlRun(Instant.now(), "RUNNING", "failures");
        repository.insertFailedTask(runId, failure("https://jobs.example.test/desc/1", "HTTP_429_RATE_LIMIT", 429));
        repository.insertFailedTask(runId, failure("https://jobs.example.test/desc/2", "HTTP_429_RATE_LIMIT", 429));
        repository.insertFailedTask(runId, failure("https://jobs.example.test/desc/3", "TIMEOUT", null));

        Map<String, Long> counts = repository.countFailedTasksByReason(runId);

        assertEquals(Map.of("HTTP_429_RATE_LIMIT", 2L, "TIMEOUT", 1L), counts);
        assertEquals("HTTP_429_RATE_LIMIT", counts.keySet().iterator().next());
    }

    @Test
    void runningRunsAreAbortedOnRequest() {
        long runId = repository.insertCrawlRun(Instant.now(), "RUNNING", "left over");

        int touched = repository.abortRunningCrawlRuns(Instant.now(), "aborted_on_startup");

        assertTrue(touched >= 1);
        CrawlRunStatusResponse run = repository.findCrawlRun(runId);
        assertEquals("ABORTED", run.status());
        assertEquals("aborted_on_startup", run.notes());
    }

    @Test
    void unknownRunIsNull() {
        assertNull(repository.findCrawlRun(Long.MAX_VALUE));
        assertTrue(repository.isDbReachable());
    }

    private JobRecord record(String url, String title, String hash) {
        return new JobRecord(
            url,
            title,
            "Acme",
            "Remote",
            null,
            "FULL_TIME",
            "2026-01-01",
            null,
            "Build things.",
            "<p>Build things.</p>",
            "https://jobs.example.test/search?ukw=java",
            1,
            ExtractionTier.HEURISTIC,
            Instant.now(),
            hash
        );
    }

    private FailedTask failure(String url, String reasonCode, Integer status) {
        return new FailedTask(
            url,
            TaskKind.DETAIL,
            4,
            status == null ? Classification.TRANSPORT_ERROR : Classification.HARD_BLOCK,
            status,
            reasonCode,
            "detail",
            Instant.now()
        );
    }
}
