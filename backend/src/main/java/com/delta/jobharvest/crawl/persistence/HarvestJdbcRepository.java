package com.delta.jobharvest.crawl.persistence;

import com.delta.jobharvest.crawl.model.CrawlRunProgress;
import com.delta.jobharvest.crawl.model.CrawlRunStatusResponse;
import com.delta.jobharvest.crawl.model.FailedTask;
import com.delta.jobharvest.crawl.model.JobRecord;
import com.delta.jobharvest.crawl.model.JobRecordView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Repository
public class HarvestJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(HarvestJdbcRepository.class);
    private static final int MAX_DETAIL_CHARS = 2000;
    private static final int MAX_URL_CHARS = 2048;
    private static final int MAX_RECORD_PAGE = 500;

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public HarvestJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("crawl_runs", countTable("crawl_runs"));
        counts.put("job_records", countTable("job_records"));
        counts.put("failed_tasks", countTable("failed_tasks"));
        return counts;
    }

    public long countTable(String tableName) {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return count == null ? 0L : count;
    }

    public long insertCrawlRun(Instant startedAt, String status, String seedLabel) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", status)
            .addValue("seedLabel", truncate(seedLabel, 1000))
            .addValue("lastHeartbeatAt", toTimestamp(startedAt));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO crawl_runs (
                    started_at,
                    status,
                    seed_label,
                    items_saved,
                    items_planned,
                    pages_visited,
                    abandoned_tasks,
                    extraction_failures,
                    last_heartbeat_at
                )
                VALUES (
                    :startedAt,
                    :status,
                    :seedLabel,
                    0,
                    0,
                    0,
                    0,
                    0,
                    :lastHeartbeatAt
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        Long id = key == null ? null : key.longValue();
        if (id == null) {
            id = jdbc.queryForObject(
                """
                    SELECT id
                    FROM crawl_runs
                    WHERE started_at = :startedAt
                      AND status = :status
                    ORDER BY id DESC
                    LIMIT 1
                    """,
                params,
                Long.class
            );
            if (id == null) {
                throw new IllegalStateException("Failed to insert crawl run");
            }
        }
        return id;
    }

    public void updateCrawlRunProgress(long crawlRunId, CrawlRunProgress progress, Instant heartbeatAt) {
        MapSqlParameterSource params = progressParams(crawlRunId, progress)
            .addValue("lastHeartbeatAt", toTimestamp(heartbeatAt));
        jdbc.update(
            """
                UPDATE crawl_runs
                SET items_saved = :itemsSaved,
                    items_planned = :itemsPlanned,
                    pages_visited = :pagesVisited,
                    abandoned_tasks = :abandonedTasks,
                    extraction_failures = :extractionFailures,
                    last_heartbeat_at = COALESCE(:lastHeartbeatAt, last_heartbeat_at)
                WHERE id = :crawlRunId
                """,
            params
        );
    }

    public void completeCrawlRun(
        long crawlRunId,
        Instant finishedAt,
        String status,
        String notes,
        CrawlRunProgress progress
    ) {
        MapSqlParameterSource params = progressParams(crawlRunId, progress)
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("status", status)
            .addValue("notes", truncate(notes, MAX_DETAIL_CHARS));
        jdbc.update(
            """
                UPDATE crawl_runs
                SET finished_at = :finishedAt,
                    status = :status,
                    notes = :notes,
                    items_saved = :itemsSaved,
                    items_planned = :itemsPlanned,
                    pages_visited = :pagesVisited,
                    abandoned_tasks = :abandonedTasks,
                    extraction_failures = :extractionFailures,
                    last_heartbeat_at = :finishedAt
                WHERE id = :crawlRunId
                """,
            params
        );
    }

    /**
     * Marks every run still in {@code RUNNING} as aborted. Returns the number of rows touched.
     */
    public int abortRunningCrawlRuns(Instant finishedAt, String notes) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("notes", notes);
        return jdbc.update(
            """
                UPDATE crawl_runs
                SET finished_at = :finishedAt,
                    status = 'ABORTED',
                    notes = :notes
                WHERE status = 'RUNNING'
                """,
            params
        );
    }

    public void upsertJobRecord(long crawlRunId, JobRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("crawlRunId", crawlRunId)
            .addValue("sourceUrl", truncate(record.sourceUrl(), MAX_URL_CHARS))
            .addValue("title", truncate(record.title(), 1000))
            .addValue("company", truncate(record.company(), 1000))
            .addValue("location", truncate(record.location(), 1000))
            .addValue("compensation", truncate(record.compensation(), 1000))
            .addValue("employmentType", truncate(record.employmentType(), 500))
            .addValue("postedAt", truncate(record.postedAt(), 200))
            .addValue("category", truncate(record.category(), 1000))
            .addValue("descriptionText", record.descriptionText())
            .addValue("descriptionHtml", record.descriptionHtml())
            .addValue("listingUrl", truncate(record.listingUrl(), MAX_URL_CHARS))
            .addValue("pageNumber", record.pageNumber())
            .addValue("extractionTier", record.extractionTier().name())
            .addValue("scrapedAt", toTimestamp(record.scrapedAt()))
            .addValue("contentHash", record.contentHash());
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO job_records (
                        crawl_run_id,
                        source_url,
                        title,
                        company,
                        location,
                        compensation,
                        employment_type,
                        posted_at,
                        category,
                        description_text,
                        description_html,
                        listing_url,
                        page_number,
                        extraction_tier,
                        scraped_at,
                        content_hash
                    )
                    VALUES (
                        :crawlRunId,
                        :sourceUrl,
                        :title,
                        :company,
                        :location,
                        :compensation,
                        :employmentType,
                        :postedAt,
                        :category,
                        :descriptionText,
                        :descriptionHtml,
                        :listingUrl,
                        :pageNumber,
                        :extractionTier,
                        :scrapedAt,
                        :contentHash
                    )
                    ON CONFLICT (crawl_run_id, source_url)
                    DO UPDATE SET
                        title = EXCLUDED.title,
                        company = EXCLUDED.company,
                        location = EXCLUDED.location,
                        compensation = EXCLUDED.compensation,
                        employment_type = EXCLUDED.employment_type,
                        posted_at = EXCLUDED.posted_at,
                        category = EXCLUDED.category,
                        description_text = EXCLUDED.description_text,
                        description_html = EXCLUDED.description_html,
                        listing_url = EXCLUDED.listing_url,
                        page_number = EXCLUDED.page_number,
                        extraction_tier = EXCLUDED.extraction_tier,
                        scraped_at = EXCLUDED.scraped_at,
                        content_hash = EXCLUDED.content_hash
                    """,
                params
            );
            return;
        }

        jdbc.update(
            """
                MERGE INTO job_records (
                    crawl_run_id,
                    source_url,
                    title,
                    company,
                    location,
                    compensation,
                    employment_type,
                    posted_at,
                    category,
                    description_text,
                    description_html,
                    listing_url,
                    page_number,
                    extraction_tier,
                    scraped_at,
                    content_hash
                )
                KEY(crawl_run_id, source_url)
                VALUES (
                    :crawlRunId,
                    :sourceUrl,
                    :title,
                    :company,
                    :location,
                    :compensation,
                    :employmentType,
                    :postedAt,
                    :category,
                    :descriptionText,
                    :descriptionHtml,
                    :listingUrl,
                    :pageNumber,
                    :extractionTier,
                    :scrapedAt,
                    :contentHash
                )
                """,
            params
        );
    }

    public void insertFailedTask(long crawlRunId, FailedTask failedTask) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("crawlRunId", crawlRunId)
            .addValue("url", truncate(failedTask.url(), MAX_URL_CHARS))
            .addValue("taskKind", failedTask.kind().name())
            .addValue("attempts", failedTask.attempts())
            .addValue(
                "lastClassification",
                failedTask.lastClassification() == null ? null : failedTask.lastClassification().name()
            )
            .addValue("lastStatusCode", failedTask.lastStatusCode())
            .addValue("reasonCode", failedTask.reasonCode())
            .addValue("detail", truncate(failedTask.detail(), MAX_DETAIL_CHARS))
            .addValue("failedAt", toTimestamp(failedTask.failedAt()));
        jdbc.update(
            """
                INSERT INTO failed_tasks (
                    crawl_run_id,
                    url,
                    task_kind,
                    attempts,
                    last_classification,
                    last_status_code,
                    reason_code,
                    detail,
                    failed_at
                )
                VALUES (
                    :crawlRunId,
                    :url,
                    :taskKind,
                    :attempts,
                    :lastClassification,
                    :lastStatusCode,
                    :reasonCode,
                    :detail,
                    :failedAt
                )
                """,
            params
        );
    }

    public List<JobRecordView> findRecords(Long crawlRunId, int limit) {
        int safeLimit = limit <= 0 ? 50 : Math.min(limit, MAX_RECORD_PAGE);
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("crawlRunId", crawlRunId)
            .addValue("limit", safeLimit);
        String where = crawlRunId == null ? "" : "WHERE crawl_run_id = :crawlRunId";
        return jdbc.query(
            """
                SELECT id,
                       crawl_run_id,
                       source_url,
                       title,
                       company,
                       location,
                       compensation,
                       employment_type,
                       posted_at,
                       category,
                       description_text,
                       extraction_tier,
                       scraped_at,
                       content_hash
                FROM job_records
                %s
                ORDER BY id DESC
                LIMIT :limit
                """.formatted(where),
            params,
            (rs, rowNum) -> new JobRecordView(
                rs.getLong("id"),
                rs.getLong("crawl_run_id"),
                rs.getString("source_url"),
                rs.getString("title"),
                rs.getString("company"),
                rs.getString("location"),
                rs.getString("compensation"),
                rs.getString("employment_type"),
                rs.getString("posted_at"),
                rs.getString("category"),
                rs.getString("description_text"),
                rs.getString("extraction_tier"),
                toInstant(rs.getTimestamp("scraped_at")),
                rs.getString("content_hash")
            )
        );
    }

    public Map<String, Long> countFailedTasksByReason(long crawlRunId) {
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT reason_code, COUNT(*) AS cnt
                FROM failed_tasks
                WHERE crawl_run_id = :crawlRunId
                GROUP BY reason_code
                ORDER BY cnt DESC, reason_code
                """,
            new MapSqlParameterSource("crawlRunId", crawlRunId),
            rs -> {
                counts.put(rs.getString("reason_code"), rs.getLong("cnt"));
            }
        );
        return counts;
    }

    public CrawlRunStatusResponse findCrawlRun(long crawlRunId) {
        List<CrawlRunStatusResponse> runs = jdbc.query(
            """
                SELECT id, started_at, finished_at, status, notes,
                       items_saved, pages_visited, abandoned_tasks, extraction_failures
                FROM crawl_runs
                WHERE id = :crawlRunId
                """,
            new MapSqlParameterSource("crawlRunId", crawlRunId),
            crawlRunRowMapper()
        );
        return runs.isEmpty() ? null : runs.get(0);
    }

    public CrawlRunStatusResponse findMostRecentCrawlRun() {
        List<CrawlRunStatusResponse> runs = jdbc.query(
            """
                SELECT id, started_at, finished_at, status, notes,
                       items_saved, pages_visited, abandoned_tasks, extraction_failures
                FROM crawl_runs
                ORDER BY started_at DESC, id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource(),
            crawlRunRowMapper()
        );
        return runs.isEmpty() ? null : runs.get(0);
    }

    private RowMapper<CrawlRunStatusResponse> crawlRunRowMapper() {
        return (rs, rowNum) -> new CrawlRunStatusResponse(
            rs.getLong("id"),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("finished_at")),
            rs.getString("status"),
            rs.getString("notes"),
            rs.getInt("items_saved"),
            rs.getInt("pages_visited"),
            rs.getInt("abandoned_tasks"),
            rs.getInt("extraction_failures"),
            false
        );
    }

    private MapSqlParameterSource progressParams(long crawlRunId, CrawlRunProgress progress) {
        CrawlRunProgress safe = progress == null ? new CrawlRunProgress(0, 0, 0, 0, 0) : progress;
        return new MapSqlParameterSource()
            .addValue("crawlRunId", crawlRunId)
            .addValue("itemsSaved", safe.itemsSaved())
            .addValue("itemsPlanned", safe.itemsPlanned())
            .addValue("pagesVisited", safe.pagesVisited())
            .addValue("abandonedTasks", safe.abandonedTasks())
            .addValue("extractionFailures", safe.extractionFailures());
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private String truncate(String value, int maxChars) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() <= maxChars) {
            return trimmed;
        }
        int end = Character.isHighSurrogate(trimmed.charAt(maxChars - 1)) ? maxChars - 1 : maxChars;
        return trimmed.substring(0, end);
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to MERGE upserts", e);
            return false;
        }
    }
}
